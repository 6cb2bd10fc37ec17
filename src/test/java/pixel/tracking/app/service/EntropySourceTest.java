package pixel.tracking.app.service;

import pixel.tracking.app.config.EntropyConfig;
import org.junit.jupiter.api.Test;

import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class EntropySourceTest {

    private final EntropyConfig entropyConfig = new EntropyConfig();

    @Test
    void entropySource_WithAvailableAlgorithm_ShouldBeStrong() {
        // When
        EntropySource source = entropyConfig.entropySource("DRBG");

        // Then
        assertInstanceOf(SecureRandomEntropySource.class, source);
        assertFalse(source.isDegraded());
    }

    @Test
    void entropySource_WithUnavailableAlgorithm_ShouldFallBackToDegraded() {
        // When
        EntropySource source = entropyConfig.entropySource("NO-SUCH-ALGORITHM");

        // Then
        assertInstanceOf(TimestampEntropySource.class, source);
        assertTrue(source.isDegraded());
        assertTrue(source.describe().contains("degraded"));
    }

    @Test
    void secureRandomEntropySource_WithUnavailableAlgorithm_ShouldThrow() {
        assertThrows(NoSuchAlgorithmException.class, () -> new SecureRandomEntropySource("NO-SUCH-ALGORITHM"));
    }

    @Test
    void timestampEntropySource_ShouldFillOddLengths() {
        // Given
        TimestampEntropySource source = new TimestampEntropySource();
        byte[] first = new byte[19];
        byte[] second = new byte[19];

        // When
        source.nextBytes(first);
        source.nextBytes(second);

        // Then
        assertFalse(Arrays.equals(first, second));
    }
}
