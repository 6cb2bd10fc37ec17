package pixel.tracking.app.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Base64;

/**
 * Issues opaque tracking identifiers: a fixed prefix followed by 128 random bits in
 * unpadded URL-safe Base64. Nothing about the send is encoded in the identifier.
 */
@Slf4j
@Service
public class IdentifierGenerator {
    public static final String PREFIX = "pixel_";
    private static final int RANDOM_BYTES = 16;
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final EntropySource entropySource;
    private final EntropySource fallbackSource;

    @Autowired
    public IdentifierGenerator(EntropySource entropySource) {
        this(entropySource, new TimestampEntropySource());
    }

    IdentifierGenerator(EntropySource entropySource, EntropySource fallbackSource) {
        this.entropySource = entropySource;
        this.fallbackSource = fallbackSource;
        if (entropySource.isDegraded()) {
            log.warn("Tracking identifiers use DEGRADED entropy from {}; identifiers may be guessable",
                    entropySource.describe());
        } else {
            log.info("Tracking identifiers use {}", entropySource.describe());
        }
    }

    public String generate() {
        byte[] bytes = new byte[RANDOM_BYTES];
        try {
            entropySource.nextBytes(bytes);
        } catch (RuntimeException e) {
            log.warn("Entropy source {} failed, issuing identifier with DEGRADED entropy from {}: {}",
                    entropySource.describe(), fallbackSource.describe(), e.getMessage());
            fallbackSource.nextBytes(bytes);
        }
        return PREFIX + ENCODER.encodeToString(bytes);
    }

    public boolean isDegraded() {
        return entropySource.isDegraded();
    }
}
