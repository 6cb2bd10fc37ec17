package pixel.tracking.app.config;

import lombok.extern.slf4j.Slf4j;
import pixel.tracking.app.service.EntropySource;
import pixel.tracking.app.service.SecureRandomEntropySource;
import pixel.tracking.app.service.TimestampEntropySource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.NoSuchAlgorithmException;

/**
 * Picks the entropy source for tracking identifiers.
 * Falls back to the timestamp source when the configured SecureRandom algorithm is unavailable.
 */
@Slf4j
@Configuration
public class EntropyConfig {

    @Bean
    public EntropySource entropySource(@Value("${tracking.id.entropy-algorithm:DRBG}") String algorithm) {
        try {
            return new SecureRandomEntropySource(algorithm);
        } catch (NoSuchAlgorithmException e) {
            log.warn("SecureRandom algorithm {} unavailable, falling back to DEGRADED timestamp entropy: {}",
                    algorithm, e.getMessage());
            return new TimestampEntropySource();
        }
    }
}
