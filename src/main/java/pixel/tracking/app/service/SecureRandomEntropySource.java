package pixel.tracking.app.service;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

/**
 * Cryptographically strong entropy. Each thread gets its own {@link SecureRandom}
 * instance so concurrent callers never wait on a shared generator.
 */
public class SecureRandomEntropySource implements EntropySource {
    private final String algorithm;
    private final ThreadLocal<SecureRandom> random;

    /**
     * @throws NoSuchAlgorithmException if the platform has no provider for the algorithm
     */
    public SecureRandomEntropySource(String algorithm) throws NoSuchAlgorithmException {
        this.algorithm = algorithm;
        // Probe once so an unavailable algorithm fails here rather than on first use
        SecureRandom.getInstance(algorithm);
        this.random = ThreadLocal.withInitial(this::newInstance);
    }

    private SecureRandom newInstance() {
        try {
            return SecureRandom.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SecureRandom algorithm disappeared: " + algorithm, e);
        }
    }

    @Override
    public void nextBytes(byte[] bytes) {
        random.get().nextBytes(bytes);
    }

    @Override
    public boolean isDegraded() {
        return false;
    }

    @Override
    public String describe() {
        return "SecureRandom(" + algorithm + ")";
    }
}
