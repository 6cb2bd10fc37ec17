package pixel.tracking.app.service;

/**
 * Source of random bytes for tracking identifiers.
 * Implementations are shared by all request threads and must not serialize them.
 */
public interface EntropySource {
    void nextBytes(byte[] bytes);

    /**
     * True when the bytes are not cryptographically strong.
     */
    boolean isDegraded();

    String describe();
}
