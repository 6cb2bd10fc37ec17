package pixel.tracking.app.service;

import java.nio.ByteBuffer;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Degraded fallback: high-resolution time mixed with a non-cryptographic generator.
 * Identifiers stay unique in practice but are guessable by a determined attacker.
 */
public class TimestampEntropySource implements EntropySource {

    @Override
    public void nextBytes(byte[] bytes) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        boolean first = true;
        while (buffer.remaining() >= Long.BYTES) {
            long value = random.nextLong();
            if (first) {
                value ^= System.nanoTime();
                first = false;
            }
            buffer.putLong(value);
        }
        while (buffer.hasRemaining()) {
            buffer.put((byte) random.nextInt());
        }
    }

    @Override
    public boolean isDegraded() {
        return true;
    }

    @Override
    public String describe() {
        return "nanoTime+ThreadLocalRandom (degraded)";
    }
}
