package pixel.tracking.app.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdentifierGeneratorTest {

    @Mock
    private EntropySource failingSource;

    @Mock
    private EntropySource fallbackSource;

    private IdentifierGenerator identifierGenerator;

    @BeforeEach
    void setUp() throws Exception {
        identifierGenerator = new IdentifierGenerator(new SecureRandomEntropySource("DRBG"));
    }

    @Test
    void generate_TenThousandCalls_ShouldBePairwiseDistinct() {
        // When
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            ids.add(identifierGenerator.generate());
        }

        // Then
        assertEquals(10_000, ids.size());
    }

    @Test
    void generate_ShouldBePrefixedUrlSafeToken() {
        // When
        String id = identifierGenerator.generate();

        // Then
        assertTrue(id.startsWith(IdentifierGenerator.PREFIX));
        String token = id.substring(IdentifierGenerator.PREFIX.length());
        assertEquals(22, token.length()); // 128 bits, unpadded base64
        assertTrue(token.matches("[A-Za-z0-9_-]+"));
        assertFalse(identifierGenerator.isDegraded());
    }

    @Test
    void generate_FromManyThreads_ShouldStayDistinct() throws Exception {
        // Given
        int threads = 8;
        int perThread = 2_000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Set<String> ids = ConcurrentHashMap.newKeySet();
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int t = 0; t < threads; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    ids.add(identifierGenerator.generate());
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertEquals(threads * perThread, ids.size());
    }

    @Test
    void generate_WhenEntropySourceFails_ShouldUseFallback() {
        // Given
        when(failingSource.describe()).thenReturn("broken");
        when(fallbackSource.describe()).thenReturn("fallback");
        doThrow(new IllegalStateException("no entropy")).when(failingSource).nextBytes(any());
        IdentifierGenerator generator = new IdentifierGenerator(failingSource, fallbackSource);

        // When
        String id = generator.generate();

        // Then
        assertTrue(id.startsWith(IdentifierGenerator.PREFIX));
        verify(fallbackSource).nextBytes(any());
    }

    @Test
    void isDegraded_WithTimestampSource_ShouldReportDegraded() {
        // When
        IdentifierGenerator generator = new IdentifierGenerator(new TimestampEntropySource());

        // Then
        assertTrue(generator.isDegraded());
        assertNotEquals(generator.generate(), generator.generate());
    }
}
