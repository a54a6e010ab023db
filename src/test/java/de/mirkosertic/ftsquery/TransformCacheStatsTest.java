package de.mirkosertic.ftsquery;

import org.assertj.core.data.Offset;
import org.junit.jupiter.api.Test;

import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TransformCacheStatsTest {

    @Test
    void testCountersStartAtZero() {
        final TransformCacheStats stats = new TransformCacheStats();

        assertThat(stats.getTotalRequests()).isEqualTo(0);
        assertThat(stats.getCacheHits()).isEqualTo(0);
        assertThat(stats.getCacheMisses()).isEqualTo(0);
        assertThat(stats.getEvictions()).isEqualTo(0);
        assertThat(stats.getCurrentSize()).isEqualTo(0);
        assertThat(stats.getHitRate()).isEqualTo(0.0);
    }

    @Test
    void testHitsAndMissesAreCounted() {
        final TransformCacheStats stats = new TransformCacheStats();

        stats.recordMiss();
        stats.recordHit();
        stats.recordHit();
        stats.recordHit();

        assertThat(stats.getTotalRequests()).isEqualTo(4);
        assertThat(stats.getCacheHits()).isEqualTo(3);
        assertThat(stats.getCacheMisses()).isEqualTo(1);
        assertThat(stats.getHitRate()).isEqualTo(75.0);

        stats.recordEviction();
        stats.setCurrentSize(17);

        assertThat(stats.getEvictions()).isEqualTo(1);
        assertThat(stats.getCurrentSize()).isEqualTo(17);
    }

    @Test
    void testConcurrentRecording() throws InterruptedException {
        final TransformCacheStats stats = new TransformCacheStats();
        final int threadCount = 8;
        final int operationsPerThread = 500;
        final ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        final CountDownLatch latch = new CountDownLatch(threadCount);

        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    for (int j = 0; j < operationsPerThread; j++) {
                        if (j % 4 == 0) {
                            stats.recordMiss();
                        } else {
                            stats.recordHit();
                        }
                    }
                } finally {
                    latch.countDown();
                }
            });
        }

        assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        final long expectedTotal = (long) threadCount * operationsPerThread;
        assertThat(stats.getTotalRequests()).isEqualTo(expectedTotal);
        assertThat(stats.getCacheHits() + stats.getCacheMisses()).isEqualTo(expectedTotal);
        assertThat(stats.getHitRate()).isCloseTo(75.0, Offset.offset(0.1));
    }

    @Test
    void testMetricsStringFormat() {
        final TransformCacheStats stats = new TransformCacheStats();

        stats.recordHit();
        stats.recordMiss();
        stats.recordMiss();
        stats.setCurrentSize(2);

        final String metrics = stats.getMetrics();

        assertThat(metrics).startsWith("TransformCacheStats[");
        assertThat(metrics).contains("total=3");
        assertThat(metrics).contains("hits=1");
        assertThat(metrics).contains("misses=2");
        assertThat(metrics).contains("hitRate=33.3%");
        assertThat(metrics).contains("size=2");
        assertThat(metrics).contains("evictions=0");
        assertThat(stats.toString()).isEqualTo(metrics);
    }

    @Test
    void testSnapshotIsDetached() {
        final TransformCacheStats stats = new TransformCacheStats();
        stats.recordHit();
        stats.recordMiss();
        stats.setCurrentSize(1);

        final TransformCacheStats.Snapshot snapshot = stats.snapshot();
        stats.recordHit();

        assertThat(snapshot).isEqualTo(new TransformCacheStats.Snapshot(1, 1, 0, 1));
        assertThat(snapshot.totalRequests()).isEqualTo(2);
        assertThat(snapshot.hitRate()).isEqualTo(50.0);
        assertThat(stats.snapshot().hits()).isEqualTo(2);
    }

    @Test
    void testMetricsIgnoreDefaultLocale() {
        final Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            final TransformCacheStats stats = new TransformCacheStats();
            stats.recordHit();
            stats.recordMiss();

            assertThat(stats.getMetrics()).contains("hitRate=50.0%");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
