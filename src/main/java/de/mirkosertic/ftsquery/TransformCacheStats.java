package de.mirkosertic.ftsquery;

import java.util.Locale;
import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe counters for {@link CachingFtsQuery}.
 *
 * <p>Counters only grow; invalidating the cache resets the size but keeps the history.
 * Use {@link #snapshot()} to read all values together for reporting.</p>
 */
public class TransformCacheStats {

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private volatile long currentSize;

    /**
     * Point-in-time copy of the counters.
     *
     * @param hits      phrases answered from the cache
     * @param misses    phrases passed to the delegate transformer
     * @param evictions entries dropped because the cache was full
     * @param size      estimated number of cached phrases
     */
    public record Snapshot(long hits, long misses, long evictions, long size) {

        public long totalRequests() {
            return hits + misses;
        }

        /**
         * Hit rate as a percentage (0-100), 0.0 before the first request.
         */
        public double hitRate() {
            final long total = totalRequests();
            return total == 0 ? 0.0 : hits * 100.0 / total;
        }
    }

    void recordHit() {
        hits.increment();
    }

    void recordMiss() {
        misses.increment();
    }

    void recordEviction() {
        evictions.increment();
    }

    void setCurrentSize(final long size) {
        currentSize = size;
    }

    public Snapshot snapshot() {
        return new Snapshot(hits.sum(), misses.sum(), evictions.sum(), currentSize);
    }

    public long getTotalRequests() {
        return snapshot().totalRequests();
    }

    public long getCacheHits() {
        return hits.sum();
    }

    public long getCacheMisses() {
        return misses.sum();
    }

    public long getEvictions() {
        return evictions.sum();
    }

    public long getCurrentSize() {
        return currentSize;
    }

    public double getHitRate() {
        return snapshot().hitRate();
    }

    /**
     * One-line summary suitable for logging.
     */
    public String getMetrics() {
        final Snapshot s = snapshot();
        return String.format(Locale.ROOT,
                "TransformCacheStats[total=%d, hits=%d, misses=%d, hitRate=%.1f%%, size=%d, evictions=%d]",
                s.totalRequests(), s.hits(), s.misses(), s.hitRate(), s.size(), s.evictions());
    }

    @Override
    public String toString() {
        return getMetrics();
    }
}
