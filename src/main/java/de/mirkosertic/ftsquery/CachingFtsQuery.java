package de.mirkosertic.ftsquery;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * Caching wrapper around a {@link ConditionTransformer}.
 *
 * <p>Search boxes see the same phrases over and over (paging through results,
 * refreshing, popular searches). The cache maps the raw phrase to the transformed
 * condition so repeated phrases skip parsing entirely.</p>
 *
 * <p>Cache characteristics:</p>
 * <ul>
 *   <li>Bounded by a maximum number of entries, evicting least recently used phrases</li>
 *   <li>Thread-safe</li>
 *   <li>Keys are case-sensitive: {@code "abc"} and {@code "ABC"} are cached separately</li>
 *   <li>Tracks hits, misses, and evictions via {@link TransformCacheStats}</li>
 * </ul>
 *
 * <p>Cached conditions depend on the delegate's stop words. After changing the stop
 * words of an {@link FtsQuery} delegate, call {@link #invalidateAll()}.</p>
 */
public class CachingFtsQuery implements ConditionTransformer {

    public static final long DEFAULT_MAXIMUM_SIZE = 10_000;

    private final ConditionTransformer delegate;
    private final Cache<String, String> cache;
    private final TransformCacheStats stats;

    public CachingFtsQuery(final ConditionTransformer delegate) {
        this(delegate, DEFAULT_MAXIMUM_SIZE);
    }

    /**
     * Creates a new caching transformer.
     *
     * @param delegate    the transformer used on cache misses
     * @param maximumSize the maximum number of cached phrases, must be positive
     */
    public CachingFtsQuery(final ConditionTransformer delegate, final long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive, got " + maximumSize);
        }
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        final TransformCacheStats cacheStats = new TransformCacheStats();
        this.stats = cacheStats;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .evictionListener((String key, String value, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        cacheStats.recordEviction();
                    }
                })
                .build();
    }

    /**
     * Transforms the phrase, serving repeated phrases from the cache.
     * A {@code null} phrase is passed to the delegate without caching.
     */
    @Override
    public String transform(@Nullable final String query) {
        if (query == null) {
            return delegate.transform(null);
        }

        final String cached = cache.getIfPresent(query);
        if (cached != null) {
            stats.recordHit();
            return cached;
        }

        final String condition = delegate.transform(query);
        cache.put(query, condition);
        stats.recordMiss();
        stats.setCurrentSize(cache.estimatedSize());
        return condition;
    }

    /**
     * Discards all cached conditions.
     */
    public void invalidateAll() {
        cache.invalidateAll();
        stats.setCurrentSize(cache.estimatedSize());
    }

    public ConditionTransformer getDelegate() {
        return delegate;
    }

    /**
     * Returns the cache statistics for monitoring and metrics.
     */
    public TransformCacheStats getStats() {
        return stats;
    }
}
