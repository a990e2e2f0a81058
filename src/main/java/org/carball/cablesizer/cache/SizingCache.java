package org.carball.cablesizer.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.carball.cablesizer.config.SizingThresholds;
import org.carball.cablesizer.model.sizing.CableSizingInput;
import org.carball.cablesizer.model.sizing.CableSizingResult;

import java.time.Duration;
import java.util.function.Function;

/**
 * Memoizes sizing results keyed by the complete input value. Lookup failures
 * are not cached and propagate to the caller.
 */
@Slf4j
public class SizingCache {

    private final Cache<CableSizingInput, CableSizingResult> cache;

    public SizingCache(long maximumSize, Duration expireAfterWrite) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(expireAfterWrite)
                .recordStats()
                .build();
        log.debug("Sizing cache created: max {} entries, expire after {}", maximumSize, expireAfterWrite);
    }

    public static SizingCache from(SizingThresholds thresholds) {
        return new SizingCache(Math.max(0, thresholds.getCacheMaximumSize()),
                Duration.ofMinutes(Math.max(1, thresholds.getCacheExpireMinutes())));
    }

    public CableSizingResult get(CableSizingInput input, Function<CableSizingInput, CableSizingResult> compute) {
        return cache.get(input, compute);
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public String getStatsSummary() {
        CacheStats stats = cache.stats();
        return String.format("Cache: %d hits, %d misses, hit rate %.0f%%",
                stats.hitCount(), stats.missCount(), stats.hitRate() * 100);
    }
}
