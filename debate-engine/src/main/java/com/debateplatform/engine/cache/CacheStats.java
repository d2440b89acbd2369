package com.debateplatform.engine.cache;

/** Point-in-time counters of {@link DebateResultCache}. */
public record CacheStats(long hits, long misses, long evictions, long invalidations, int size) {

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
