package com.doctrace.core.cache;

/**
 * Snapshot of cache size and hit counters.
 *
 * @param entries number of stored analyses
 * @param trackedFiles number of file fingerprints
 * @param hits lookups answered from the cache since it was opened
 * @param misses lookups that required analysis since it was opened
 */
public record CacheStats(int entries, int trackedFiles, long hits, long misses) {

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
