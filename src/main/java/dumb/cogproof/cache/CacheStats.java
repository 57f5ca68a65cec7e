package dumb.cogproof.cache;

/**
 * Counters of a {@link ProofCache}.
 *
 * @param coalesced callers that waited on another caller's in-flight computation instead of computing
 */
public record CacheStats(long hits, long misses, long evictions, long coalesced, int size) {

    public double hitRate() {
        var total = hits + misses + coalesced;
        return total == 0 ? 0 : (double) hits / total;
    }
}
