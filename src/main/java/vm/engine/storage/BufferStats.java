package vm.engine.storage;

/**
 * Snapshot of page buffer counters.
 * hits: lookups served without I/O; misses: pages loaded from the store;
 * evictions: valid pages replaced; writeBacks: dirty pages written to the store (eviction or flush).
 */
public record BufferStats(long hits, long misses, long evictions, long writeBacks) {
    @Override
    public String toString() {
        return "hits=" + hits + ", misses=" + misses + ", evictions=" + evictions + ", writeBacks=" + writeBacks;
    }
}
