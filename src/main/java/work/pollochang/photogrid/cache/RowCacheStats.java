package work.pollochang.photogrid.cache;

public record RowCacheStats(long hits, long misses, long evictions, int size) {}
