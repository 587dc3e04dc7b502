package work.pollochang.photogrid.cache;

/**
 * 快取上限設定。
 * @param thumbnailCacheSize 縮圖最多保留幾筆
 * @param maxMemoryUsage 縮圖最多佔用多少記憶體 (bytes)
 * @param rowCacheSize 列快取最多保留幾筆
 * @param rowEvictionBatchSize 列快取超過上限時一次淘汰幾筆
 */
public record CacheParams(int thumbnailCacheSize, long maxMemoryUsage, int rowCacheSize, int rowEvictionBatchSize) {

    public static final CacheParams DEFAULTS = new CacheParams(2000, 512L * 1024 * 1024, 1000, 1);

    public CacheParams {
        if (thumbnailCacheSize < 1 || rowCacheSize < 1) {
            throw new IllegalArgumentException("快取筆數上限必須至少為 1");
        }
        if (maxMemoryUsage < 1) {
            throw new IllegalArgumentException("maxMemoryUsage 必須大於 0: " + maxMemoryUsage);
        }
        if (rowEvictionBatchSize < 1) {
            throw new IllegalArgumentException("rowEvictionBatchSize 必須至少為 1: " + rowEvictionBatchSize);
        }
    }
}
