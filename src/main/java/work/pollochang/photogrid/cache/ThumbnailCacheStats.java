package work.pollochang.photogrid.cache;

/**
 * 縮圖快取統計。
 * @param hits 命中次數
 * @param misses 未命中並送出解碼的次數
 * @param coalesced 併入進行中解碼的次數
 * @param failures 解碼失敗次數
 * @param evictions 淘汰筆數
 * @param residentCount 目前常駐筆數
 * @param residentBytes 目前常駐大小 (bytes)
 */
public record ThumbnailCacheStats(long hits, long misses, long coalesced, long failures, long evictions,
                                  int residentCount, long residentBytes) {}
