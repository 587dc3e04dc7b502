package work.pollochang.photogrid.cache;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.photogrid.model.LayoutRow;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 排版結果的 LRU 快取。
 * <p>
 * 以存取順序的 {@link LinkedHashMap} 維護新舊，命中即移到最新，O(1)。
 * 超過 {@code maxCacheSize} 時從最舊的開始一次淘汰 {@code evictionBatchSize} 筆。
 * 所有操作都在同一個 monitor 下進行，同一個 key 不會有兩個寫入者同時更新淘汰紀錄。
 * <p>
 * 快取只依幾何參數分桶，不含圖片內容；圖片集合改變時 (切換目錄、分頁追加) 必須呼叫 {@link #clear()}。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class RowGeometryCache {

    private final int maxCacheSize;
    private final int evictionBatchSize;
    private final LinkedHashMap<RowCacheKey, RowCacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);

    private long hits;
    private long misses;
    private long evictions;

    public RowGeometryCache(int maxCacheSize) {
        this(maxCacheSize, 1);
    }

    public RowGeometryCache(int maxCacheSize, int evictionBatchSize) {
        if (maxCacheSize < 1 || evictionBatchSize < 1) {
            throw new IllegalArgumentException("maxCacheSize 與 evictionBatchSize 必須至少為 1");
        }
        this.maxCacheSize = maxCacheSize;
        this.evictionBatchSize = evictionBatchSize;
    }

    public static RowGeometryCache from(CacheParams params) {
        return new RowGeometryCache(params.rowCacheSize(), params.rowEvictionBatchSize());
    }

    public List<LayoutRow> getOrCompute(RowCacheKey key, Supplier<RowCacheEntry> compute) {
        return getOrCompute(key, rows -> true, compute);
    }

    /**
     * 取得快取結果，未命中 (或 {@code stillValid} 判定快取內容已不適用) 時計算並存入。
     *
     * @param key        量化後的 key
     * @param stillValid 檢查命中的內容是否仍適用目前的圖片
     * @param compute    未命中時的計算
     * @return 不可變的列清單
     */
    public synchronized List<LayoutRow> getOrCompute(RowCacheKey key, Predicate<List<LayoutRow>> stillValid,
                                                     Supplier<RowCacheEntry> compute) {
        RowCacheEntry cached = entries.get(key);
        if (cached != null && stillValid.test(cached.rows())) {
            hits++;
            return cached.rows();
        }

        misses++;
        RowCacheEntry computed = compute.get();
        entries.put(key, computed);
        evictIfNeeded();
        return computed.rows();
    }

    public synchronized Optional<RowCacheEntry> get(RowCacheKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public synchronized void clear() {
        if (!entries.isEmpty()) {
            log.debug("清除列快取，共 {} 筆", entries.size());
        }
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized RowCacheStats stats() {
        return new RowCacheStats(hits, misses, evictions, entries.size());
    }

    private void evictIfNeeded() {
        if (entries.size() <= maxCacheSize) {
            return;
        }
        // 最新放入的一筆在尾端，不會被淘汰
        int toRemove = Math.min(entries.size() - 1, entries.size() - maxCacheSize + evictionBatchSize - 1);
        Iterator<Map.Entry<RowCacheKey, RowCacheEntry>> iterator = entries.entrySet().iterator();
        for (int i = 0; i < toRemove && iterator.hasNext(); i++) {
            iterator.next();
            iterator.remove();
        }
        evictions += toRemove;
        log.debug("列快取超過上限 {}，淘汰 {} 筆", maxCacheSize, toRemove);
    }
}
