package work.pollochang.photogrid.cache;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.photogrid.decode.ThumbnailDecoder;
import work.pollochang.photogrid.model.ImageRecord;
import work.pollochang.photogrid.model.ThumbnailSize;
import work.pollochang.photogrid.tools.FileTools;
import work.pollochang.photogrid.tools.ImageTools;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 縮圖快取，同時受筆數與記憶體大小限制，超過時淘汰最久未使用的縮圖。
 *
 * <p>每個 key 的狀態：
 * <ul>
 *   <li>不存在 -&gt; 解碼中：{@link #loadOrDecode} 未命中時送到解碼執行緒池。</li>
 *   <li>解碼中 -&gt; 存在：解碼成功後放入快取；同一個 key 的後續請求共用同一個進行中的 future。</li>
 *   <li>存在 -&gt; 不存在：只會因淘汰或 {@link #clear()} 發生。</li>
 * </ul>
 * 解碼失敗不會留下任何紀錄，下次請求會重新解碼。
 *
 * <p>快取中的 {@link BufferedImage} 與所有呼叫端共用同一個實例，只能讀取不可修改。
 * 淘汰或清除後快取不再持有它，已取得的參考仍可繼續使用。
 * 每個呼叫端拿到的 future 都是各自的複本，取消或提前完成它不影響解碼本身與其他呼叫端。
 *
 * <p>所有對內部 map 的修改都在同一個 monitor 下進行；回呼在建構時指定的 {@code completionExecutor} 上執行。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class ThumbnailCache implements AutoCloseable {

    private final int maxCacheSize;
    private final long maxMemoryUsage;
    private final ThumbnailDecoder decoder;
    private final ExecutorService decodeExecutor;
    private final boolean ownsDecodeExecutor;
    private final Executor completionExecutor;

    private final LinkedHashMap<ThumbnailKey, CachedThumbnail> entries = new LinkedHashMap<>(64, 0.75f, true);
    private final Map<ThumbnailKey, CompletableFuture<Optional<BufferedImage>>> pending = new HashMap<>();

    private long residentBytes;
    // clear() 時遞增，清除前送出的解碼結果不再放入快取
    private long generation;

    private long hits;
    private long misses;
    private long coalesced;
    private long failures;
    private long evictions;

    private record CachedThumbnail(BufferedImage image, long byteCost) {}

    /**
     * 建立快取，並以 CPU 核心數建立專用的解碼執行緒池，{@link #close()} 時關閉。
     */
    public ThumbnailCache(CacheParams params, ThumbnailDecoder decoder, Executor completionExecutor) {
        this(params, decoder, newDecodeExecutor(), true, completionExecutor);
    }

    /**
     * 使用外部提供的解碼執行緒池，{@link #close()} 時不會關閉它。
     */
    public ThumbnailCache(CacheParams params, ThumbnailDecoder decoder, ExecutorService decodeExecutor,
                          Executor completionExecutor) {
        this(params, decoder, decodeExecutor, false, completionExecutor);
    }

    private ThumbnailCache(CacheParams params, ThumbnailDecoder decoder, ExecutorService decodeExecutor,
                           boolean ownsDecodeExecutor, Executor completionExecutor) {
        Objects.requireNonNull(params, "params must not be null");
        this.maxCacheSize = params.thumbnailCacheSize();
        this.maxMemoryUsage = params.maxMemoryUsage();
        this.decoder = Objects.requireNonNull(decoder, "decoder must not be null");
        this.decodeExecutor = Objects.requireNonNull(decodeExecutor, "decodeExecutor must not be null");
        this.ownsDecodeExecutor = ownsDecodeExecutor;
        this.completionExecutor = Objects.requireNonNull(completionExecutor, "completionExecutor must not be null");
    }

    private static ExecutorService newDecodeExecutor() {
        int coreCount = Math.max(1, Runtime.getRuntime().availableProcessors());
        log.info("偵測到 {} 個 CPU 核心，建立固定大小為 {} 的縮圖解碼執行緒池。", coreCount, coreCount);
        return Executors.newFixedThreadPool(coreCount, runnable -> {
            Thread thread = new Thread(runnable, "thumbnail-decoder");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 同步查詢，不做任何 I/O。命中時會更新為最近使用。
     * 回傳的縮圖與快取共用，呼叫端不可修改其像素。
     */
    public synchronized Optional<BufferedImage> get(ThumbnailKey key) {
        CachedThumbnail cached = entries.get(key);
        return cached == null ? Optional.empty() : Optional.of(cached.image());
    }

    /**
     * 放入縮圖，並從最舊的開始淘汰，直到筆數與記憶體都不超過上限。
     *
     * @return 單張大小已超過記憶體上限而未放入時回傳 {@code false}
     */
    public synchronized boolean put(ThumbnailKey key, BufferedImage image) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(image, "image must not be null");

        long byteCost = ImageTools.estimateByteCost(image);
        if (byteCost > maxMemoryUsage) {
            log.debug("{} - 縮圖大小 {} 超過記憶體上限 {}，不放入快取", key.imageId(),
                    FileTools.formatFileSize(byteCost), FileTools.formatFileSize(maxMemoryUsage));
            return false;
        }

        CachedThumbnail previous = entries.put(key, new CachedThumbnail(image, byteCost));
        if (previous != null) {
            residentBytes -= previous.byteCost();
        }
        residentBytes += byteCost;
        evictIfNeeded();
        return true;
    }

    /**
     * 取得縮圖，未命中時於背景解碼。
     * <p>
     * 解碼失敗時以 {@link Optional#empty()} 完成，不會以例外完成。
     */
    public CompletableFuture<Optional<BufferedImage>> loadOrDecode(ImageRecord record, ThumbnailSize targetSize) {
        Objects.requireNonNull(record, "record must not be null");
        Objects.requireNonNull(targetSize, "targetSize must not be null");
        ThumbnailKey key = ThumbnailKey.of(record, targetSize);

        synchronized (this) {
            CachedThumbnail cached = entries.get(key);
            if (cached != null) {
                hits++;
                return CompletableFuture.completedFuture(Optional.of(cached.image()));
            }

            CompletableFuture<Optional<BufferedImage>> inFlight = pending.get(key);
            if (inFlight != null) {
                coalesced++;
                return inFlight.copy();
            }

            misses++;
            long startGeneration = generation;
            CompletableFuture<Optional<BufferedImage>> future;
            try {
                future = CompletableFuture
                        .supplyAsync(() -> decode(record, targetSize), decodeExecutor)
                        .handle((image, error) -> admit(key, record, image, error, startGeneration));
            } catch (RejectedExecutionException e) {
                log.warn("{} - 解碼執行緒池已關閉，無法產生縮圖", describe(record), e);
                failures++;
                return CompletableFuture.completedFuture(Optional.empty());
            }
            // 同步執行的 executor 會在這裡就已完成
            if (!future.isDone()) {
                pending.put(key, future);
            }
            return future.copy();
        }
    }

    /**
     * 回呼版本：{@code onReady} 恰好被呼叫一次，於 {@code completionExecutor} 上執行；解碼失敗時收到 {@code null}。
     * 回呼可能與請求順序不同，呼叫端應以圖片比對而非送出順序。
     */
    public void loadOrDecode(ImageRecord record, ThumbnailSize targetSize, Consumer<BufferedImage> onReady) {
        Objects.requireNonNull(onReady, "onReady must not be null");
        loadOrDecode(record, targetSize)
                .whenCompleteAsync((image, error) -> onReady.accept(error == null ? image.orElse(null) : null),
                        completionExecutor);
    }

    /**
     * 立即清除所有縮圖。清除前已送出的解碼完成後不會再放入快取。
     */
    public synchronized void clear() {
        log.debug("清除縮圖快取，共 {} 筆，{}", entries.size(), FileTools.formatFileSize(residentBytes));
        entries.clear();
        pending.clear();
        residentBytes = 0;
        generation++;
    }

    public synchronized int size() {
        return entries.size();
    }

    public int maxCacheSize() {
        return maxCacheSize;
    }

    public synchronized long residentBytes() {
        return residentBytes;
    }

    public synchronized ThumbnailCacheStats stats() {
        return new ThumbnailCacheStats(hits, misses, coalesced, failures, evictions, entries.size(), residentBytes);
    }

    private Optional<BufferedImage> decode(ImageRecord record, ThumbnailSize targetSize) {
        try {
            return Optional.ofNullable(decoder.decode(record, targetSize));
        } catch (IOException e) {
            log.warn("{} - 縮圖解碼失敗 (可能非支援格式或檔案損毀)", describe(record), e);
        } catch (OutOfMemoryError e) {
            log.error("{} - 縮圖解碼時發生記憶體溢位錯誤", describe(record), e);
        } catch (RuntimeException e) {
            log.error("{} - 縮圖解碼時發生未知錯誤", describe(record), e);
        }
        synchronized (this) {
            failures++;
        }
        return Optional.empty();
    }

    private synchronized Optional<BufferedImage> admit(ThumbnailKey key, ImageRecord record, Optional<BufferedImage> image,
                                                       Throwable error, long startGeneration) {
        Optional<BufferedImage> result = image;
        if (error != null) {
            log.error("{} - 縮圖解碼時發生嚴重錯誤", describe(record), error);
            failures++;
            result = Optional.empty();
        }
        if (startGeneration != generation) {
            log.debug("{} - 快取已於解碼期間清除，結果不放入快取", key.imageId());
            return result;
        }
        pending.remove(key);
        result.ifPresent(decoded -> put(key, decoded));
        return result;
    }

    private void evictIfNeeded() {
        Iterator<Map.Entry<ThumbnailKey, CachedThumbnail>> iterator = entries.entrySet().iterator();
        while ((entries.size() > maxCacheSize || residentBytes > maxMemoryUsage) && iterator.hasNext()) {
            CachedThumbnail eldest = iterator.next().getValue();
            iterator.remove();
            residentBytes -= eldest.byteCost();
            evictions++;
        }
    }

    private static String describe(ImageRecord record) {
        return record.source() != null ? record.source().toString() : record.id();
    }

    /**
     * 關閉自行建立的解碼執行緒池。
     */
    @Override
    public void close() {
        if (!ownsDecodeExecutor) {
            return;
        }
        decodeExecutor.shutdown();
        try {
            if (!decodeExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("縮圖解碼執行緒池等待逾時，強制關閉。");
                decodeExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("縮圖解碼執行緒池被中斷。", e);
            decodeExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
