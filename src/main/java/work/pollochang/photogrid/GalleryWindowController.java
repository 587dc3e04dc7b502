package work.pollochang.photogrid;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.photogrid.cache.RowGeometryCache;
import work.pollochang.photogrid.cache.ThumbnailCache;
import work.pollochang.photogrid.core.LayoutPolicy;
import work.pollochang.photogrid.core.RowLayoutSolver;
import work.pollochang.photogrid.model.ImageRecord;
import work.pollochang.photogrid.model.ImageSize;
import work.pollochang.photogrid.model.LayoutRow;
import work.pollochang.photogrid.model.ThumbnailSize;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;

/**
 * 管理目前已載入的圖片 (分頁)、視窗寬度與兩個快取，決定何時重新排版與清除快取。
 *
 * <p>本類別不是執行緒安全的，應只在單一 (UI) 執行緒上使用；縮圖回呼會回到縮圖快取指定的 executor。
 *
 * <p>快取清除時機：
 * <ul>
 *   <li>{@link #load(List)} 換一批圖片：清除列快取與縮圖快取。</li>
 *   <li>{@link #loadMore()} / {@link #loadAll()} 追加圖片：清除列快取，縮圖保留。</li>
 *   <li>{@link #setPolicy(LayoutPolicy)} 切換策略：下次 {@link #layout(double)} 重新計算。</li>
 * </ul>
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class GalleryWindowController {

    private final RowLayoutSolver solver;
    private final ThumbnailCache thumbnailCache;
    private final PagingParams paging;

    @Getter
    private LayoutPolicy policy;

    private List<ImageRecord> allImages = List.of();
    private final List<ImageRecord> materialized = new ArrayList<>();

    private List<LayoutRow> lastRows = List.of();
    private double lastViewportWidth = Double.NaN;
    private boolean layoutStale = true;

    public GalleryWindowController(RowGeometryCache rowCache, ThumbnailCache thumbnailCache, LayoutPolicy policy,
                                   PagingParams paging) {
        this.solver = new RowLayoutSolver(Objects.requireNonNull(rowCache, "rowCache must not be null"));
        this.thumbnailCache = Objects.requireNonNull(thumbnailCache, "thumbnailCache must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.paging = Objects.requireNonNull(paging, "paging must not be null");
    }

    /**
     * 換一批圖片 (例如切換目錄)，只載入第一頁。
     */
    public void load(List<ImageRecord> images) {
        Objects.requireNonNull(images, "images must not be null");
        allImages = List.copyOf(images);
        materialized.clear();

        int initialCount = Math.min(allImages.size(), paging.effectiveInitialLoadCount(thumbnailCache.maxCacheSize()));
        materialized.addAll(allImages.subList(0, initialCount));

        solver.clearCache();
        thumbnailCache.clear();
        invalidateLayout();
        log.info("載入 {} 張圖片，先顯示 {} 張", allImages.size(), initialCount);
    }

    /**
     * 追加下一頁。
     * @return 追加的張數，沒有更多圖片時為 0
     */
    public int loadMore() {
        int start = materialized.size();
        int end = Math.min(start + paging.pageSize(), allImages.size());
        if (start >= end) {
            return 0;
        }
        appendUpTo(end);
        log.info("載入更多圖片: 從 {} 到 {}, 總共 {} 張圖片", start, end - 1, materialized.size());
        return end - start;
    }

    /**
     * 一次載入全部剩餘圖片。
     */
    public void loadAll() {
        if (materialized.size() < allImages.size()) {
            int before = materialized.size();
            appendUpTo(allImages.size());
            log.info("載入完整內容: {} -> {}", before, materialized.size());
        }
    }

    public boolean canLoadMore() {
        return materialized.size() < allImages.size();
    }

    public int totalImages() {
        return allImages.size();
    }

    public List<ImageRecord> images() {
        return Collections.unmodifiableList(new ArrayList<>(materialized));
    }

    public void setPolicy(LayoutPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        invalidateLayout();
        log.info("切換排版策略: {}", policy.kind());
    }

    public double effectiveWidth(double viewportWidth) {
        return viewportWidth - paging.horizontalPadding() * 2;
    }

    /**
     * 依視窗寬度排版。寬度變化不超過門檻、且圖片與策略都沒變時，直接沿用上次結果。
     *
     * @param viewportWidth 視窗寬度 (含左右留白)
     * @return 不可變的列清單
     */
    public List<LayoutRow> layout(double viewportWidth) {
        if (!layoutStale && Math.abs(viewportWidth - lastViewportWidth) <= paging.resizeThreshold()) {
            return lastRows;
        }
        lastRows = solver.solve(materialized, effectiveWidth(viewportWidth), policy);
        lastViewportWidth = viewportWidth;
        layoutStale = false;
        return lastRows;
    }

    /**
     * 計算與可視區域 (往下延伸到可視高度的預載倍數) 相交的列所包含的圖片索引。
     *
     * @param rows           排版結果
     * @param scrollOffset   目前捲動位置 (列表頂端為 0)
     * @param viewportHeight 可視高度
     * @return 圖片索引範圍
     */
    public VisibleRange visibleRange(List<LayoutRow> rows, double scrollOffset, double viewportHeight) {
        double windowTop = Math.max(0, scrollOffset);
        double windowBottom = windowTop + viewportHeight * paging.preloadThresholdMultiplier();
        double rowSpacing = Math.max(0, policy.spacing());

        int start = -1;
        int end = 0;
        int imageIndex = 0;
        double rowTop = 0;
        for (LayoutRow row : rows) {
            double rowBottom = rowTop + row.height();
            if (rowTop >= windowBottom) {
                break;
            }
            if (rowBottom > windowTop) {
                if (start < 0) {
                    start = imageIndex;
                }
                end = imageIndex + row.imageCount();
            }
            imageIndex += row.imageCount();
            rowTop = rowBottom + rowSpacing;
        }
        return start < 0 ? VisibleRange.EMPTY : new VisibleRange(start, end);
    }

    /**
     * 為可視範圍內的圖片要求縮圖，尺寸取排版結果。
     * @return 每張圖片一個 future，順序與圖片相同
     */
    public List<CompletableFuture<Optional<BufferedImage>>> prefetchVisibleThumbnails(List<LayoutRow> rows, double scrollOffset,
                                                                                     double viewportHeight) {
        List<CompletableFuture<Optional<BufferedImage>>> futures = new ArrayList<>();
        forEachVisible(rows, scrollOffset, viewportHeight,
                (image, size) -> futures.add(thumbnailCache.loadOrDecode(image, size)));
        return futures;
    }

    /**
     * 回呼版本，回呼可能與請求順序不同。
     * @return 送出的請求數
     */
    public int requestVisibleThumbnails(List<LayoutRow> rows, double scrollOffset, double viewportHeight,
                                        BiConsumer<ImageRecord, BufferedImage> onReady) {
        Objects.requireNonNull(onReady, "onReady must not be null");
        int[] requested = {0};
        forEachVisible(rows, scrollOffset, viewportHeight, (image, size) -> {
            thumbnailCache.loadOrDecode(image, size, bitmap -> onReady.accept(image, bitmap));
            requested[0]++;
        });
        return requested[0];
    }

    private void forEachVisible(List<LayoutRow> rows, double scrollOffset, double viewportHeight,
                                BiConsumer<ImageRecord, ThumbnailSize> action) {
        VisibleRange range = visibleRange(rows, scrollOffset, viewportHeight);
        int imageIndex = 0;
        for (LayoutRow row : rows) {
            if (imageIndex >= range.end()) {
                break;
            }
            for (int i = 0; i < row.imageCount(); i++, imageIndex++) {
                if (range.contains(imageIndex)) {
                    ImageSize size = row.imageSizes().get(i);
                    action.accept(row.images().get(i), ThumbnailSize.of(size));
                }
            }
        }
    }

    private void appendUpTo(int end) {
        materialized.addAll(allImages.subList(materialized.size(), end));
        solver.clearCache();
        invalidateLayout();
    }

    private void invalidateLayout() {
        layoutStale = true;
        lastRows = List.of();
    }
}
