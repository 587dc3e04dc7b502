package work.pollochang.photogrid.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.photogrid.cache.RowCacheEntry;
import work.pollochang.photogrid.cache.RowCacheKey;
import work.pollochang.photogrid.cache.RowGeometryCache;
import work.pollochang.photogrid.model.ImageRecord;
import work.pollochang.photogrid.model.LayoutRow;
import work.pollochang.photogrid.model.RowFit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static work.pollochang.photogrid.tools.CacheTools.createRowKey;

/**
 * 將圖片依序分成多列。
 *
 * <p>本類別是純計算，不做 I/O，可在每次視窗縮放時重複呼叫。除了選用的 {@link RowGeometryCache} 之外沒有可變狀態，
 * 相同輸入必定得到相同輸出。
 *
 * <p>輸入檢查：
 * <ul>
 *   <li>空清單回傳空清單。</li>
 *   <li>可用寬度不是正的有限數時，不拋例外，改以單欄排版輸出 ({@link RowFit#DEGENERATE})。</li>
 *   <li>間距為負數或 NaN 時視為 0。</li>
 *   <li>目標列高不是正的有限數時，限制在列高上下限內 (NaN 取下限)。</li>
 * </ul>
 *
 * <p>使用範例：
 * <pre>{@code
 * RowLayoutSolver solver = new RowLayoutSolver(new RowGeometryCache(1000));
 * List<LayoutRow> rows = solver.solve(images, 1180, LayoutPolicy.justified(200, 10));
 * }</pre>
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class RowLayoutSolver {

    private final RowGeometryCache cache;

    /**
     * 不使用快取。
     */
    public RowLayoutSolver() {
        this(null);
    }

    /**
     * @param cache 列快取，可為 null
     */
    public RowLayoutSolver(RowGeometryCache cache) {
        this.cache = cache;
    }

    /**
     * 以智慧排版 (預設門檻) 分列。
     */
    public List<LayoutRow> solve(List<ImageRecord> images, double availableWidth, double targetRowHeight, double spacing) {
        return solve(images, availableWidth, LayoutPolicy.justified(targetRowHeight, spacing));
    }

    /**
     * 依指定策略分列。回傳的列依序串接後與 {@code images} 完全相同 (不漏、不重複、順序不變)。
     *
     * @param images         要排版的圖片
     * @param availableWidth 可用寬度 (已扣除左右邊距)
     * @param policy         排版策略
     * @return 不可變的列清單
     */
    public List<LayoutRow> solve(List<ImageRecord> images, double availableWidth, LayoutPolicy policy) {
        Objects.requireNonNull(images, "images must not be null");
        Objects.requireNonNull(policy, "policy must not be null");

        if (images.isEmpty()) {
            return List.of();
        }

        double spacing = policy.spacing();
        if (!(spacing >= 0)) {
            log.warn("間距 {} 無效，改用 0", spacing);
            spacing = 0;
        }

        if (!(availableWidth > 0) || Double.isInfinite(availableWidth)) {
            log.warn("可用寬度 {} 無效，改以單欄排版 {} 張圖片", availableWidth, images.size());
            return degenerateRows(images, policy);
        }

        List<LayoutRow> rows;
        if (policy instanceof LayoutPolicy.FixedGrid fixedGrid) {
            rows = solveFixedGrid(images, availableWidth, fixedGrid.imagesPerRow(), spacing);
        } else {
            LayoutPolicy.Justified justified = (LayoutPolicy.Justified) policy;
            rows = solveJustified(images, availableWidth, targetRowHeight(justified), spacing, justified.constraints());
        }
        log.debug("排版完成: {} 張圖片 -> {} 列 (寬度 {}, 策略 {})", images.size(), rows.size(), availableWidth, policy.kind());
        return Collections.unmodifiableList(rows);
    }

    /**
     * 清除列快取。圖片集合改變時 (切換目錄、分頁追加) 必須呼叫。
     */
    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    private List<LayoutRow> solveFixedGrid(List<ImageRecord> images, double availableWidth, int imagesPerRow, double spacing) {
        if (cache == null) {
            return FixedGridLayout.createRows(images, availableWidth, imagesPerRow, spacing);
        }
        // 分列與寬度無關：以張數與每列張數為 key，命中後只依目前寬度重新計算尺寸
        RowCacheKey key = createRowKey(LayoutKind.FIXED_GRID, images.size(), 0, imagesPerRow, spacing);
        List<LayoutRow> partition = cache.getOrCompute(key,
                rows -> coversExactly(rows, images),
                () -> new RowCacheEntry(FixedGridLayout.createRows(images, availableWidth, imagesPerRow, spacing), 1.0));
        return FixedGridLayout.resize(partition, availableWidth, spacing);
    }

    private List<LayoutRow> solveJustified(List<ImageRecord> images, double availableWidth, double targetRowHeight,
                                           double spacing, LayoutConstraints constraints) {
        List<LayoutRow> rows = new ArrayList<>();
        int cursor = 0;
        while (cursor < images.size()) {
            List<ImageRecord> remaining = images.subList(cursor, images.size());
            LayoutRow row = cache == null
                    ? JustifiedLayout.findOptimalRow(remaining, availableWidth, targetRowHeight, spacing, constraints)
                    : cachedOptimalRow(remaining, availableWidth, targetRowHeight, spacing, constraints);
            rows.add(row);
            cursor += row.imageCount();
        }
        return rows;
    }

    private LayoutRow cachedOptimalRow(List<ImageRecord> remaining, double availableWidth, double targetRowHeight,
                                       double spacing, LayoutConstraints constraints) {
        RowCacheKey key = createRowKey(LayoutKind.JUSTIFIED, remaining.size(), availableWidth, targetRowHeight, spacing,
                constraints);
        return cache.getOrCompute(key,
                rows -> startsWith(remaining, rows.get(0).images()),
                () -> RowCacheEntry.of(
                        JustifiedLayout.findOptimalRow(remaining, availableWidth, targetRowHeight, spacing, constraints),
                        availableWidth)
        ).get(0);
    }

    private List<LayoutRow> degenerateRows(List<ImageRecord> images, LayoutPolicy policy) {
        double height = policy instanceof LayoutPolicy.Justified justified
                ? justified.constraints().clampHeight(targetRowHeight(justified))
                : LayoutConstraints.DEFAULTS.minRowHeight();
        List<LayoutRow> rows = new ArrayList<>(images.size());
        for (ImageRecord image : images) {
            rows.add(JustifiedLayout.rowAtHeight(List.of(image), height, 0, RowFit.DEGENERATE));
        }
        return Collections.unmodifiableList(rows);
    }

    private static double targetRowHeight(LayoutPolicy.Justified policy) {
        double target = policy.targetRowHeight();
        if (target > 0 && Double.isFinite(target)) {
            return target;
        }
        LayoutConstraints constraints = policy.constraints();
        double clamped = Double.isNaN(target) ? constraints.minRowHeight() : constraints.clampHeight(target);
        log.warn("目標列高 {} 無效，改用 {}", target, clamped);
        return clamped;
    }

    private static boolean startsWith(List<ImageRecord> images, List<ImageRecord> prefix) {
        if (prefix.size() > images.size()) {
            return false;
        }
        for (int i = 0; i < prefix.size(); i++) {
            if (!images.get(i).id().equals(prefix.get(i).id())) {
                return false;
            }
        }
        return true;
    }

    private static boolean coversExactly(List<LayoutRow> rows, List<ImageRecord> images) {
        int index = 0;
        for (LayoutRow row : rows) {
            for (ImageRecord image : row.images()) {
                if (index >= images.size() || !images.get(index).id().equals(image.id())) {
                    return false;
                }
                index++;
            }
        }
        return index == images.size();
    }
}
