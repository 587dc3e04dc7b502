package work.pollochang.photogrid.core;

/**
 * 智慧排版 (justified) 的搜尋範圍與門檻。
 *
 * @param minRowHeight            列高下限，也是縮放時的硬性下限
 * @param maxRowHeight            列高上限
 * @param heightRangeLow          搜尋高度範圍下緣 (目標列高的倍數)
 * @param heightRangeHigh         搜尋高度範圍上緣 (目標列高的倍數)
 * @param heightStep              搜尋高度的步進 (px)
 * @param maxImagesPerRowSearch   第一輪每列最多嘗試幾張
 * @param fallbackMaxImagesPerRow 第二輪每列最多嘗試幾張
 * @param minFillRate             第一輪可接受的最低填充率
 * @param maxFillRate             填充率上限，超過即代表超出可用寬度
 * @param fallbackFillRate        第二輪可接受的最低填充率
 * @author PolloChang
 * @since 0.1.0
 */
public record LayoutConstraints(
        double minRowHeight,
        double maxRowHeight,
        double heightRangeLow,
        double heightRangeHigh,
        double heightStep,
        int maxImagesPerRowSearch,
        int fallbackMaxImagesPerRow,
        double minFillRate,
        double maxFillRate,
        double fallbackFillRate
) {

    public static final LayoutConstraints DEFAULTS = new LayoutConstraints(
            120, 300, 0.8, 1.2, 10, 10, 8, 0.85, 1.0, 0.75);

    public LayoutConstraints {
        if (!(minRowHeight > 0) || maxRowHeight < minRowHeight) {
            throw new IllegalArgumentException("列高範圍無效: " + minRowHeight + " ~ " + maxRowHeight);
        }
        if (!(heightStep > 0)) {
            throw new IllegalArgumentException("heightStep 必須大於 0: " + heightStep);
        }
        if (maxImagesPerRowSearch < 1 || fallbackMaxImagesPerRow < 1) {
            throw new IllegalArgumentException("每列搜尋張數必須至少為 1");
        }
        if (minFillRate > maxFillRate || fallbackFillRate > maxFillRate) {
            throw new IllegalArgumentException("填充率門檻不可高於上限 " + maxFillRate);
        }
    }

    public double clampHeight(double height) {
        return Math.max(minRowHeight, Math.min(maxRowHeight, height));
    }

    public boolean isInBand(double fillRate) {
        return fillRate >= minFillRate && fillRate <= maxFillRate;
    }

    public boolean isAcceptableFallback(double fillRate) {
        return fillRate >= fallbackFillRate && fillRate <= maxFillRate;
    }
}
