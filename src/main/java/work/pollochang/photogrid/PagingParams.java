package work.pollochang.photogrid;

/**
 * 分頁與視窗相關參數。
 * @param initialLoadCount 初次載入張數
 * @param pageSize 每次追加張數
 * @param horizontalPadding 列表左右留白 (px)，可用寬度會扣除兩倍
 * @param resizeThreshold 寬度變化不超過此值時沿用上次排版 (px)
 * @param preloadThresholdMultiplier 預先載入縮圖的範圍 (可視高度的倍數)
 */
public record PagingParams(int initialLoadCount, int pageSize, double horizontalPadding, double resizeThreshold,
                           double preloadThresholdMultiplier) {

    public static final PagingParams DEFAULTS = new PagingParams(50, 50, 10, 5, 1.5);

    public PagingParams {
        if (initialLoadCount < 1 || pageSize < 1) {
            throw new IllegalArgumentException("initialLoadCount 與 pageSize 必須至少為 1");
        }
        if (horizontalPadding < 0 || resizeThreshold < 0 || preloadThresholdMultiplier < 1) {
            throw new IllegalArgumentException("留白、縮放門檻不可為負數，預載倍數不可小於 1");
        }
    }

    /**
     * 初次載入張數不超過縮圖快取上限的一半，避免第一頁就把快取擠滿。
     */
    public int effectiveInitialLoadCount(int thumbnailCacheSize) {
        return Math.max(1, Math.min(initialLoadCount, thumbnailCacheSize / 2));
    }
}
