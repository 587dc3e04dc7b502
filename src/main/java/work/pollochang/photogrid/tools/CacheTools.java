package work.pollochang.photogrid.tools;

import work.pollochang.photogrid.cache.RowCacheKey;
import work.pollochang.photogrid.core.LayoutConstraints;
import work.pollochang.photogrid.core.LayoutKind;

public class CacheTools {
    /**
     * 輔助方法來產生列快取的 Key (不含門檻，用於固定網格)
     * @param kind 排版策略
     * @param imageCount 圖片數量
     * @param availableWidth 可用寬度
     * @param targetHeight 目標列高 (固定網格傳入每列張數)
     * @param spacing 圖片間距
     * @return 分桶後的 Key
     */
    public static RowCacheKey createRowKey(LayoutKind kind, int imageCount, double availableWidth, double targetHeight, double spacing) {
        return createRowKey(kind, imageCount, availableWidth, targetHeight, spacing, null);
    }

    /**
     * 輔助方法來產生列快取的 Key
     * @param constraints 智慧排版的門檻，會原樣放入 Key
     */
    public static RowCacheKey createRowKey(LayoutKind kind, int imageCount, double availableWidth, double targetHeight,
                                           double spacing, LayoutConstraints constraints) {
        // 寬度與間距保留 1 位小數，高度取整數，避免次像素的浮動造成快取失效
        int widthBucket = (int) Math.round(availableWidth * 10);
        int heightBucket = (int) Math.round(targetHeight);
        int spacingBucket = (int) Math.round(spacing * 10);
        return new RowCacheKey(kind, imageCount, widthBucket, heightBucket, spacingBucket, constraints);
    }
}
