package work.pollochang.photogrid.cache;

import work.pollochang.photogrid.core.LayoutConstraints;
import work.pollochang.photogrid.core.LayoutKind;

/**
 * 列快取的 Key，以量化後的幾何參數分桶，避免浮點誤差造成快取失效。
 * @param kind 排版策略
 * @param imageCount 圖片數量 (智慧排版為游標後剩餘張數)
 * @param widthBucket 可用寬度 x10 四捨五入
 * @param heightBucket 目標列高四捨五入 (固定網格則為每列張數)
 * @param spacingBucket 間距 x10 四捨五入
 * @param constraints 智慧排版的搜尋範圍與門檻，門檻不同的結果不可共用；固定網格為 {@code null}
 */
public record RowCacheKey(LayoutKind kind, int imageCount, int widthBucket, int heightBucket, int spacingBucket,
                          LayoutConstraints constraints) {}
