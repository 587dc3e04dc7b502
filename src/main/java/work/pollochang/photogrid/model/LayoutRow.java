package work.pollochang.photogrid.model;

import java.util.List;

/**
 * 排版結果中的一列。
 * <p>
 * {@code imageSizes} 與 {@code images} 一一對應；{@code totalWidth} 為所有圖片寬度加上圖片間距的總和。
 * 兩個清單在建構時即複製為不可變清單，呼叫端無法改動快取內的資料。
 *
 * @param images     本列的圖片，依輸入順序
 * @param imageSizes 每張圖片的顯示尺寸
 * @param totalWidth 本列總寬度 (含間距)
 * @param fit        本列的選取方式
 */
public record LayoutRow(List<ImageRecord> images, List<ImageSize> imageSizes, double totalWidth, RowFit fit) {

    public LayoutRow {
        images = List.copyOf(images);
        imageSizes = List.copyOf(imageSizes);
        if (images.size() != imageSizes.size()) {
            throw new IllegalArgumentException(
                    "images 與 imageSizes 數量不一致: " + images.size() + " != " + imageSizes.size());
        }
    }

    public int imageCount() {
        return images.size();
    }

    /**
     * 列高，取本列最高的圖片。
     */
    public double height() {
        double max = 0;
        for (ImageSize size : imageSizes) {
            max = Math.max(max, size.height());
        }
        return max;
    }

    public double fillRate(double availableWidth) {
        return availableWidth > 0 ? totalWidth / availableWidth : 0;
    }
}
