package work.pollochang.photogrid.model;

/**
 * 縮圖的目標像素尺寸，至少 1x1。
 * @param width 目標寬度 (px)
 * @param height 目標高度 (px)
 */
public record ThumbnailSize(int width, int height) {

    public ThumbnailSize {
        width = Math.max(1, width);
        height = Math.max(1, height);
    }

    /**
     * 由排版尺寸換算，四捨五入到整數像素。
     */
    public static ThumbnailSize of(ImageSize size) {
        return new ThumbnailSize((int) Math.round(size.width()), (int) Math.round(size.height()));
    }

    /**
     * 在維持寬高比的前提下，將圖片縮放到能完全放進指定方框。
     * @param record 圖片
     * @param box 方框尺寸
     * @return 放入方框後的尺寸
     */
    public static ThumbnailSize fit(ImageRecord record, ThumbnailSize box) {
        double aspectRatio = record.aspectRatio();
        double widthRatio = box.width() / aspectRatio;
        if (widthRatio <= box.height()) {
            return new ThumbnailSize(box.width(), (int) Math.round(widthRatio));
        }
        return new ThumbnailSize((int) Math.round(box.height() * aspectRatio), box.height());
    }

    public long pixelCount() {
        return (long) width * height;
    }
}
