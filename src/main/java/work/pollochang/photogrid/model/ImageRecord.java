package work.pollochang.photogrid.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 單張圖片的中繼資料，建立後不可變。
 * <p>
 * 像素尺寸為 0、負數或非有限值時，寬高比一律視為 1.0，排版計算不會因此產生 NaN 或 Infinity。
 *
 * @param id          穩定的唯一識別字串 (通常為檔案路徑)
 * @param pixelWidth  原始像素寬度
 * @param pixelHeight 原始像素高度
 * @param source      來源檔案，可為 null (例如測試資料)
 * @author PolloChang
 * @since 0.1.0
 */
public record ImageRecord(String id, double pixelWidth, double pixelHeight, Path source) {

    /** 寬高比下限，避免除以接近 0 的值。 */
    public static final double MIN_ASPECT_RATIO = 0.001;

    public ImageRecord {
        Objects.requireNonNull(id, "id must not be null");
    }

    public static ImageRecord of(String id, double pixelWidth, double pixelHeight) {
        return new ImageRecord(id, pixelWidth, pixelHeight, null);
    }

    public double aspectRatio() {
        if (!hasValidSize()) {
            return 1.0;
        }
        return Math.max(MIN_ASPECT_RATIO, pixelWidth / pixelHeight);
    }

    public boolean hasValidSize() {
        return pixelWidth > 0 && pixelHeight > 0
                && Double.isFinite(pixelWidth) && Double.isFinite(pixelHeight);
    }
}
