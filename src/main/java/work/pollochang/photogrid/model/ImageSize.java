package work.pollochang.photogrid.model;

/**
 * 排版後單張圖片的顯示尺寸。
 * @param width 顯示寬度
 * @param height 顯示高度
 */
public record ImageSize(double width, double height) {

    public ImageSize scale(double factor) {
        return new ImageSize(width * factor, height * factor);
    }
}
