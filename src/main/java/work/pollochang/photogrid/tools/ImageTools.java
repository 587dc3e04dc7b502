package work.pollochang.photogrid.tools;

import java.awt.*;
import java.awt.image.BufferedImage;

public class ImageTools {

    public static BufferedImage resizeImage(BufferedImage originalImage, int targetWidth, int targetHeight) {
        int newWidth = Math.max(1, targetWidth);
        int newHeight = Math.max(1, targetHeight);

        // 保留 Alpha 通道
        int imageType = originalImage.getType();
        if (imageType == 0 || imageType == BufferedImage.TYPE_CUSTOM) {
            imageType = originalImage.getAlphaRaster() != null ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        }

        BufferedImage resizedImage = new BufferedImage(newWidth, newHeight, imageType);
        Graphics2D g2d = resizedImage.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2d.drawImage(originalImage, 0, 0, newWidth, newHeight, null);
        } finally {
            g2d.dispose();
        }
        return resizedImage;
    }

    /**
     * 估算圖片常駐記憶體大小，一律以每像素 4 bytes 計算。
     * @param image 圖片
     * @return bytes
     */
    public static long estimateByteCost(BufferedImage image) {
        return (long) image.getWidth() * image.getHeight() * 4L;
    }
}
