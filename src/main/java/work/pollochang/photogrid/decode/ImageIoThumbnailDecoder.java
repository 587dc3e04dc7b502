package work.pollochang.photogrid.decode;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.photogrid.model.ImageRecord;
import work.pollochang.photogrid.model.ThumbnailSize;
import work.pollochang.photogrid.tools.ImageTools;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.spi.IIORegistry;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * 以 ImageIO 產生縮圖。
 * <p>
 * 讀取時先依目標尺寸計算二次取樣率，只解出接近目標大小的像素，再以雙線性插值縮放到剛好放入目標方框。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class ImageIoThumbnailDecoder implements ThumbnailDecoder {

    // 註冊 ImageIO 外掛程式，禁用磁碟快取，強制使用記憶體操作，避免 I/O 瓶頸。
    static {
        IIORegistry.getDefaultInstance().registerApplicationClasspathSpis();
        ImageIO.setUseCache(false);
    }

    @Override
    public BufferedImage decode(ImageRecord record, ThumbnailSize targetSize) throws IOException {
        Path source = record.source();
        if (source == null) {
            throw new IOException(record.id() + " - 沒有來源檔案");
        }
        if (!Files.isReadable(source)) {
            throw new IOException(source + " - 檔案不存在或不可讀");
        }

        try (DecodedImage decoded = decodeWithSubsampling(source, targetSize)) {
            BufferedImage image = decoded.image();
            ThumbnailSize fitted = ThumbnailSize.fit(
                    ImageRecord.of(record.id(), image.getWidth(), image.getHeight()), targetSize);
            if (fitted.width() == image.getWidth() && fitted.height() == image.getHeight()) {
                return image;
            }
            try {
                return ImageTools.resizeImage(image, fitted.width(), fitted.height());
            } finally {
                image.flush();
            }
        }
    }

    private static DecodedImage decodeWithSubsampling(Path source, ThumbnailSize targetSize) throws IOException {
        try (InputStream fileStream = Files.newInputStream(source);
             ImageInputStream in = ImageIO.createImageInputStream(fileStream)) {
            if (in == null) {
                throw new IOException(source + " - 無法建立圖片輸入流");
            }

            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new IOException(source + " - 找不到對應的圖片讀取器");
            }

            ImageReader reader = readers.next();
            reader.setInput(in, true, true);

            try {
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);

                ImageReadParam param = reader.getDefaultReadParam();
                int subsampling = calculateSubsampling(width, height, targetSize);
                if (subsampling > 1) {
                    log.trace("{} - 對圖片應用二次取樣，比率: {}", source.getFileName(), subsampling);
                    param.setSourceSubsampling(subsampling, subsampling, 0, 0);
                }

                BufferedImage image = reader.read(0, param);
                return new DecodedImage(image, reader);
            } catch (IOException | RuntimeException e) {
                // 讀取尺寸或解碼時出錯，安全地釋放 reader 後重新拋出
                reader.dispose();
                throw e;
            }
        }
    }

    /**
     * 取樣後的尺寸仍不小於目標尺寸，之後再精確縮放。取 2 的冪，對 JPG 解碼器較友善。
     */
    static int calculateSubsampling(int width, int height, ThumbnailSize targetSize) {
        double ratio = Math.min((double) width / targetSize.width(), (double) height / targetSize.height());
        if (ratio < 2) {
            return 1;
        }
        return Integer.highestOneBit((int) Math.floor(ratio));
    }
}
