package work.pollochang.photogrid.decode;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.photogrid.model.ImageRecord;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * 由圖片檔建立 {@link ImageRecord}，只讀取檔頭中的尺寸，不解碼像素。
 * 無法讀取尺寸的檔案仍會建立紀錄 (尺寸為 0，寬高比視為 1.0)，讓排版照常進行。
 */
@Slf4j
public final class ImageRecordReader {

    private ImageRecordReader() {}

    public static List<ImageRecord> readAll(List<Path> paths) {
        List<ImageRecord> records = new ArrayList<>(paths.size());
        for (Path path : paths) {
            records.add(read(path));
        }
        return records;
    }

    public static ImageRecord read(Path path) {
        String id = path.toAbsolutePath().normalize().toString();
        try (InputStream fileStream = Files.newInputStream(path);
             ImageInputStream in = ImageIO.createImageInputStream(fileStream)) {
            if (in != null) {
                Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
                if (readers.hasNext()) {
                    ImageReader reader = readers.next();
                    try {
                        reader.setInput(in, true, true);
                        return new ImageRecord(id, reader.getWidth(0), reader.getHeight(0), path);
                    } finally {
                        reader.dispose();
                    }
                }
            }
            log.warn("{} - 找不到對應的圖片讀取器，尺寸以 0x0 記錄", path);
        } catch (IOException e) {
            log.warn("{} - 無法讀取圖片尺寸，尺寸以 0x0 記錄", path, e);
        }
        return new ImageRecord(id, 0, 0, path);
    }
}
