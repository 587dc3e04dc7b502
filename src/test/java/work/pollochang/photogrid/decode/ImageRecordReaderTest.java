package work.pollochang.photogrid.decode;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.photogrid.model.ImageRecord;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ImageRecordReaderTest {

    /**
     * 只讀取標頭取得尺寸，id 為正規化後的絕對路徑
     */
    @Test
    void testRead_ShouldReturnPixelDimensions(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("photo.png");
        ImageIO.write(new BufferedImage(320, 240, BufferedImage.TYPE_INT_RGB), "png", file.toFile());

        ImageRecord record = ImageRecordReader.read(file);

        assertEquals(320, record.pixelWidth());
        assertEquals(240, record.pixelHeight());
        assertEquals(file.toAbsolutePath().normalize().toString(), record.id());
        assertEquals(file, record.source());
        assertTrue(record.hasValidSize());
    }

    /**
     * 無法辨識的檔案記錄為 0x0，寬高比以 1 計算
     */
    @Test
    void testRead_UnreadableFile_ShouldFallBackToZeroSize(@TempDir Path tempDir) throws IOException {
        Path corrupt = tempDir.resolve("corrupt.jpg");
        Files.writeString(corrupt, "garbage");
        Path missing = tempDir.resolve("missing.png");

        List<ImageRecord> records = ImageRecordReader.readAll(List.of(corrupt, missing));

        assertEquals(2, records.size());
        for (ImageRecord record : records) {
            assertFalse(record.hasValidSize());
            assertEquals(1.0, record.aspectRatio());
        }
    }
}
