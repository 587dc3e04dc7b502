package work.pollochang.photogrid;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ExecuteTest {

    /**
     * 建立測試用圖片
     */
    private void writeTestImage(Path file, int width, int height, Color color) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(color);
        g.fillRect(0, 0, width, height);
        g.dispose();
        ImageIO.write(image, "png", file.toFile());
    }

    /**
     * 掃描目錄、排版並輸出 JSON 報告
     */
    @Test
    void testDirectory_ShouldWriteLayoutReport(@TempDir Path tempDir) throws IOException {
        Path images = Files.createDirectories(tempDir.resolve("images"));
        writeTestImage(images.resolve("a.png"), 400, 300, Color.RED);
        writeTestImage(images.resolve("b.png"), 300, 400, Color.GREEN);
        writeTestImage(images.resolve("c.png"), 600, 200, Color.BLUE);
        Path output = tempDir.resolve("report").resolve("layout.json");

        int exitCode = new CommandLine(new Execute()).execute(
                "-d", images.toString(), "-o", output.toString(), "-w", "800", "--thumbnails");

        assertEquals(0, exitCode);
        JsonNode report = new ObjectMapper().readTree(output.toFile());
        assertEquals("JUSTIFIED", report.get("policy").asText());
        assertEquals(3, report.get("totalImages").asInt());
        assertEquals(3, report.get("layoutImages").asInt());
        assertEquals(780, report.get("effectiveWidth").asDouble(), 1e-9);
        assertEquals(report.get("rowCount").asInt(), report.get("rows").size());
        assertTrue(report.get("thumbnails").get("misses").asLong() > 0);
    }

    /**
     * 固定網格策略，透過檔案列表指定圖片
     */
    @Test
    void testFileListWithFixedGrid_ShouldUseRequestedColumns(@TempDir Path tempDir) throws IOException {
        StringBuilder list = new StringBuilder();
        for (int i = 0; i < 5; i++) {
            Path file = tempDir.resolve("img-" + i + ".png");
            writeTestImage(file, 100, 100, Color.GRAY);
            list.append(file).append('\n');
        }
        Path fileList = Files.writeString(tempDir.resolve("files.txt"), list.toString());
        Path output = tempDir.resolve("layout.json");

        int exitCode = new CommandLine(new Execute()).execute(
                "-f", fileList.toString(), "-o", output.toString(), "-p", "FIXED_GRID", "-n", "2");

        assertEquals(0, exitCode);
        JsonNode report = new ObjectMapper().readTree(output.toFile());
        assertEquals(3, report.get("rowCount").asInt());
        assertEquals(3, report.get("rowsByFit").get("FIXED_GRID").asInt());
    }

    /**
     * 檔案列表不存在時回傳錯誤碼
     */
    @Test
    void testMissingFileList_ShouldReturnErrorCode(@TempDir Path tempDir) {
        int exitCode = new CommandLine(new Execute()).execute("-f", tempDir.resolve("missing.txt").toString());

        assertEquals(1, exitCode);
    }

    /**
     * 同時指定檔案列表與目錄時為參數錯誤
     */
    @Test
    void testBothSources_ShouldBeRejected(@TempDir Path tempDir) {
        int exitCode = new CommandLine(new Execute()).execute("-f", "a.txt", "-d", tempDir.toString());

        assertEquals(2, exitCode);
    }
}
