package work.pollochang.photogrid.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class FileToolsTest {

    /**
     * 遞迴列出圖片，忽略非圖片檔，依路徑排序
     */
    @Test
    void testListImages_ShouldReturnSortedImagesOnly(@TempDir Path tempDir) throws IOException {
        Path nested = Files.createDirectories(tempDir.resolve("nested"));
        Files.createFile(tempDir.resolve("b.JPG"));
        Files.createFile(tempDir.resolve("a.png"));
        Files.createFile(tempDir.resolve("notes.txt"));
        Files.createFile(nested.resolve("c.webp"));

        List<Path> images = FileTools.listImages(tempDir);

        assertEquals(List.of(tempDir.resolve("a.png"), tempDir.resolve("b.JPG"), nested.resolve("c.webp")), images);
    }

    /**
     * 檔案列表略過空白行並保留順序
     */
    @Test
    void testReadFileList_ShouldSkipBlankLines(@TempDir Path tempDir) throws IOException {
        Path list = tempDir.resolve("list.txt");
        Files.writeString(list, "/photos/2.jpg\n\n  /photos/1.jpg  \n");

        assertEquals(List.of(Paths.get("/photos/2.jpg"), Paths.get("/photos/1.jpg")), FileTools.readFileList(list));
    }

    /**
     * 檔案列表不存在時拋出 IOException
     */
    @Test
    void testReadFileList_MissingFile_ShouldThrow(@TempDir Path tempDir) {
        assertThrows(IOException.class, () -> FileTools.readFileList(tempDir.resolve("missing.txt")));
    }

    @Test
    void testEnsureDirectoryExists_ShouldCreateNestedDirectories(@TempDir Path tempDir) {
        Path target = tempDir.resolve("a").resolve("b");

        FileTools.ensureDirectoryExists(target);

        assertTrue(Files.isDirectory(target));
    }

    @Test
    void testFormatFileSize() {
        assertEquals("0 B", FileTools.formatFileSize(0));
        assertEquals("1 KB", FileTools.formatFileSize(1024));
        assertEquals("1.5 MB", FileTools.formatFileSize(1024 * 1024 * 3 / 2));
    }

    /**
     * 路徑已被一般檔案佔用時拋出 UncheckedIOException
     */
    @Test
    void testEnsureDirectoryExists_BlockedByFile_ShouldThrow(@TempDir Path tempDir) throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("blocker"));

        assertThrows(UncheckedIOException.class, () -> FileTools.ensureDirectoryExists(blocker.resolve("child")));
    }

    /**
     * 小數點不受預設語系影響
     */
    @Test
    void testFormatFileSize_ShouldIgnoreDefaultLocale() {
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(Locale.GERMANY);
            assertEquals("1.5 MB", FileTools.formatFileSize(1024 * 1024 * 3 / 2));
            assertEquals("2 GB", FileTools.formatFileSize(2L * 1024 * 1024 * 1024));
        } finally {
            Locale.setDefault(original);
        }
    }
}
