package work.pollochang.photogrid.tools;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
public class FileTools {

    /** 支援的圖片副檔名 */
    public static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "bmp", "tiff", "webp");

    private static final String[] SIZE_UNITS = {"B", "KB", "MB", "GB", "TB"};

    /**
     * 建立報告輸出目錄 (含上層目錄)，已存在時不做任何事。
     * @param directory 輸出目錄
     * @throws UncheckedIOException 無法建立目錄
     */
    public static void ensureDirectoryExists(Path directory) {
        if (Files.isDirectory(directory)) {
            return;
        }
        try {
            Files.createDirectories(directory);
            log.info("{} - 已建立輸出目錄", directory);
        } catch (IOException e) {
            throw new UncheckedIOException("無法建立輸出目錄: " + directory, e);
        }
    }

    public static boolean isImageFile(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && IMAGE_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    /**
     * 逐行讀取檔案列表，略過空白行，保留原順序。
     * @param fileList 每行一個圖片路徑的文字檔
     * @return 圖片路徑
     * @throws IOException 讀取檔案列表失敗
     */
    public static List<Path> readFileList(Path fileList) throws IOException {
        try (Stream<String> lines = Files.lines(fileList)) {
            return lines.map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .map(Paths::get)
                    .collect(Collectors.toList());
        }
    }

    /**
     * 遞迴列出目錄下所有支援的圖片，依路徑排序以確保每次順序一致。
     * @param directory 目錄
     * @return 圖片路徑
     * @throws IOException 走訪目錄失敗
     */
    public static List<Path> listImages(Path directory) throws IOException {
        try (Stream<Path> paths = Files.walk(directory)) {
            return paths.filter(Files::isRegularFile)
                    .filter(FileTools::isImageFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * 以 1024 進位換算成易讀的大小，最多 1 位小數，用於快取記憶體用量的日誌。
     */
    public static String formatFileSize(long bytes) {
        if (bytes <= 0) {
            return "0 B";
        }
        int unit = 0;
        double value = bytes;
        while (value >= 1024 && unit < SIZE_UNITS.length - 1) {
            value /= 1024;
            unit++;
        }
        DecimalFormat format = new DecimalFormat("#,##0.#", DecimalFormatSymbols.getInstance(Locale.ROOT));
        return format.format(value) + " " + SIZE_UNITS[unit];
    }
}
