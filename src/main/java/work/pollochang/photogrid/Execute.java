package work.pollochang.photogrid;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import work.pollochang.photogrid.cache.CacheParams;
import work.pollochang.photogrid.cache.RowGeometryCache;
import work.pollochang.photogrid.cache.ThumbnailCache;
import work.pollochang.photogrid.core.LayoutConstraints;
import work.pollochang.photogrid.core.LayoutKind;
import work.pollochang.photogrid.core.LayoutPolicy;
import work.pollochang.photogrid.decode.ImageIoThumbnailDecoder;
import work.pollochang.photogrid.decode.ImageRecordReader;
import work.pollochang.photogrid.model.ImageRecord;
import work.pollochang.photogrid.model.LayoutRow;
import work.pollochang.photogrid.report.LayoutReport;
import work.pollochang.photogrid.tools.FileTools;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@Command(name = "photo-grid",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        description = "照片牆排版工具：計算圖片分列結果並輸出 JSON 報告")
public class Execute implements Callable<Integer> {

    static class Source {
        @Option(names = {"-f", "--file-list"}, required = true, description = "包含圖片路徑的文字檔案。")
        File fileList;

        @Option(names = {"-d", "--dir"}, required = true, description = "圖片目錄 (遞迴掃描)。")
        File directory;
    }

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Source source;

    @Option(names = {"-o", "--output"}, description = "JSON 報告輸出檔案 (預設: 輸出到標準輸出)。")
    private File output;

    @Option(names = {"-w", "--width"}, defaultValue = "1200", description = "視窗寬度 (預設: 1200)。")
    private double viewportWidth;

    @Option(names = {"--viewport-height"}, defaultValue = "800", description = "可視高度，用於預載縮圖 (預設: 800)。")
    private double viewportHeight;

    @Option(names = {"-p", "--policy"}, defaultValue = "JUSTIFIED", description = "排版策略: ${COMPLETION-CANDIDATES} (預設: JUSTIFIED)。")
    private LayoutKind policy;

    @Option(names = {"-n", "--images-per-row"}, defaultValue = "6", description = "固定網格每列張數 (預設: 6)。")
    private int imagesPerRow;

    @Option(names = {"-s", "--spacing"}, defaultValue = "10", description = "圖片間距 (預設: 10)。")
    private double spacing;

    @Option(names = {"--padding"}, defaultValue = "10", description = "列表左右留白 (預設: 10)。")
    private double horizontalPadding;

    @Option(names = {"-t", "--target-row-height"}, defaultValue = "200", description = "智慧排版目標列高 (預設: 200)。")
    private double targetRowHeight;

    @Option(names = {"--min-row-height"}, defaultValue = "120", description = "列高下限 (預設: 120)。")
    private double minRowHeight;

    @Option(names = {"--max-row-height"}, defaultValue = "300", description = "列高上限 (預設: 300)。")
    private double maxRowHeight;

    @Option(names = {"--min-fill-rate"}, defaultValue = "0.85", description = "第一輪可接受的最低填充率 (預設: 0.85)。")
    private double minFillRate;

    @Option(names = {"--fallback-fill-rate"}, defaultValue = "0.75", description = "第二輪可接受的最低填充率 (預設: 0.75)。")
    private double fallbackFillRate;

    @Option(names = {"--max-images-search"}, defaultValue = "10", description = "第一輪每列最多嘗試張數 (預設: 10)。")
    private int maxImagesPerRowSearch;

    @Option(names = {"--fallback-max-images"}, defaultValue = "8", description = "第二輪每列最多嘗試張數 (預設: 8)。")
    private int fallbackMaxImagesPerRow;

    @Option(names = {"--height-step"}, defaultValue = "10", description = "搜尋列高的步進 (預設: 10)。")
    private double heightStep;

    @Option(names = {"--row-cache-size"}, defaultValue = "1000", description = "列快取筆數上限 (預設: 1000)。")
    private int rowCacheSize;

    @Option(names = {"--thumbnail-cache-size"}, defaultValue = "2000", description = "縮圖快取筆數上限 (預設: 2000)。")
    private int thumbnailCacheSize;

    @Option(names = {"--max-memory"}, defaultValue = "536870912", description = "縮圖快取記憶體上限(bytes) (預設: 536870912, 即 512MB)。")
    private long maxMemoryUsage;

    @Option(names = {"--initial-load"}, defaultValue = "${env:PHOTOGRID_INITIAL_LOAD_COUNT:-50}", description = "初次載入張數，可由環境變數 PHOTOGRID_INITIAL_LOAD_COUNT 指定 (預設: 50)。")
    private int initialLoadCount;

    @Option(names = {"--page-size"}, defaultValue = "50", description = "每次追加張數 (預設: 50)。")
    private int pageSize;

    @Option(names = {"--pages"}, defaultValue = "0", description = "初次載入後再追加幾頁 (預設: 0)。")
    private int extraPages;

    @Option(names = {"-a", "--all"}, description = "載入全部圖片後再排版。")
    private boolean loadAll;

    @Option(names = {"--thumbnails"}, description = "為第一個可視範圍內的圖片產生縮圖。")
    private boolean thumbnails;

    @Option(names = {"--timeOut"}, defaultValue = "60", description = "等待縮圖產生的逾時(秒) (預設: 60 秒)。")
    private long timeOutSec;

    @Override
    public Integer call() throws Exception {
        LayoutConstraints constraints = new LayoutConstraints(minRowHeight, maxRowHeight,
                LayoutConstraints.DEFAULTS.heightRangeLow(), LayoutConstraints.DEFAULTS.heightRangeHigh(), heightStep,
                maxImagesPerRowSearch, fallbackMaxImagesPerRow, minFillRate, LayoutConstraints.DEFAULTS.maxFillRate(),
                fallbackFillRate);
        LayoutPolicy layoutPolicy = policy == LayoutKind.FIXED_GRID
                ? LayoutPolicy.fixedGrid(imagesPerRow, spacing)
                : new LayoutPolicy.Justified(targetRowHeight, spacing, constraints);
        CacheParams cacheParams = new CacheParams(thumbnailCacheSize, maxMemoryUsage, rowCacheSize, 1);
        PagingParams pagingParams = new PagingParams(initialLoadCount, pageSize, horizontalPadding,
                PagingParams.DEFAULTS.resizeThreshold(), PagingParams.DEFAULTS.preloadThresholdMultiplier());

        log.info("========================================排版參數設定========================================");
        log.info("圖片來源: {}", source.fileList != null ? source.fileList.getAbsolutePath() : source.directory.getAbsolutePath());
        log.info("視窗尺寸: {}x{}", viewportWidth, viewportHeight);
        log.info("排版策略: {}", layoutPolicy);
        log.info("列快取上限: {} 筆", rowCacheSize);
        log.info("縮圖快取上限: {} 筆 / {}", thumbnailCacheSize, FileTools.formatFileSize(maxMemoryUsage));
        log.info("初次載入 / 每頁: {} / {}", initialLoadCount, pageSize);
        log.info("========================================排版參數設定========================================");

        List<Path> paths;
        try {
            paths = source.fileList != null
                    ? FileTools.readFileList(source.fileList.toPath())
                    : FileTools.listImages(source.directory.toPath());
        } catch (IOException e) {
            log.error("讀取圖片來源失敗", e);
            return 1;
        }
        List<ImageRecord> records = ImageRecordReader.readAll(paths);

        LayoutReport report;
        try (ThumbnailCache thumbnailCache = new ThumbnailCache(cacheParams, new ImageIoThumbnailDecoder(), Runnable::run)) {
            RowGeometryCache rowCache = RowGeometryCache.from(cacheParams);
            GalleryWindowController controller = new GalleryWindowController(rowCache, thumbnailCache, layoutPolicy, pagingParams);
            controller.load(records);
            if (loadAll) {
                controller.loadAll();
            } else {
                for (int i = 0; i < extraPages && controller.canLoadMore(); i++) {
                    controller.loadMore();
                }
            }

            List<LayoutRow> rows = controller.layout(viewportWidth);
            if (thumbnails) {
                awaitThumbnails(controller.prefetchVisibleThumbnails(rows, 0, viewportHeight));
            }

            report = LayoutReport.of(layoutPolicy.kind(), viewportWidth, controller.effectiveWidth(viewportWidth),
                    controller.totalImages(), rows, rowCache.stats(), thumbnailCache.stats());
        }

        if (!writeReport(report)) {
            return 1;
        }

        log.info("========================================排版統計報告========================================");
        log.info(" 圖片總數: {}, 已排版: {}, 列數: {}", report.totalImages(), report.layoutImages(), report.rowCount());
        log.info(" 平均填充率: {}", String.format("%.3f", report.averageFillRate()));
        report.rowsByFit().forEach((fit, count) -> log.info(" {}: {} 列", fit.getDescription(), count));
        log.info(" 縮圖: 命中 {}, 解碼 {}, 失敗 {}, 常駐 {} 筆 / {}", report.thumbnails().hits(), report.thumbnails().misses(),
                report.thumbnails().failures(), report.thumbnails().residentCount(),
                FileTools.formatFileSize(report.thumbnails().residentBytes()));
        log.info("========================================排版統計報告========================================");
        return 0;
    }

    private void awaitThumbnails(List<CompletableFuture<Optional<BufferedImage>>> futures) {
        log.info("等待 {} 張縮圖產生...", futures.size());
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(timeOutSec, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("縮圖產生逾時，部分縮圖可能未完成。");
        } catch (ExecutionException e) {
            log.error("縮圖產生時發生錯誤", e);
        } catch (InterruptedException e) {
            log.error("等待縮圖時被中斷。", e);
            Thread.currentThread().interrupt();
        }
    }

    private boolean writeReport(LayoutReport report) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT); // 讓 JSON 格式化，方便閱讀
        try {
            if (output == null) {
                System.out.println(mapper.writeValueAsString(report));
            } else {
                Path outputPath = output.toPath().toAbsolutePath();
                if (outputPath.getParent() != null) {
                    FileTools.ensureDirectoryExists(outputPath.getParent());
                }
                mapper.writeValue(outputPath.toFile(), report);
                log.info("排版報告已寫入 {}", outputPath);
            }
            return true;
        } catch (IOException | UncheckedIOException e) {
            log.error("寫入排版報告時發生錯誤。", e);
            return false;
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Execute()).execute(args);
        System.exit(exitCode);
    }
}
