package work.pollochang.photogrid.report;

import work.pollochang.photogrid.cache.RowCacheStats;
import work.pollochang.photogrid.cache.ThumbnailCacheStats;
import work.pollochang.photogrid.core.LayoutKind;
import work.pollochang.photogrid.model.ImageRecord;
import work.pollochang.photogrid.model.ImageSize;
import work.pollochang.photogrid.model.LayoutRow;
import work.pollochang.photogrid.model.RowFit;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 排版結果報告，輸出為 JSON。
 */
public record LayoutReport(
        LayoutKind policy,
        double viewportWidth,
        double effectiveWidth,
        int totalImages,
        int layoutImages,
        int rowCount,
        double averageFillRate,
        Map<RowFit, Long> rowsByFit,
        RowCacheStats rowCache,
        ThumbnailCacheStats thumbnails,
        List<RowReport> rows
) {

    public static LayoutReport of(LayoutKind policy, double viewportWidth, double effectiveWidth, int totalImages,
                                  List<LayoutRow> rows, RowCacheStats rowCache, ThumbnailCacheStats thumbnails) {
        Map<RowFit, Long> rowsByFit = new EnumMap<>(RowFit.class);
        List<RowReport> rowReports = new ArrayList<>(rows.size());
        int layoutImages = 0;
        double fillRateSum = 0;

        for (int i = 0; i < rows.size(); i++) {
            LayoutRow row = rows.get(i);
            double fillRate = row.fillRate(effectiveWidth);
            fillRateSum += fillRate;
            layoutImages += row.imageCount();
            rowsByFit.merge(row.fit(), 1L, Long::sum);

            List<RowReport.ImagePlacement> placements = new ArrayList<>(row.imageCount());
            for (int j = 0; j < row.imageCount(); j++) {
                ImageRecord image = row.images().get(j);
                ImageSize size = row.imageSizes().get(j);
                placements.add(new RowReport.ImagePlacement(image.id(), size.width(), size.height()));
            }
            rowReports.add(new RowReport(i, row.imageCount(), row.height(), row.totalWidth(), fillRate, row.fit(), placements));
        }

        double averageFillRate = rows.isEmpty() ? 0.0 : fillRateSum / rows.size();
        return new LayoutReport(policy, viewportWidth, effectiveWidth, totalImages, layoutImages, rows.size(),
                averageFillRate, rowsByFit, rowCache, thumbnails, rowReports);
    }
}
