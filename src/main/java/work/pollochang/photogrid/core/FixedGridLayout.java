package work.pollochang.photogrid.core;

import work.pollochang.photogrid.model.ImageRecord;
import work.pollochang.photogrid.model.ImageSize;
import work.pollochang.photogrid.model.LayoutRow;
import work.pollochang.photogrid.model.RowFit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 固定張數網格排版。
 * <p>
 * 每列 N 張，同一列的圖片寬度相同，列高以該列自己的平均寬高比換算，使整列剛好填滿可用寬度。
 * 最後一列不足 N 張時，以實際張數重新分配寬度，同樣填滿整列。
 *
 * @author PolloChang
 * @since 0.1.0
 */
public final class FixedGridLayout {

    private FixedGridLayout() {}

    public static List<LayoutRow> createRows(List<ImageRecord> images, double availableWidth, int imagesPerRow, double spacing) {
        List<LayoutRow> rows = new ArrayList<>((images.size() + imagesPerRow - 1) / imagesPerRow);
        for (int start = 0; start < images.size(); start += imagesPerRow) {
            int end = Math.min(start + imagesPerRow, images.size());
            rows.add(sizeRow(images.subList(start, end), availableWidth, spacing));
        }
        return rows;
    }

    /**
     * 沿用既有的分列結果，只依新的寬度重新計算尺寸。
     * @param rows 先前的分列結果
     * @param availableWidth 新的可用寬度
     * @param spacing 圖片間距
     * @return 重新計算尺寸後的列
     */
    public static List<LayoutRow> resize(List<LayoutRow> rows, double availableWidth, double spacing) {
        List<LayoutRow> resized = new ArrayList<>(rows.size());
        for (LayoutRow row : rows) {
            resized.add(sizeRow(row.images(), availableWidth, spacing));
        }
        return resized;
    }

    static LayoutRow sizeRow(List<ImageRecord> run, double availableWidth, double spacing) {
        int count = run.size();
        double totalSpacing = spacing * (count - 1);
        double cellWidth = Math.max(0, (availableWidth - totalSpacing) / count);

        double totalAspectRatio = 0;
        for (ImageRecord image : run) {
            totalAspectRatio += image.aspectRatio();
        }
        double averageAspectRatio = totalAspectRatio / count;

        ImageSize size = new ImageSize(cellWidth, cellWidth / averageAspectRatio);
        return new LayoutRow(run, Collections.nCopies(count, size), cellWidth * count + totalSpacing, RowFit.FIXED_GRID);
    }
}
