package work.pollochang.photogrid.core;

import org.junit.jupiter.api.Test;
import work.pollochang.photogrid.model.ImageRecord;
import work.pollochang.photogrid.model.ImageSize;
import work.pollochang.photogrid.model.LayoutRow;
import work.pollochang.photogrid.model.RowFit;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FixedGridLayoutTest {

    private static final double EPSILON = 1e-9;

    private List<ImageRecord> squares(int count) {
        List<ImageRecord> images = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            images.add(ImageRecord.of("square-" + i, 100, 100));
        }
        return images;
    }

    /**
     * 最後一列不足 N 張時仍填滿整列
     */
    @Test
    void testPartialLastRow_ShouldSpanFullWidth() {
        List<LayoutRow> rows = FixedGridLayout.createRows(squares(8), 620, 3, 10);

        assertEquals(3, rows.size());
        assertEquals(3, rows.get(0).imageCount());
        assertEquals(2, rows.get(2).imageCount());
        assertEquals(200, rows.get(0).imageSizes().get(0).width(), EPSILON);
        assertEquals(305, rows.get(2).imageSizes().get(0).width(), EPSILON);
        for (LayoutRow row : rows) {
            assertEquals(620, row.totalWidth(), EPSILON);
            assertEquals(RowFit.FIXED_GRID, row.fit());
        }
    }

    /**
     * 列高由該列自己的平均寬高比決定
     */
    @Test
    void testRowHeight_ShouldUseRowAverageAspectRatio() {
        List<ImageRecord> images = List.of(ImageRecord.of("a", 100, 100), ImageRecord.of("b", 200, 100));

        LayoutRow row = FixedGridLayout.createRows(images, 310, 2, 10).get(0);

        for (ImageSize size : row.imageSizes()) {
            assertEquals(150, size.width(), EPSILON);
            assertEquals(100, size.height(), EPSILON);
        }
    }

    /**
     * 沿用分列結果重新計算尺寸，與直接以新寬度排版相同
     */
    @Test
    void testResize_ShouldMatchFreshLayout() {
        List<ImageRecord> images = squares(14);
        List<LayoutRow> rows = FixedGridLayout.createRows(images, 600, 6, 10);

        assertEquals(FixedGridLayout.createRows(images, 300, 6, 10), FixedGridLayout.resize(rows, 300, 10));
    }

    /**
     * 每列張數必須至少為 1
     */
    @Test
    void testInvalidImagesPerRow_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> LayoutPolicy.fixedGrid(0, 10));
    }
}
