package work.pollochang.photogrid.core;

import org.junit.jupiter.api.Test;
import work.pollochang.photogrid.model.ImageRecord;
import work.pollochang.photogrid.model.ImageSize;
import work.pollochang.photogrid.model.LayoutRow;
import work.pollochang.photogrid.model.RowFit;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JustifiedLayoutTest {

    private static final double EPSILON = 1e-9;

    private List<ImageRecord> squares(int count) {
        List<ImageRecord> images = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            images.add(ImageRecord.of("square-" + i, 400, 400));
        }
        return images;
    }

    /**
     * 第一輪找到填充率 0.99 的 5 張組合，撐滿後每張 192 x 192
     */
    @Test
    void testFirstPass_ShouldPickHighestFillRateInBand() {
        LayoutRow row = JustifiedLayout.findOptimalRow(squares(12), 1000, 200, 10, LayoutConstraints.DEFAULTS);

        assertEquals(RowFit.IN_BAND, row.fit());
        assertEquals(5, row.imageCount());
        for (ImageSize size : row.imageSizes()) {
            assertEquals(192, size.width(), EPSILON);
            assertEquals(192, size.height(), EPSILON);
        }
        assertEquals(1000, row.totalWidth(), EPSILON);
    }

    /**
     * 第一輪沒有組合達標，第二輪以目標列高找到可接受的組合
     */
    @Test
    void testFallbackPass_ShouldAcceptFillRateAboveFallbackThreshold() {
        LayoutConstraints strict = new LayoutConstraints(120, 300, 1.0, 1.0, 10, 10, 8, 0.95, 1.0, 0.75);

        LayoutRow row = JustifiedLayout.findOptimalRow(squares(4), 1000, 200, 0, strict);

        assertEquals(RowFit.ACCEPTABLE, row.fit());
        assertEquals(4, row.imageCount());
        assertEquals(250, row.height(), EPSILON);
        assertEquals(1000, row.totalWidth(), EPSILON);
    }

    /**
     * 最後剩下兩張時取最佳填充並維持目標列高
     */
    @Test
    void testTrailingImages_ShouldKeepTargetHeight() {
        LayoutRow row = JustifiedLayout.findOptimalRow(squares(2), 1000, 200, 10, LayoutConstraints.DEFAULTS);

        assertEquals(RowFit.BEST_EFFORT, row.fit());
        assertEquals(2, row.imageCount());
        assertEquals(200, row.height(), EPSILON);
        assertEquals(410, row.totalWidth(), EPSILON);
    }

    /**
     * 縮放後會低於列高下限時，保留超出寬度的列
     */
    @Test
    void testJustifyRow_ShouldKeepOverflowRatherThanBreakMinimumHeight() {
        LayoutRow row = JustifiedLayout.justifyRow(squares(10), 1000, 0, LayoutConstraints.DEFAULTS, RowFit.IN_BAND);

        assertEquals(120, row.height(), EPSILON);
        assertEquals(1200, row.totalWidth(), EPSILON);
    }

    /**
     * 理想列高超過上限時以上限為準
     */
    @Test
    void testJustifyRow_ShouldClampToMaximumHeight() {
        LayoutRow row = JustifiedLayout.justifyRow(squares(2), 1000, 0, LayoutConstraints.DEFAULTS, RowFit.ACCEPTABLE);

        assertEquals(300, row.height(), EPSILON);
        assertEquals(600, row.totalWidth(), EPSILON);
    }

    /**
     * 單張列：目標列高低於下限時提高到下限，但不超出寬度
     */
    @Test
    void testSingleImageRow_ShouldClampTargetHeight() {
        LayoutRow row = JustifiedLayout.singleImageRow(ImageRecord.of("a", 100, 100), 1000, 50, LayoutConstraints.DEFAULTS);

        assertEquals(RowFit.SINGLE_IMAGE, row.fit());
        assertEquals(120, row.height(), EPSILON);
        assertEquals(120, row.totalWidth(), EPSILON);
    }

    /**
     * 門檻設定不合理時拒絕建立
     */
    @Test
    void testInvalidConstraints_ShouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> new LayoutConstraints(300, 120, 0.8, 1.2, 10, 10, 8, 0.85, 1.0, 0.75));
        assertThrows(IllegalArgumentException.class,
                () -> new LayoutConstraints(120, 300, 0.8, 1.2, 0, 10, 8, 0.85, 1.0, 0.75));
        assertThrows(IllegalArgumentException.class,
                () -> new LayoutConstraints(120, 300, 0.8, 1.2, 10, 10, 8, 1.1, 1.0, 0.75));
    }
}
