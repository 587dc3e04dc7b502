package work.pollochang.photogrid.cache;

import work.pollochang.photogrid.model.LayoutRow;

import java.util.List;

/**
 * 列快取的 Value。
 * @param rows 計算結果 (智慧排版為單一列，固定網格為整個分列)
 * @param fillRate 計算當下的填充率
 */
public record RowCacheEntry(List<LayoutRow> rows, double fillRate) {

    public RowCacheEntry {
        rows = List.copyOf(rows);
    }

    public static RowCacheEntry of(LayoutRow row, double availableWidth) {
        return new RowCacheEntry(List.of(row), row.fillRate(availableWidth));
    }
}
