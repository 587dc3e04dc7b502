package work.pollochang.photogrid.model;

/**
 * 一列是經由哪一層規則選出的。
 */
public enum RowFit {
    FIXED_GRID("固定張數網格"),
    IN_BAND("填充率落在理想區間"),
    ACCEPTABLE("退回目標高度後可接受"),
    BEST_EFFORT("退回後取最佳填充"),
    SINGLE_IMAGE("單張保底"),
    DEGENERATE("輸入寬度無效，單欄排版");

    private final String description;
    RowFit(String description) { this.description = description; }
    public String getDescription() { return description; }
}
