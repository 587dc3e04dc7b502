package work.pollochang.photogrid;

/**
 * 可視範圍內的圖片索引，{@code [start, end)}。
 */
public record VisibleRange(int start, int end) {

    public static final VisibleRange EMPTY = new VisibleRange(0, 0);

    public boolean isEmpty() {
        return end <= start;
    }

    public int size() {
        return Math.max(0, end - start);
    }

    public boolean contains(int index) {
        return index >= start && index < end;
    }
}
