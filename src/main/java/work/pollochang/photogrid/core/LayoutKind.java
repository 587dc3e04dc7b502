package work.pollochang.photogrid.core;

public enum LayoutKind {
    FIXED_GRID,
    JUSTIFIED
}
