package work.pollochang.photogrid.core;

import java.util.Objects;

/**
 * 排版策略。只有兩種：固定張數網格與智慧 (justified) 排版，由 {@link RowLayoutSolver#solve} 統一分派。
 */
public sealed interface LayoutPolicy permits LayoutPolicy.FixedGrid, LayoutPolicy.Justified {

    double spacing();

    LayoutKind kind();

    static LayoutPolicy fixedGrid(int imagesPerRow, double spacing) {
        return new FixedGrid(imagesPerRow, spacing);
    }

    static LayoutPolicy justified(double targetRowHeight, double spacing) {
        return new Justified(targetRowHeight, spacing, LayoutConstraints.DEFAULTS);
    }

    /**
     * 每列固定 {@code imagesPerRow} 張。
     */
    record FixedGrid(int imagesPerRow, double spacing) implements LayoutPolicy {

        public FixedGrid {
            if (imagesPerRow < 1) {
                throw new IllegalArgumentException("imagesPerRow 必須至少為 1: " + imagesPerRow);
            }
        }

        @Override
        public LayoutKind kind() {
            return LayoutKind.FIXED_GRID;
        }
    }

    /**
     * 每列張數不固定，以填充率挑選最接近可用寬度的組合。
     * 目標列高不是正的有限數時不在此拒絕，由 {@link RowLayoutSolver} 限制在列高範圍內。
     */
    record Justified(double targetRowHeight, double spacing, LayoutConstraints constraints) implements LayoutPolicy {

        public Justified {
            Objects.requireNonNull(constraints, "constraints must not be null");
        }

        @Override
        public LayoutKind kind() {
            return LayoutKind.JUSTIFIED;
        }
    }
}
