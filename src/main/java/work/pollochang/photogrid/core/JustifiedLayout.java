package work.pollochang.photogrid.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.photogrid.model.ImageRecord;
import work.pollochang.photogrid.model.ImageSize;
import work.pollochang.photogrid.model.LayoutRow;
import work.pollochang.photogrid.model.RowFit;

import java.util.ArrayList;
import java.util.List;

/**
 * 智慧 (justified) 排版：每一列的張數不固定，依填充率挑選最接近可用寬度的組合。
 *
 * <p>挑選一列的流程：
 * <ol>
 *   <li>在目標列高的 0.8 ~ 1.2 倍 (並限制在列高上下限內) 依步進嘗試各高度，每個高度再嘗試 1 ~ N 張，
 *       取填充率落在理想區間內的最高者。</li>
 *   <li>若沒有，改以目標列高本身，從較多張往較少張嘗試，第一個達到退回門檻者即採用。</li>
 *   <li>仍沒有，取第二輪中不超出寬度的最佳填充，維持目標列高。</li>
 *   <li>連一張都放不下時，輸出縮放到可用寬度內的單張列。</li>
 * </ol>
 *
 * <p>前兩層選出的圖片會再撐滿整列 (列高限制在上下限內)。
 * 撐滿後若仍超出寬度，等比縮小；但縮小後低於列高下限時，寧可保留超出的列也不違反下限。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public final class JustifiedLayout {

    private JustifiedLayout() {}

    /**
     * 從 {@code images} 的開頭挑出一列。回傳的列至少包含一張圖片。
     *
     * @param images          尚未排版的圖片 (至少一張)
     * @param availableWidth  可用寬度，必須為正數
     * @param targetRowHeight 目標列高
     * @param spacing         圖片間距
     * @param constraints     搜尋範圍與門檻
     * @return 挑選出的列
     */
    public static LayoutRow findOptimalRow(List<ImageRecord> images, double availableWidth, double targetRowHeight,
                                           double spacing, LayoutConstraints constraints) {
        int searchCount = Math.min(images.size(), Math.max(constraints.maxImagesPerRowSearch(), constraints.fallbackMaxImagesPerRow()));
        double[] aspectSums = prefixAspectSums(images, searchCount);

        // 第一輪：高度範圍 x 張數
        double lowHeight = Math.max(constraints.minRowHeight(), targetRowHeight * constraints.heightRangeLow());
        double highHeight = Math.min(constraints.maxRowHeight(), targetRowHeight * constraints.heightRangeHigh());
        int firstPassCount = Math.min(images.size(), constraints.maxImagesPerRowSearch());

        int bestCount = 0;
        double bestFillRate = 0;
        int steps = lowHeight <= highHeight ? (int) Math.floor((highHeight - lowHeight) / constraints.heightStep() + 1e-9) : -1;
        for (int step = 0; step <= steps; step++) {
            double height = lowHeight + step * constraints.heightStep();
            for (int count = 1; count <= firstPassCount; count++) {
                double fillRate = candidateWidth(aspectSums[count], count, height, spacing) / availableWidth;
                if (fillRate > constraints.maxFillRate()) {
                    // 張數越多越寬，後面的候選只會更寬
                    break;
                }
                if (constraints.isInBand(fillRate) && fillRate > bestFillRate) {
                    bestFillRate = fillRate;
                    bestCount = count;
                }
            }
        }

        if (bestCount > 0) {
            log.trace("第一輪找到最佳組合: {} 張, 填充率 {}", bestCount, bestFillRate);
            return justifyRow(images.subList(0, bestCount), availableWidth, spacing, constraints, RowFit.IN_BAND);
        }

        // 第二輪：只用目標列高，從多張往少張嘗試
        int fallbackCount = Math.min(images.size(), constraints.fallbackMaxImagesPerRow());
        int bestFallbackCount = 0;
        double bestFallbackFillRate = 0;
        for (int count = fallbackCount; count >= 1; count--) {
            double fillRate = candidateWidth(aspectSums[count], count, targetRowHeight, spacing) / availableWidth;
            if (constraints.isAcceptableFallback(fillRate)) {
                log.trace("第二輪採用: {} 張, 填充率 {}", count, fillRate);
                return justifyRow(images.subList(0, count), availableWidth, spacing, constraints, RowFit.ACCEPTABLE);
            }
            if (fillRate <= constraints.maxFillRate() && fillRate > bestFallbackFillRate) {
                bestFallbackFillRate = fillRate;
                bestFallbackCount = count;
            }
        }

        if (bestFallbackCount > 0) {
            log.trace("未達退回門檻，取最佳填充: {} 張, 填充率 {}", bestFallbackCount, bestFallbackFillRate);
            return rowAtHeight(images.subList(0, bestFallbackCount), targetRowHeight, spacing, RowFit.BEST_EFFORT);
        }

        return singleImageRow(images.get(0), availableWidth, targetRowHeight, constraints);
    }

    /**
     * 讓圖片撐滿整列，列高限制在上下限內。
     */
    static LayoutRow justifyRow(List<ImageRecord> images, double availableWidth, double spacing,
                                LayoutConstraints constraints, RowFit fit) {
        int count = images.size();
        double totalSpacing = spacing * (count - 1);
        double aspectSum = 0;
        for (ImageRecord image : images) {
            aspectSum += image.aspectRatio();
        }

        double idealHeight = (availableWidth - totalSpacing) / aspectSum;
        double height = constraints.clampHeight(idealHeight);
        double imagesWidth = height * aspectSum;

        if (imagesWidth + totalSpacing > availableWidth) {
            double scale = (availableWidth - totalSpacing) / imagesWidth;
            if (height * scale >= constraints.minRowHeight()) {
                height *= scale;
            } else {
                log.debug("縮放後列高 {} 低於下限 {}，保留超出寬度的列", height * scale, constraints.minRowHeight());
            }
        }
        return rowAtHeight(images, height, spacing, fit);
    }

    /**
     * 單張列：維持目標列高 (限制在上下限內)，太寬時縮小到可用寬度。
     * 為了不超出寬度，這裡允許低於列高下限。
     */
    static LayoutRow singleImageRow(ImageRecord image, double availableWidth, double targetRowHeight,
                                    LayoutConstraints constraints) {
        double aspectRatio = image.aspectRatio();
        double height = constraints.clampHeight(targetRowHeight);
        if (height * aspectRatio > availableWidth) {
            height = availableWidth / aspectRatio;
        }
        return rowAtHeight(List.of(image), height, 0, RowFit.SINGLE_IMAGE);
    }

    static LayoutRow rowAtHeight(List<ImageRecord> images, double height, double spacing, RowFit fit) {
        List<ImageSize> sizes = new ArrayList<>(images.size());
        double totalWidth = spacing * (images.size() - 1);
        for (ImageRecord image : images) {
            double width = height * image.aspectRatio();
            sizes.add(new ImageSize(width, height));
            totalWidth += width;
        }
        return new LayoutRow(images, sizes, totalWidth, fit);
    }

    private static double candidateWidth(double aspectSum, int count, double height, double spacing) {
        return height * aspectSum + spacing * (count - 1);
    }

    private static double[] prefixAspectSums(List<ImageRecord> images, int count) {
        double[] sums = new double[count + 1];
        for (int i = 0; i < count; i++) {
            sums[i + 1] = sums[i] + images.get(i).aspectRatio();
        }
        return sums;
    }
}
