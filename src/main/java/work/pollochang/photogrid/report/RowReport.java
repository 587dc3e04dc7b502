package work.pollochang.photogrid.report;

import work.pollochang.photogrid.model.RowFit;

import java.util.List;

public record RowReport(int index, int imageCount, double height, double totalWidth, double fillRate, RowFit fit,
                        List<ImagePlacement> images) {

    public record ImagePlacement(String id, double width, double height) {}
}
