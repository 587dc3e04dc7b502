package work.pollochang.photogrid.decode;

import work.pollochang.photogrid.model.ImageRecord;
import work.pollochang.photogrid.model.ThumbnailSize;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * 讀檔並產生縮圖。實作會在背景執行緒上被呼叫，必須是執行緒安全的。
 */
@FunctionalInterface
public interface ThumbnailDecoder {

    /**
     * @param record 來源圖片
     * @param targetSize 縮圖要放入的方框
     * @return 縮圖，尺寸不超過 {@code targetSize}
     * @throws IOException 檔案不存在、不可讀、格式不支援或內容損毀
     */
    BufferedImage decode(ImageRecord record, ThumbnailSize targetSize) throws IOException;
}
