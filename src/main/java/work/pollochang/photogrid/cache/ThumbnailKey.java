package work.pollochang.photogrid.cache;

import work.pollochang.photogrid.model.ImageRecord;
import work.pollochang.photogrid.model.ThumbnailSize;

/**
 * 縮圖快取的 Key：同一張圖片在不同尺寸下各自快取。
 */
public record ThumbnailKey(String imageId, int targetWidth, int targetHeight) {

    public static ThumbnailKey of(ImageRecord record, ThumbnailSize size) {
        return new ThumbnailKey(record.id(), size.width(), size.height());
    }
}
