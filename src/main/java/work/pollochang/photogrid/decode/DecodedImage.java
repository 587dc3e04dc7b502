package work.pollochang.photogrid.decode;

import javax.imageio.ImageReader;
import java.awt.image.BufferedImage;

// 封裝解碼後的圖片和其讀取器，讀取器用完即釋放；圖片本身交由呼叫端決定是否保留
record DecodedImage(BufferedImage image, ImageReader reader) implements AutoCloseable {
    @Override
    public void close() {
        if (reader != null) {
            reader.dispose();
        }
    }
}
