package rastr.domain.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;

/**
 * Conversions between {@link RasterImage} and AWT images, plus small buffer helpers
 * @since 19/10/2026
 */
public final class RasterImages {
    private static final Logger logger = LoggerFactory.getLogger(RasterImages.class);

    private RasterImages() {
        throw new AssertionError("Utility class cannot be instantiated.");
    }

    /**
     * Copy any AWT image into a new RGBA buffer
     */
    public static RasterImage fromBufferedImage(BufferedImage image) {
        if (image == null) {
            throw new IllegalArgumentException("Image cannot be null");
        }
        int width = image.getWidth();
        int height = image.getHeight();
        RasterImage raster = RasterImage.blank(width, height);

        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                int argb = row[x];
                raster.setPixel(x, y,
                        (argb >> 16) & 0xFF,
                        (argb >> 8) & 0xFF,
                        argb & 0xFF,
                        (argb >>> 24) & 0xFF);
            }
        }
        return raster;
    }

    /**
     * Copy the buffer into a TYPE_INT_ARGB image, ready for ImageIO encoding by the caller
     */
    public static BufferedImage toBufferedImage(RasterImage raster) {
        int width = raster.getWidth();
        int height = raster.getHeight();
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);

        byte[] pixels = raster.getPixels();
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            int i = y * width * RasterImage.CHANNELS;
            for (int x = 0; x < width; x++, i += RasterImage.CHANNELS) {
                row[x] = ((pixels[i + 3] & 0xFF) << 24)
                        | ((pixels[i] & 0xFF) << 16)
                        | ((pixels[i + 1] & 0xFF) << 8)
                        | (pixels[i + 2] & 0xFF);
            }
            image.setRGB(0, y, width, 1, row, 0, width);
        }
        return image;
    }

    /**
     * Opaque single-color image
     */
    public static RasterImage uniform(int width, int height, RgbColor color) {
        RasterImage image = RasterImage.blank(width, height);
        image.fill(color);
        return image;
    }

    /**
     * Box-filter the image down by an integer factor. Partial blocks at the right and bottom edges are
     * averaged over the pixels they actually contain.
     */
    public static RasterImage downsample(RasterImage source, int factor) {
        if (factor < 1) {
            throw new IllegalArgumentException("Downsample factor must be at least 1: " + factor);
        }
        if (factor == 1) {
            return source.copy();
        }

        int width = Math.max(1, (source.getWidth() + factor - 1) / factor);
        int height = Math.max(1, (source.getHeight() + factor - 1) / factor);
        RasterImage target = RasterImage.blank(width, height);
        byte[] src = source.getPixels();

        for (int ty = 0; ty < height; ty++) {
            for (int tx = 0; tx < width; tx++) {
                long r = 0, g = 0, b = 0, a = 0;
                int count = 0;
                int maxY = Math.min(source.getHeight(), (ty + 1) * factor);
                int maxX = Math.min(source.getWidth(), (tx + 1) * factor);
                for (int sy = ty * factor; sy < maxY; sy++) {
                    int i = (sy * source.getWidth() + tx * factor) * RasterImage.CHANNELS;
                    for (int sx = tx * factor; sx < maxX; sx++, i += RasterImage.CHANNELS) {
                        r += src[i] & 0xFF;
                        g += src[i + 1] & 0xFF;
                        b += src[i + 2] & 0xFF;
                        a += src[i + 3] & 0xFF;
                        count++;
                    }
                }
                target.setPixel(tx, ty,
                        (int) Math.round((double) r / count),
                        (int) Math.round((double) g / count),
                        (int) Math.round((double) b / count),
                        (int) Math.round((double) a / count));
            }
        }

        logger.debug("Downsampled {}x{} to {}x{} (factor {})",
                source.getWidth(), source.getHeight(), width, height, factor);
        return target;
    }
}
