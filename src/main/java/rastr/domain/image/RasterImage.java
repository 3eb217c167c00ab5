package rastr.domain.image;

import rastr.common.HalftoneConstants;

import java.util.Arrays;

/**
 * Row-major RGBA8 pixel buffer with a top-left origin.
 * Not thread-safe for writing; concurrent readers are fine.
 * @since 19/10/2026
 */
public final class RasterImage {
    public static final int CHANNELS = 4;

    private final int width;
    private final int height;
    private final byte[] pixels;

    /**
     * Wrap an existing buffer, no copy is made
     */
    public RasterImage(int width, int height, byte[] pixels) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        if (pixels == null) {
            throw new IllegalArgumentException("Pixel buffer cannot be null");
        }
        long expected = (long) width * height * CHANNELS;
        if (pixels.length != expected) {
            throw new IllegalArgumentException(String.format(
                    "Pixel buffer has %d bytes, %dx%d RGBA needs %d", pixels.length, width, height, expected));
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    /**
     * Fully transparent image
     */
    public static RasterImage blank(int width, int height) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        return new RasterImage(width, height, new byte[Math.multiplyExact(Math.multiplyExact(width, height), CHANNELS)]);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * Backing buffer, writes are visible to this image
     */
    public byte[] getPixels() {
        return pixels;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    private int offset(int x, int y) {
        if (!contains(x, y)) {
            throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") outside " + width + "x" + height);
        }
        return (y * width + x) * CHANNELS;
    }

    public int getRed(int x, int y) {
        return pixels[offset(x, y)] & 0xFF;
    }

    public int getGreen(int x, int y) {
        return pixels[offset(x, y) + 1] & 0xFF;
    }

    public int getBlue(int x, int y) {
        return pixels[offset(x, y) + 2] & 0xFF;
    }

    public int getAlpha(int x, int y) {
        return pixels[offset(x, y) + 3] & 0xFF;
    }

    /**
     * Perceptual brightness 0.299R + 0.587G + 0.114B, alpha ignored
     */
    public double getLuminance(int x, int y) {
        int i = offset(x, y);
        return HalftoneConstants.LUMA_RED * (pixels[i] & 0xFF)
                + HalftoneConstants.LUMA_GREEN * (pixels[i + 1] & 0xFF)
                + HalftoneConstants.LUMA_BLUE * (pixels[i + 2] & 0xFF);
    }

    public void setPixel(int x, int y, int red, int green, int blue, int alpha) {
        int i = offset(x, y);
        pixels[i] = (byte) red;
        pixels[i + 1] = (byte) green;
        pixels[i + 2] = (byte) blue;
        pixels[i + 3] = (byte) alpha;
    }

    public void setPixel(int x, int y, RgbColor color) {
        setPixel(x, y, color.red(), color.green(), color.blue(), 255);
    }

    /**
     * Paint every pixel with the opaque color
     */
    public void fill(RgbColor color) {
        byte r = (byte) color.red();
        byte g = (byte) color.green();
        byte b = (byte) color.blue();
        for (int i = 0; i < pixels.length; i += CHANNELS) {
            pixels[i] = r;
            pixels[i + 1] = g;
            pixels[i + 2] = b;
            pixels[i + 3] = (byte) 0xFF;
        }
    }

    public boolean hasSameSize(RasterImage other) {
        return other != null && other.width == width && other.height == height;
    }

    public RasterImage copy() {
        return new RasterImage(width, height, Arrays.copyOf(pixels, pixels.length));
    }

    /**
     * Pixel-for-pixel comparison
     */
    public boolean contentEquals(RasterImage other) {
        return hasSameSize(other) && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public String toString() {
        return "RasterImage{" + width + "x" + height + "}";
    }
}
