package rastr.domain.halftone;

import rastr.common.HalftoneConstants;
import rastr.domain.image.RasterImage;

/**
 * Builds the shadow-only image sampled by the duotone shadow layer.
 * Luminance below the threshold is stretched over the full 0..255 range; everything brighter
 * becomes white and therefore draws no dot.
 *
 * @since 19/10/2026
 */
public final class ShadowMaskFactory {

    private ShadowMaskFactory() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static double remap(double luminance) {
        if (luminance < HalftoneConstants.SHADOW_THRESHOLD) {
            return DotRasterizer.map(luminance, 0, HalftoneConstants.SHADOW_THRESHOLD, 0, HalftoneConstants.MAX_LUMINANCE);
        }
        return HalftoneConstants.MAX_LUMINANCE;
    }

    /**
     * Grayscale copy of {@code source} with remapped luminance. Source alpha is kept so transparent
     * areas stay unsampled.
     */
    public static RasterImage derive(RasterImage source) {
        if (source == null) {
            throw HalftoneException.sourceImageMissing();
        }
        RasterImage mask = RasterImage.blank(source.getWidth(), source.getHeight());
        for (int y = 0; y < source.getHeight(); y++) {
            for (int x = 0; x < source.getWidth(); x++) {
                int value = (int) Math.min(255, Math.round(remap(source.getLuminance(x, y))));
                mask.setPixel(x, y, value, value, value, source.getAlpha(x, y));
            }
        }
        return mask;
    }
}
