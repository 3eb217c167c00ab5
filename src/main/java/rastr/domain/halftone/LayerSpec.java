package rastr.domain.halftone;

import rastr.common.ELayerSource;
import rastr.domain.image.RgbColor;

/**
 * One halftone pass of a job
 *
 * @param screen            screen parameters of the pass
 * @param clearsBackground  fill the canvas with {@code background} before drawing; only valid for the first layer
 * @param background        canvas color, required when {@code clearsBackground} is set
 * @param source            image the pass samples
 * @since 19/10/2026
 */
public record LayerSpec(
        ScreenConfig screen,
        boolean clearsBackground,
        RgbColor background,
        ELayerSource source) {

    public LayerSpec {
        if (screen == null) {
            throw HalftoneException.invalidParameter("layer screen cannot be null");
        }
        if (clearsBackground && background == null) {
            throw HalftoneException.invalidParameter("background color is required for a layer that clears the canvas");
        }
        if (source == null) {
            source = ELayerSource.ORIGINAL;
        }
    }

    /**
     * First layer of a job: clears the canvas and samples the original image
     */
    public static LayerSpec base(ScreenConfig screen, RgbColor background) {
        return new LayerSpec(screen, true, background, ELayerSource.ORIGINAL);
    }

    /**
     * Layer drawn on top of whatever is already on the canvas
     */
    public static LayerSpec overlay(ScreenConfig screen, ELayerSource source) {
        return new LayerSpec(screen, false, null, source);
    }
}
