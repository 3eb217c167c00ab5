package rastr.domain.halftone;

import rastr.common.EAnchorStrategy;
import rastr.common.EHalftoneMode;
import rastr.domain.image.RgbColor;

import java.util.List;

/**
 * User-facing conversion parameters, turned into a {@link HalftoneJob} by {@link HalftoneRecipe}
 *
 * @param mode          recipe
 * @param dotSize       maximum dot diameter
 * @param dotResolution grid step
 * @param screenAngle   base screen angle in degrees
 * @param invert        bright areas get the large dots
 * @param anchor        dot anchoring
 * @param colors        one color per recipe layer
 * @param background    canvas color
 * @param supersample   output scale
 * @since 19/10/2026
 */
public record HalftoneSettings(
        EHalftoneMode mode,
        double dotSize,
        int dotResolution,
        double screenAngle,
        boolean invert,
        EAnchorStrategy anchor,
        List<RgbColor> colors,
        RgbColor background,
        int supersample) {

    public HalftoneSettings {
        if (colors == null) {
            colors = List.of();
        } else {
            for (int i = 0; i < colors.size(); i++) {
                if (colors.get(i) == null) {
                    throw HalftoneException.invalidParameter("color " + i + " is null");
                }
            }
            colors = List.copyOf(colors);
        }
    }

    public HalftoneSettings withMode(EHalftoneMode newMode, List<RgbColor> newColors) {
        return new HalftoneSettings(newMode, dotSize, dotResolution, screenAngle, invert, anchor,
                newColors, background, supersample);
    }

    public HalftoneSettings withAnchor(EAnchorStrategy newAnchor) {
        return new HalftoneSettings(mode, dotSize, dotResolution, screenAngle, invert, newAnchor,
                colors, background, supersample);
    }
}
