package rastr.domain.halftone;

import rastr.common.EHalftoneMode;
import rastr.common.ELayerSource;
import rastr.common.HalftoneConstants;
import rastr.domain.image.RgbColor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Layer recipes of the built-in modes, kept as data. A new N-tone mode is one more template list.
 * @since 19/10/2026
 */
public final class HalftoneRecipe {

    /**
     * Layer blueprint; the color comes from the settings' color list at the same index
     *
     * @param angleOffset      degrees added to the base screen angle
     * @param clearsBackground fill the canvas with the background first
     * @param source           image to sample
     */
    public record LayerTemplate(double angleOffset, boolean clearsBackground, ELayerSource source) {
    }

    private static final Map<EHalftoneMode, List<LayerTemplate>> TEMPLATES = new EnumMap<>(EHalftoneMode.class);

    static {
        TEMPLATES.put(EHalftoneMode.BASIC, List.of(
                new LayerTemplate(0, true, ELayerSource.ORIGINAL)));

        // Highlights over the whole tonal range, then shadows only
        TEMPLATES.put(EHalftoneMode.DUOTONE, List.of(
                new LayerTemplate(HalftoneConstants.DUOTONE_HIGHLIGHT_ANGLE_OFFSET, true, ELayerSource.ORIGINAL),
                new LayerTemplate(0, false, ELayerSource.SHADOW_MASK)));

        TEMPLATES.put(EHalftoneMode.TRITONE, List.of(
                new LayerTemplate(0, true, ELayerSource.ORIGINAL),
                new LayerTemplate(HalftoneConstants.TRITONE_SECOND_ANGLE_OFFSET, false, ELayerSource.ORIGINAL),
                new LayerTemplate(HalftoneConstants.TRITONE_THIRD_ANGLE_OFFSET, false, ELayerSource.ORIGINAL)));
    }

    private HalftoneRecipe() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static List<LayerTemplate> templatesFor(EHalftoneMode mode) {
        List<LayerTemplate> templates = TEMPLATES.get(mode);
        if (templates == null) {
            throw HalftoneException.invalidParameter("no recipe for mode " + mode);
        }
        return Collections.unmodifiableList(templates);
    }

    /**
     * Expand settings into a job, validating every parameter before anything is drawn
     */
    public static HalftoneJob buildJob(HalftoneSettings settings) {
        if (settings == null) {
            throw HalftoneException.invalidParameter("settings cannot be null");
        }
        if (settings.mode() == null) {
            throw HalftoneException.invalidParameter("halftone mode cannot be null");
        }
        List<LayerTemplate> templates = templatesFor(settings.mode());
        List<RgbColor> colors = settings.colors();
        if (colors.size() != templates.size()) {
            throw HalftoneException.invalidParameter(String.format(
                    "%s needs %d color(s), got %d", settings.mode(), templates.size(), colors.size()));
        }
        if (settings.background() == null) {
            throw HalftoneException.invalidParameter("background color cannot be null");
        }

        List<LayerSpec> layers = new ArrayList<>(templates.size());
        for (int i = 0; i < templates.size(); i++) {
            LayerTemplate template = templates.get(i);
            ScreenConfig screen = new ScreenConfig(
                    settings.screenAngle() + template.angleOffset(),
                    settings.dotSize(),
                    settings.dotResolution(),
                    colors.get(i),
                    settings.invert(),
                    settings.anchor());
            layers.add(new LayerSpec(
                    screen,
                    template.clearsBackground(),
                    template.clearsBackground() ? settings.background() : null,
                    template.source()));
        }
        return new HalftoneJob(layers, settings.supersample());
    }
}
