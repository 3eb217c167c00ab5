package rastr.domain.halftone;

import rastr.common.HalftoneConstants;

import java.util.Arrays;
import java.util.List;

/**
 * Ordered layer passes sharing one source image and one output canvas
 *
 * @param layers      1 to {@link HalftoneConstants#MAX_LAYERS} layers, drawn in order
 * @param supersample output canvas scale relative to the source size
 * @since 19/10/2026
 */
public record HalftoneJob(List<LayerSpec> layers, int supersample) {

    public HalftoneJob {
        if (layers == null || layers.isEmpty()) {
            throw HalftoneException.invalidParameter("a job needs at least one layer");
        }
        if (layers.size() > HalftoneConstants.MAX_LAYERS) {
            throw HalftoneException.invalidParameter(String.format(
                    "a job supports at most %d layers, got %d", HalftoneConstants.MAX_LAYERS, layers.size()));
        }
        for (int i = 0; i < layers.size(); i++) {
            LayerSpec layer = layers.get(i);
            if (layer == null) {
                throw HalftoneException.invalidParameter("layer " + i + " is null");
            }
            if (i > 0 && layer.clearsBackground()) {
                throw HalftoneException.invalidParameter("only the first layer may clear the background, layer " + i + " does");
            }
        }
        if (supersample < 1 || supersample > HalftoneConstants.MAX_SUPERSAMPLE_FACTOR) {
            throw HalftoneException.invalidParameter(String.format(
                    "supersample factor must be between 1 and %d, got %d",
                    HalftoneConstants.MAX_SUPERSAMPLE_FACTOR, supersample));
        }
        layers = List.copyOf(layers);
    }

    public static HalftoneJob of(LayerSpec... layers) {
        return new HalftoneJob(Arrays.asList(layers), HalftoneConstants.SUPERSAMPLE_FACTOR);
    }

    public boolean clearsBackground() {
        return layers.get(0).clearsBackground();
    }

    public int outputWidth(int sourceWidth) {
        return Math.multiplyExact(sourceWidth, supersample);
    }

    public int outputHeight(int sourceHeight) {
        return Math.multiplyExact(sourceHeight, supersample);
    }
}
