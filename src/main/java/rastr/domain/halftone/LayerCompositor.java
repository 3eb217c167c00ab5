package rastr.domain.halftone;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rastr.common.ELayerSource;
import rastr.domain.image.RasterImage;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the layers of a job, in order, onto one shared canvas. Later layers paint over earlier ones.
 * Holds no state between calls.
 *
 * @since 19/10/2026
 */
public class LayerCompositor {
    private static final Logger logger = LoggerFactory.getLogger(LayerCompositor.class);

    /**
     * Draw every layer of {@code job} onto {@code target}
     *
     * @param source           nominal-size source image
     * @param job              validated job
     * @param target           canvas of exactly source size times {@code job.supersample()}
     * @param cancellationHook polled once per grid row
     * @return statistics per layer, in job order
     */
    public List<LayerStats> composite(RasterImage source, HalftoneJob job, RasterImage target,
                                      ICancellationHook cancellationHook) {
        if (source == null) {
            throw HalftoneException.sourceImageMissing();
        }
        if (target == null
                || target.getWidth() != job.outputWidth(source.getWidth())
                || target.getHeight() != job.outputHeight(source.getHeight())) {
            throw HalftoneException.invalidParameter(String.format(
                    "target canvas must be %dx%d", job.outputWidth(source.getWidth()), job.outputHeight(source.getHeight())));
        }

        List<LayerStats> stats = new ArrayList<>(job.layers().size());
        RasterImage shadowMask = null;

        for (int i = 0; i < job.layers().size(); i++) {
            LayerSpec layer = job.layers().get(i);

            if (layer.clearsBackground()) {
                target.fill(layer.background());
            }

            RasterImage layerSource = source;
            if (layer.source() == ELayerSource.SHADOW_MASK) {
                if (shadowMask == null) {
                    shadowMask = ShadowMaskFactory.derive(source);
                }
                layerSource = shadowMask;
            }

            GridSampler sampler = GridSampler.forScreen(layerSource, layer.screen(), cancellationHook);
            DotRasterizer rasterizer = new DotRasterizer(target, layer.screen(), job.supersample());
            for (DotSample sample : sampler) {
                rasterizer.draw(sample);
            }

            LayerStats layerStats = new LayerStats(
                    i,
                    layer.screen().angle(),
                    layer.screen().color().toHex(),
                    layer.source(),
                    rasterizer.getDrawnCount(),
                    rasterizer.getBelowThresholdCount(),
                    sampler.getRejectedCount());
            logger.debug("Layer {}: angle={} color={} source={} drawn={} invisible={} rejected={}",
                    i, layerStats.angle(), layerStats.color(), layerStats.source(),
                    layerStats.drawnDots(), layerStats.invisibleDots(), layerStats.rejectedSamples());
            stats.add(layerStats);
        }

        return stats;
    }
}
