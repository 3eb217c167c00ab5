package rastr.domain.halftone;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rastr.dal.HalftoneConfig;
import rastr.domain.image.RasterImage;
import rastr.domain.image.RasterImages;

import java.time.Duration;
import java.util.List;

/**
 * Entry point of the halftone conversion.
 * <p>
 * Every call is a pure function of the source image and the job: parameters are validated first, then a
 * fresh canvas is allocated and handed to the caller. The engine keeps no mutable state, so one instance
 * can serve concurrent calls that share a read-only source.
 *
 * @since 19/10/2026
 */
public class HalftoneEngine {
    private static final Logger logger = LoggerFactory.getLogger(HalftoneEngine.class);
    private static final String CUSTOM_RECIPE = "CUSTOM";

    private final HalftoneConfig config;
    private final LayerCompositor compositor;

    public HalftoneEngine(HalftoneConfig config) {
        this(config, new LayerCompositor());
    }

    public HalftoneEngine(HalftoneConfig config, LayerCompositor compositor) {
        this.config = config != null ? config : HalftoneConfig.defaults();
        this.compositor = compositor;
    }

    public HalftoneConfig getConfig() {
        return config;
    }

    /**
     * Settings made of the configured defaults
     */
    public HalftoneSettings defaultSettings() {
        return config.toSettings();
    }

    public HalftoneResult convert(RasterImage source, HalftoneSettings settings) {
        return convert(source, settings, defaultCancellationHook());
    }

    /**
     * Expand {@code settings} through the recipe of its mode and render it
     */
    public HalftoneResult convert(RasterImage source, HalftoneSettings settings, ICancellationHook cancellationHook) {
        if (source == null) {
            throw HalftoneException.sourceImageMissing();
        }
        HalftoneJob job = HalftoneRecipe.buildJob(settings);
        return execute(source, job, settings.mode().name(), cancellationHook);
    }

    public HalftoneResult render(RasterImage source, HalftoneJob job) {
        return render(source, job, defaultCancellationHook());
    }

    /**
     * Render a hand-built job
     */
    public HalftoneResult render(RasterImage source, HalftoneJob job, ICancellationHook cancellationHook) {
        if (source == null) {
            throw HalftoneException.sourceImageMissing();
        }
        if (job == null) {
            throw HalftoneException.invalidParameter("job cannot be null");
        }
        return execute(source, job, CUSTOM_RECIPE, cancellationHook);
    }

    /**
     * Render into a canvas owned by the caller. It must be the supersampled size of the source.
     * The canvas content is undefined if the call fails.
     */
    public List<LayerStats> renderInto(RasterImage source, HalftoneJob job, RasterImage target,
                                       ICancellationHook cancellationHook) {
        if (source == null) {
            throw HalftoneException.sourceImageMissing();
        }
        if (job == null) {
            throw HalftoneException.invalidParameter("job cannot be null");
        }
        return compositor.composite(source, job, target, hookOrNone(cancellationHook));
    }

    private HalftoneResult execute(RasterImage source, HalftoneJob job, String recipe, ICancellationHook cancellationHook) {
        long started = System.nanoTime();

        RasterImage canvas = RasterImage.blank(job.outputWidth(source.getWidth()), job.outputHeight(source.getHeight()));
        List<LayerStats> stats = compositor.composite(source, job, canvas, hookOrNone(cancellationHook));

        RasterImage output = canvas;
        if (config.outputDownsample() && job.supersample() > 1) {
            output = RasterImages.downsample(canvas, job.supersample());
        }

        long elapsed = (System.nanoTime() - started) / 1_000_000;
        HalftoneResult result = new HalftoneResult(output, recipe, job, stats, elapsed);
        logger.info("Halftone {} {}x{} -> {}x{}: {} layer(s), {} dots, {} samples rejected in {} ms",
                recipe, source.getWidth(), source.getHeight(), output.getWidth(), output.getHeight(),
                stats.size(), result.getDrawnDots(), result.getRejectedSamples(), elapsed);
        return result;
    }

    private ICancellationHook defaultCancellationHook() {
        if (config.hasTimeout()) {
            return ICancellationHook.deadline(Duration.ofMillis(config.timeoutMs()));
        }
        return ICancellationHook.NONE;
    }

    private static ICancellationHook hookOrNone(ICancellationHook hook) {
        return hook != null ? hook : ICancellationHook.NONE;
    }
}
