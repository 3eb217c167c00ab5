package rastr.domain.halftone;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import rastr.domain.image.RasterImage;

import java.util.List;

/**
 * Output of one conversion plus the metadata the caller persists next to it
 * @since 19/10/2026
 */
public class HalftoneResult {
    private static final Gson gson = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .setPrettyPrinting()
            .create();

    private final RasterImage image;
    private final String recipe;
    private final HalftoneJob job;
    private final List<LayerStats> layers;
    private final long elapsedMillis;

    public HalftoneResult(RasterImage image, String recipe, HalftoneJob job, List<LayerStats> layers, long elapsedMillis) {
        this.image = image;
        this.recipe = recipe;
        this.job = job;
        this.layers = List.copyOf(layers);
        this.elapsedMillis = elapsedMillis;
    }

    public RasterImage getImage() {
        return image;
    }

    /**
     * Mode name, or CUSTOM for a hand-built job
     */
    public String getRecipe() {
        return recipe;
    }

    public HalftoneJob getJob() {
        return job;
    }

    public List<LayerStats> getLayers() {
        return layers;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    public int getDrawnDots() {
        return layers.stream().mapToInt(LayerStats::drawnDots).sum();
    }

    /**
     * Grid cells skipped across all layers because they fell outside the source or on transparent pixels
     */
    public int getRejectedSamples() {
        return layers.stream().mapToInt(LayerStats::rejectedSamples).sum();
    }

    /**
     * Metadata only, no pixels
     */
    public String toSummaryJson() {
        ScreenConfig base = job.layers().get(0).screen();
        Summary summary = new Summary(
                recipe,
                new Parameters(base.dotSize(), base.dotResolution(), base.angle(), base.invert(),
                        base.anchor().name(), job.supersample()),
                new int[]{image.getWidth(), image.getHeight()},
                layers,
                getDrawnDots(),
                getRejectedSamples(),
                elapsedMillis);
        return gson.toJson(summary);
    }

    private record Parameters(double dotSize, int dotResolution, double screenAngle, boolean invert,
                              String anchor, int supersample) {
    }

    private record Summary(String mode, Parameters parameters, int[] outputSize, List<LayerStats> layers,
                           int drawnDots, int rejectedSamples, long elapsedMs) {
    }

    @Override
    public String toString() {
        return String.format("HalftoneResult{recipe=%s, size=%dx%d, dots=%d, rejected=%d, %dms}",
                recipe, image.getWidth(), image.getHeight(), getDrawnDots(), getRejectedSamples(), elapsedMillis);
    }
}
