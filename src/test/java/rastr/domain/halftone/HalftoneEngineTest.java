package rastr.domain.halftone;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import rastr.common.EAnchorStrategy;
import rastr.common.EHalftoneError;
import rastr.common.EHalftoneMode;
import rastr.dal.HalftoneConfig;
import rastr.domain.image.RasterImage;
import rastr.domain.image.RasterImages;
import rastr.domain.image.RgbColor;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests for HalftoneEngine
 * @since 19/10/2026
 */
class HalftoneEngineTest {

    private HalftoneEngine engine;

    @BeforeEach
    void setUp() {
        engine = new HalftoneEngine(HalftoneConfig.defaults());
    }

    private static HalftoneSettings basic(double dotSize, int resolution, double angle, EAnchorStrategy anchor) {
        return new HalftoneSettings(EHalftoneMode.BASIC, dotSize, resolution, angle, false, anchor,
                List.of(RgbColor.BLACK), RgbColor.WHITE, 2);
    }

    private static HalftoneConfig configWith(boolean downsample, long timeoutMs) {
        HalftoneConfig d = HalftoneConfig.defaults();
        return new HalftoneConfig(d.dotSize(), d.dotResolution(), d.screenAngle(), d.invert(), d.anchor(), d.mode(),
                d.color(), d.background(), d.duotoneColors(), d.tritoneColors(), d.supersample(), downsample, timeoutMs);
    }

    private static void assertError(Runnable action, EHalftoneError expected) {
        assertThatThrownBy(action::run)
                .isInstanceOf(HalftoneException.class)
                .satisfies(e -> assertThat(((HalftoneException) e).getError()).isEqualTo(expected));
    }

    @Test
    @DisplayName("Black source should get a dot at every grid cell on a supersampled canvas")
    void blackSourceShouldGetDotAtEveryCell() {
        // Given
        RasterImage source = RasterImages.uniform(400, 300, RgbColor.BLACK);

        // When
        HalftoneResult result = engine.convert(source, basic(10, 5, 0, EAnchorStrategy.TRADITIONAL));

        // Then
        RasterImage image = result.getImage();
        assertThat(image.getWidth()).isEqualTo(800);
        assertThat(image.getHeight()).isEqualTo(600);
        assertThat(result.getRecipe()).isEqualTo("BASIC");
        assertThat(result.getDrawnDots()).isEqualTo(4800);
        assertThat(result.getRejectedSamples()).isZero();

        // Tangent dots leave no gap between grid points
        assertThat(image.getRed(405, 305)).isZero();
        assertThat(image.getRed(0, 0)).isZero();
        assertThat(image.getAlpha(405, 305)).isEqualTo(255);
    }

    @Test
    @DisplayName("White source should leave the background untouched")
    void whiteSourceShouldLeaveBackground() {
        // Given
        RasterImage source = RasterImages.uniform(50, 40, RgbColor.WHITE);

        // When
        HalftoneResult result = engine.convert(source, basic(10, 5, 45, EAnchorStrategy.TRADITIONAL));

        // Then
        assertThat(result.getDrawnDots()).isZero();
        assertThat(result.getImage().contentEquals(RasterImages.uniform(100, 80, RgbColor.WHITE))).isTrue();
    }

    @Test
    @DisplayName("Same input should give identical output")
    void conversionShouldBeDeterministic() {
        // Given
        RasterImage source = RasterImages.uniform(60, 40, new RgbColor(90, 140, 200));
        for (int x = 0; x < 60; x++) {
            source.setPixel(x, x % 40, new RgbColor(x * 4, 0, 255 - x * 4));
        }
        HalftoneSettings settings = HalftoneConfig.defaults().toSettings(EHalftoneMode.TRITONE);

        // When
        HalftoneResult first = engine.convert(source, settings);
        HalftoneResult second = engine.convert(source, settings);

        // Then
        assertThat(first.getImage().contentEquals(second.getImage())).isTrue();
        assertThat(first.getLayers()).isEqualTo(second.getLayers());
    }

    @Test
    @DisplayName("Legacy and traditional anchoring should agree on an unrotated screen")
    void anchorsShouldAgreeUnrotated() {
        // Given
        RasterImage source = RasterImages.uniform(40, 30, new RgbColor(60, 60, 60));

        // When
        RasterImage traditional = engine.convert(source, basic(8, 4, 0, EAnchorStrategy.TRADITIONAL)).getImage();
        RasterImage legacy = engine.convert(source, basic(8, 4, 0, EAnchorStrategy.LEGACY)).getImage();

        // Then
        assertThat(traditional.contentEquals(legacy)).isTrue();
    }

    @Test
    @DisplayName("Missing source should fail before any parameter is examined")
    void missingSourceShouldFail() {
        assertError(() -> engine.convert(null, null), EHalftoneError.SOURCE_IMAGE_MISSING);
        assertError(() -> engine.render(null, null), EHalftoneError.SOURCE_IMAGE_MISSING);
    }

    @Test
    @DisplayName("Invalid settings should fail without drawing")
    void invalidSettingsShouldFail() {
        // Given
        LayerCompositor compositor = mock(LayerCompositor.class);
        HalftoneEngine mockedEngine = new HalftoneEngine(HalftoneConfig.defaults(), compositor);
        RasterImage source = RasterImages.uniform(10, 10, RgbColor.BLACK);

        // When / Then
        assertError(() -> mockedEngine.convert(source, basic(10, 0, 0, EAnchorStrategy.TRADITIONAL)),
                EHalftoneError.INVALID_PARAMETER);
        assertError(() -> mockedEngine.convert(source, basic(-2, 5, 0, EAnchorStrategy.TRADITIONAL)),
                EHalftoneError.INVALID_PARAMETER);
        assertError(() -> mockedEngine.render(source, null), EHalftoneError.INVALID_PARAMETER);
        verifyNoInteractions(compositor);
    }

    @Test
    @DisplayName("Engine should hand the compositor a canvas of the supersampled size")
    void engineShouldAllocateSupersampledCanvas() {
        // Given
        LayerCompositor compositor = mock(LayerCompositor.class);
        when(compositor.composite(any(), any(), any(), any())).thenReturn(List.of());
        HalftoneEngine mockedEngine = new HalftoneEngine(HalftoneConfig.defaults(), compositor);
        RasterImage source = RasterImages.uniform(30, 20, RgbColor.BLACK);
        HalftoneJob job = new HalftoneJob(List.of(LayerSpec.base(
                new ScreenConfig(0, 6, 3, RgbColor.BLACK, false, EAnchorStrategy.TRADITIONAL), RgbColor.WHITE)), 3);

        // When
        HalftoneResult result = mockedEngine.render(source, job);

        // Then
        assertThat(result.getRecipe()).isEqualTo("CUSTOM");
        assertThat(result.getImage().getWidth()).isEqualTo(90);
        assertThat(result.getImage().getHeight()).isEqualTo(60);
        verify(compositor).composite(eq(source), eq(job), any(RasterImage.class), eq(ICancellationHook.NONE));
    }

    @Test
    @DisplayName("Configured downsampling should return a nominal-size image")
    void downsampleShouldReturnNominalSize() {
        // Given
        HalftoneEngine downsampling = new HalftoneEngine(configWith(true, 0));
        RasterImage source = RasterImages.uniform(40, 30, RgbColor.BLACK);

        // When
        HalftoneResult result = downsampling.convert(source, basic(10, 5, 0, EAnchorStrategy.TRADITIONAL));

        // Then
        assertThat(result.getImage().getWidth()).isEqualTo(40);
        assertThat(result.getImage().getHeight()).isEqualTo(30);
        assertThat(result.getImage().getRed(20, 15)).isZero();
    }

    @Test
    @DisplayName("Fired cancellation hook should abort the conversion")
    void cancellationShouldAbort() {
        RasterImage source = RasterImages.uniform(40, 30, RgbColor.BLACK);

        assertError(() -> engine.convert(source, basic(10, 5, 0, EAnchorStrategy.TRADITIONAL), () -> true),
                EHalftoneError.CANCELLED);
        assertError(() -> engine.convert(source, basic(10, 5, 0, EAnchorStrategy.TRADITIONAL),
                ICancellationHook.deadline(Duration.ZERO)), EHalftoneError.CANCELLED);
    }

    @Test
    @DisplayName("Caller-owned canvas should receive the layers")
    void renderIntoShouldDrawOnCallerCanvas() {
        // Given
        RasterImage source = RasterImages.uniform(20, 20, RgbColor.BLACK);
        HalftoneJob job = HalftoneRecipe.buildJob(basic(10, 5, 0, EAnchorStrategy.TRADITIONAL));
        RasterImage target = RasterImage.blank(40, 40);

        // When
        List<LayerStats> stats = engine.renderInto(source, job, target, null);

        // Then
        assertThat(stats).hasSize(1);
        assertThat(target.getAlpha(21, 21)).isEqualTo(255);
        assertThat(target.getRed(21, 21)).isZero();
    }

    @Test
    @DisplayName("Summary JSON should carry the metadata without pixels")
    void summaryJsonShouldCarryMetadata() {
        // Given
        RasterImage source = RasterImages.uniform(20, 10, RgbColor.BLACK);
        HalftoneResult result = engine.convert(source, HalftoneConfig.defaults().toSettings(EHalftoneMode.DUOTONE));

        // When
        String json = result.toSummaryJson();

        // Then
        assertThat(json)
                .contains("\"mode\": \"DUOTONE\"")
                .contains("\"drawn_dots\"")
                .contains("\"rejected_samples\"")
                .contains("\"dot_resolution\": 5")
                .contains("\"SHADOW_MASK\"")
                .doesNotContain("pixels");
    }
}
