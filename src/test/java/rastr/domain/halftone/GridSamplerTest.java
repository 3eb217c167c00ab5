package rastr.domain.halftone;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import rastr.common.EAnchorStrategy;
import rastr.common.EHalftoneError;
import rastr.domain.image.RasterImage;
import rastr.domain.image.RasterImages;
import rastr.domain.image.RgbColor;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for GridSampler
 * @since 19/10/2026
 */
@ExtendWith(MockitoExtension.class)
class GridSamplerTest {

    private static final RgbColor MID_GRAY = new RgbColor(127, 127, 127);

    @Mock
    private ICancellationHook cancellationHook;

    private static ScreenConfig screen(double angle, int resolution, EAnchorStrategy anchor) {
        return new ScreenConfig(angle, 10, resolution, RgbColor.BLACK, false, anchor);
    }

    private static List<DotSample> collect(GridSampler sampler) {
        List<DotSample> samples = new ArrayList<>();
        sampler.forEach(samples::add);
        return samples;
    }

    @ParameterizedTest
    @ValueSource(doubles = {0, 45, 90})
    @DisplayName("Mid-gray source should give radius about 2.5 at every cell")
    void midGrayShouldGiveQuarterDotSize(double angle) {
        // Given
        RasterImage source = RasterImages.uniform(100, 100, MID_GRAY);
        ScreenConfig screen = screen(angle, 8, EAnchorStrategy.TRADITIONAL);

        // When
        List<DotSample> samples = collect(GridSampler.forScreen(source, screen, ICancellationHook.NONE));

        // Then
        assertThat(samples).isNotEmpty();
        for (DotSample sample : samples) {
            assertThat(sample.luminance()).isCloseTo(127.0, within(1e-6));
            assertThat(DotRasterizer.radiusFor(sample.luminance(), screen.dotSize(), screen.invert()))
                    .isCloseTo(2.5, within(0.5));
        }
    }

    @Test
    @DisplayName("Unrotated grid should visit every cell of the canvas")
    void unrotatedGridShouldVisitEveryCell() {
        // Given
        RasterImage source = RasterImages.uniform(400, 300, RgbColor.BLACK);
        GridSampler sampler = GridSampler.forScreen(source, screen(0, 5, EAnchorStrategy.TRADITIONAL), null);

        // When
        List<DotSample> samples = collect(sampler);

        // Then
        assertThat(samples).hasSize(80 * 60);
        assertThat(sampler.getEmittedCount()).isEqualTo(4800);
        assertThat(sampler.getRejectedCount()).isZero();
        assertThat(samples.get(0).anchor().x()).isEqualTo(0.0);
        assertThat(samples.get(1).anchor().x()).isEqualTo(5.0);
        assertThat(samples.get(80).anchor().y()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Rotated grid should drop cells that map outside the source")
    void rotatedGridShouldDropOutOfBoundsCells() {
        // Given
        RasterImage source = RasterImages.uniform(100, 60, MID_GRAY);
        GridSampler sampler = GridSampler.forScreen(source, screen(30, 4, EAnchorStrategy.TRADITIONAL), ICancellationHook.NONE);

        // When
        List<DotSample> samples = collect(sampler);

        // Then
        assertThat(sampler.getOutOfBoundsCount()).isPositive();
        assertThat(sampler.getTransparentCount()).isZero();
        assertThat(sampler.getEmittedCount() + sampler.getRejectedCount())
                .isEqualTo((int) sampler.getBounds().cellCount(4));
        assertThat(samples).allSatisfy(sample -> {
            assertThat(sample.samplePoint().x()).isGreaterThanOrEqualTo(0).isLessThan(100);
            assertThat(sample.samplePoint().y()).isGreaterThanOrEqualTo(0).isLessThan(60);
        });
    }

    @Test
    @DisplayName("Transparent pixels should produce no sample")
    void transparentPixelsShouldProduceNoSample() {
        // Given - blank image is fully transparent
        RasterImage source = RasterImage.blank(10, 10);
        GridSampler sampler = GridSampler.forScreen(source, screen(0, 5, EAnchorStrategy.TRADITIONAL), ICancellationHook.NONE);

        // When
        List<DotSample> samples = collect(sampler);

        // Then
        assertThat(samples).isEmpty();
        assertThat(sampler.getTransparentCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should sample the pixel under the floored inverse-rotated point")
    void shouldSampleFlooredPixel() {
        // Given - left half black, right half white
        RasterImage source = RasterImages.uniform(20, 10, RgbColor.WHITE);
        for (int y = 0; y < 10; y++) {
            for (int x = 0; x < 10; x++) {
                source.setPixel(x, y, RgbColor.BLACK);
            }
        }

        // When
        List<DotSample> samples = collect(GridSampler.forScreen(source, screen(0, 5, EAnchorStrategy.TRADITIONAL), ICancellationHook.NONE));

        // Then
        assertThat(samples).hasSize(8);
        assertThat(samples).filteredOn(s -> s.anchor().x() < 10).allSatisfy(s -> assertThat(s.luminance()).isZero());
        assertThat(samples).filteredOn(s -> s.anchor().x() >= 10)
                .allSatisfy(s -> assertThat(s.luminance()).isCloseTo(255.0, within(1e-6)));
    }

    @Test
    @DisplayName("Traditional and legacy anchors should differ only on a rotated screen")
    void anchorsShouldDifferOnRotatedScreen() {
        RasterImage source = RasterImages.uniform(50, 50, MID_GRAY);

        List<DotSample> traditional = collect(GridSampler.forScreen(source, screen(30, 6, EAnchorStrategy.TRADITIONAL), ICancellationHook.NONE));
        List<DotSample> legacy = collect(GridSampler.forScreen(source, screen(30, 6, EAnchorStrategy.LEGACY), ICancellationHook.NONE));

        assertThat(legacy).hasSameSizeAs(traditional);
        assertThat(traditional).allSatisfy(s -> {
            assertThat(s.anchor().x()).isEqualTo(Math.rint(s.anchor().x()));
            assertThat(s.anchor().y()).isEqualTo(Math.rint(s.anchor().y()));
        });
        assertThat(legacy).allSatisfy(s -> assertThat(s.anchor()).isEqualTo(s.samplePoint()));
        assertThat(legacy.get(0).anchor()).isNotEqualTo(traditional.get(0).anchor());
    }

    @Test
    @DisplayName("Should only be iterable once")
    void shouldOnlyBeIterableOnce() {
        GridSampler sampler = GridSampler.forScreen(RasterImages.uniform(10, 10, MID_GRAY),
                screen(0, 5, EAnchorStrategy.TRADITIONAL), ICancellationHook.NONE);
        sampler.iterator();

        assertThatThrownBy(sampler::iterator).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should stop with CANCELLED when the hook fires between rows")
    void shouldStopWhenCancelled() {
        // Given
        when(cancellationHook.isCancelled()).thenReturn(false, true);
        GridSampler sampler = GridSampler.forScreen(RasterImages.uniform(20, 20, MID_GRAY),
                screen(0, 5, EAnchorStrategy.TRADITIONAL), cancellationHook);
        List<DotSample> samples = new ArrayList<>();

        // When & Then
        assertThatThrownBy(() -> sampler.forEach(samples::add))
                .isInstanceOf(HalftoneException.class)
                .satisfies(e -> assertThat(((HalftoneException) e).getError()).isEqualTo(EHalftoneError.CANCELLED));
        assertThat(samples).hasSize(4);
        verify(cancellationHook, atLeast(2)).isCancelled();
    }
}
