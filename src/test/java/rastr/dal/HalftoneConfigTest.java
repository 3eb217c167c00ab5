package rastr.dal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import rastr.common.EHalftoneMode;
import rastr.domain.halftone.HalftoneSettings;
import rastr.domain.image.RgbColor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for HalftoneConfig
 * @since 19/10/2026
 */
class HalftoneConfigTest {

    @Test
    @DisplayName("Defaults should be valid")
    void defaultsShouldBeValid() {
        HalftoneConfig config = HalftoneConfig.defaults();

        assertThatCode(config::validate).doesNotThrowAnyException();
        assertThat(config.hasTimeout()).isFalse();
        assertThat(config.supersample()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should pick the color list of each mode")
    void shouldPickColorsPerMode() {
        HalftoneConfig config = HalftoneConfig.defaults();

        assertThat(config.colorsFor(EHalftoneMode.BASIC)).containsExactly(RgbColor.BLACK);
        assertThat(config.colorsFor(EHalftoneMode.DUOTONE)).extracting(RgbColor::toHex)
                .containsExactly("#8B4513", "#000000");
        assertThat(config.colorsFor(EHalftoneMode.TRITONE)).extracting(RgbColor::toHex)
                .containsExactly("#FFD700", "#FF6347", "#000000");
    }

    @Test
    @DisplayName("Settings should carry the configured values")
    void settingsShouldCarryConfiguredValues() {
        // When
        HalftoneSettings settings = HalftoneConfig.defaults().toSettings(EHalftoneMode.TRITONE);

        // Then
        assertThat(settings.mode()).isEqualTo(EHalftoneMode.TRITONE);
        assertThat(settings.dotSize()).isEqualTo(8.0);
        assertThat(settings.dotResolution()).isEqualTo(5);
        assertThat(settings.colors()).hasSize(3);
        assertThat(settings.background()).isEqualTo(RgbColor.WHITE);
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldRejectOutOfRangeValues() {
        HalftoneConfig d = HalftoneConfig.defaults();
        HalftoneConfig badSupersample = new HalftoneConfig(d.dotSize(), d.dotResolution(), d.screenAngle(), d.invert(),
                d.anchor(), d.mode(), d.color(), d.background(), d.duotoneColors(), d.tritoneColors(), 9, false, 0);
        HalftoneConfig badTimeout = new HalftoneConfig(d.dotSize(), d.dotResolution(), d.screenAngle(), d.invert(),
                d.anchor(), d.mode(), d.color(), d.background(), d.duotoneColors(), d.tritoneColors(), 2, false, -1);
        HalftoneConfig badDuotone = new HalftoneConfig(d.dotSize(), d.dotResolution(), d.screenAngle(), d.invert(),
                d.anchor(), d.mode(), d.color(), d.background(), List.of(RgbColor.BLACK), d.tritoneColors(), 2, false, 0);

        assertThatThrownBy(badSupersample::validate).isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Supersample");
        assertThatThrownBy(badTimeout::validate).isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Timeout");
        assertThatThrownBy(badDuotone::validate).isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Duotone");
    }
}
