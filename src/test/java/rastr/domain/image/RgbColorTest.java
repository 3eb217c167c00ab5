package rastr.domain.image;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for RgbColor
 * @since 19/10/2026
 */
class RgbColorTest {

    @Test
    @DisplayName("Should parse hex colors with and without hash")
    void shouldParseHex() {
        assertThat(RgbColor.fromHex("#8B4513")).isEqualTo(new RgbColor(0x8B, 0x45, 0x13));
        assertThat(RgbColor.fromHex("ff6347")).isEqualTo(new RgbColor(255, 99, 71));
    }

    @Test
    @DisplayName("Should format as upper-case hex")
    void shouldFormatHex() {
        assertThat(new RgbColor(255, 215, 0).toHex()).isEqualTo("#FFD700");
    }

    @Test
    @DisplayName("Should reject malformed colors")
    void shouldRejectMalformed() {
        assertThatThrownBy(() -> RgbColor.fromHex("#12345")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RgbColor.fromHex("#GGGGGG")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RgbColor(256, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should parse comma separated lists and skip blanks")
    void shouldParseList() {
        assertThat(RgbColor.parseList("#FFD700, #FF6347,,#000000"))
                .containsExactly(new RgbColor(255, 215, 0), new RgbColor(255, 99, 71), RgbColor.BLACK);
        assertThat(RgbColor.parseList(null)).isEmpty();
    }

    @Test
    @DisplayName("Should compute luminance with BT.601 weights")
    void shouldComputeLuminance() {
        assertThat(RgbColor.WHITE.luminance()).isCloseTo(255.0, within(1e-9));
        assertThat(new RgbColor(255, 0, 0).luminance()).isCloseTo(76.245, within(1e-9));
    }
}
