package rastr.dal;

import rastr.common.EAnchorStrategy;
import rastr.common.EHalftoneMode;
import rastr.common.HalftoneConstants;
import rastr.domain.halftone.HalftoneSettings;
import rastr.domain.image.RgbColor;

import java.util.List;

/**
 * Type-safe halftone engine defaults
 *
 * @since 19/10/2026
 */
public record HalftoneConfig(
        double dotSize,
        int dotResolution,
        double screenAngle,
        boolean invert,
        EAnchorStrategy anchor,
        EHalftoneMode mode,
        RgbColor color,
        RgbColor background,
        List<RgbColor> duotoneColors,
        List<RgbColor> tritoneColors,
        int supersample,
        boolean outputDownsample,
        long timeoutMs) {

    public HalftoneConfig {
        duotoneColors = duotoneColors == null ? List.of() : List.copyOf(duotoneColors);
        tritoneColors = tritoneColors == null ? List.of() : List.copyOf(tritoneColors);
    }

    /**
     * Factory method: built-in defaults, no configuration file involved
     */
    public static HalftoneConfig defaults() {
        return new HalftoneConfig(
                HalftoneConstants.DEFAULT_DOT_SIZE,
                HalftoneConstants.DEFAULT_DOT_RESOLUTION,
                0.0,
                false,
                EAnchorStrategy.TRADITIONAL,
                EHalftoneMode.BASIC,
                RgbColor.fromHex(HalftoneConstants.DEFAULT_COLOR),
                RgbColor.fromHex(HalftoneConstants.DEFAULT_BACKGROUND),
                RgbColor.parseList(HalftoneConstants.DEFAULT_DUOTONE_COLORS),
                RgbColor.parseList(HalftoneConstants.DEFAULT_TRITONE_COLORS),
                HalftoneConstants.SUPERSAMPLE_FACTOR,
                false,
                0);
    }

    /**
     * Configured layer colors of a recipe
     */
    public List<RgbColor> colorsFor(EHalftoneMode recipe) {
        return switch (recipe) {
            case BASIC -> List.of(color);
            case DUOTONE -> duotoneColors;
            case TRITONE -> tritoneColors;
        };
    }

    /**
     * Settings for the configured default mode
     */
    public HalftoneSettings toSettings() {
        return toSettings(mode);
    }

    public HalftoneSettings toSettings(EHalftoneMode recipe) {
        return new HalftoneSettings(recipe, dotSize, dotResolution, screenAngle, invert, anchor,
                colorsFor(recipe), background, supersample);
    }

    public boolean hasTimeout() {
        return timeoutMs > 0;
    }

    @Override
    public String toString() {
        return String.format("HalftoneConfiguration{mode=%s, dotSize=%.1f, resolution=%d, angle=%.1f, invert=%s, " +
                        "anchor=%s, color=%s, background=%s, supersample=%d, downsample=%s, timeout=%dms}",
                mode, dotSize, dotResolution, screenAngle, invert, anchor, color, background,
                supersample, outputDownsample, timeoutMs);
    }

    /**
     * Validate configuration values
     */
    public void validate() throws ConfigurationException {
        if (Double.isNaN(dotSize) || dotSize < 0) {
            throw new ConfigurationException("Dot size must be zero or positive");
        }
        if (dotResolution < 1) {
            throw new ConfigurationException("Dot resolution must be at least 1");
        }
        if (Double.isNaN(screenAngle) || Double.isInfinite(screenAngle)) {
            throw new ConfigurationException("Screen angle must be a finite number");
        }
        if (anchor == null || mode == null) {
            throw new ConfigurationException("Anchor strategy and mode cannot be null");
        }
        if (color == null || background == null) {
            throw new ConfigurationException("Halftone color and background cannot be null");
        }
        if (duotoneColors.size() != EHalftoneMode.DUOTONE.getColorCount()) {
            throw new ConfigurationException("Duotone needs exactly " + EHalftoneMode.DUOTONE.getColorCount()
                    + " colors, got " + duotoneColors.size());
        }
        if (tritoneColors.size() != EHalftoneMode.TRITONE.getColorCount()) {
            throw new ConfigurationException("Tritone needs exactly " + EHalftoneMode.TRITONE.getColorCount()
                    + " colors, got " + tritoneColors.size());
        }
        if (supersample < 1 || supersample > HalftoneConstants.MAX_SUPERSAMPLE_FACTOR) {
            throw new ConfigurationException("Supersample factor must be between 1 and "
                    + HalftoneConstants.MAX_SUPERSAMPLE_FACTOR);
        }
        if (timeoutMs < 0) {
            throw new ConfigurationException("Timeout cannot be negative");
        }
    }
}
