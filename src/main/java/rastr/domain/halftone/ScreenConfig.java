package rastr.domain.halftone;

import rastr.common.EAnchorStrategy;
import rastr.domain.image.RgbColor;

/**
 * Parameters of one halftone screen
 *
 * @param angle         screen angle in degrees, normalized to [0, 360)
 * @param dotSize       maximum dot diameter in nominal output pixels
 * @param dotResolution grid step between dot centers in nominal output pixels
 * @param color         dot color
 * @param invert        bright areas get the large dots
 * @param anchor        where dots are centered
 * @since 19/10/2026
 */
public record ScreenConfig(
        double angle,
        double dotSize,
        int dotResolution,
        RgbColor color,
        boolean invert,
        EAnchorStrategy anchor) {

    public ScreenConfig {
        if (Double.isNaN(angle) || Double.isInfinite(angle)) {
            throw HalftoneException.invalidParameter("screen angle must be a finite number, got " + angle);
        }
        if (Double.isNaN(dotSize) || Double.isInfinite(dotSize) || dotSize < 0) {
            throw HalftoneException.invalidParameter("dot size must be >= 0, got " + dotSize);
        }
        if (dotResolution < 1) {
            throw HalftoneException.invalidParameter("dot resolution must be >= 1, got " + dotResolution);
        }
        if (color == null) {
            throw HalftoneException.invalidParameter("screen color cannot be null");
        }
        if (anchor == null) {
            throw HalftoneException.invalidParameter("anchor strategy cannot be null");
        }
        angle = normalizeAngle(angle);
    }

    /**
     * Map any angle into [0, 360)
     */
    public static double normalizeAngle(double degrees) {
        double normalized = degrees % 360.0;
        if (normalized < 0) {
            normalized += 360.0;
        }
        // -1e-15 % 360 + 360 rounds to 360.0
        return normalized >= 360.0 ? 0.0 : normalized;
    }

    public double angleRadians() {
        return Math.toRadians(angle);
    }

    public ScreenConfig withAngle(double newAngle) {
        return new ScreenConfig(newAngle, dotSize, dotResolution, color, invert, anchor);
    }

    public ScreenConfig withColor(RgbColor newColor) {
        return new ScreenConfig(angle, dotSize, dotResolution, newColor, invert, anchor);
    }
}
