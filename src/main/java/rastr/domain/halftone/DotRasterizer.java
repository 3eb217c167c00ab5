package rastr.domain.halftone;

import rastr.common.HalftoneConstants;
import rastr.domain.image.Point2D;
import rastr.domain.image.RasterImage;
import rastr.domain.image.RgbColor;

/**
 * Turns samples of one screen into filled, anti-aliased dots on a shared canvas.
 * <p>
 * Dot geometry is given in nominal units and multiplied by the canvas scale, so every layer of a job
 * lands on the same pixels. Where dots overlap, the last one drawn wins: every pixel fully inside it
 * is overwritten with its color, whatever lies underneath. Blending is limited to anti-aliased rim
 * pixels, which are mixed source-over with the canvas in proportion to their edge coverage, so a red
 * dot over a black one leaves a slightly darker rim.
 *
 * @since 19/10/2026
 */
public final class DotRasterizer {
    private static final double HALF_PIXEL_DIAGONAL = Math.sqrt(0.5);

    private final RasterImage target;
    private final ScreenConfig screen;
    private final int scale;

    private int drawn;
    private int belowThreshold;

    public DotRasterizer(RasterImage target, ScreenConfig screen, int scale) {
        if (target == null) {
            throw new IllegalArgumentException("Target canvas cannot be null");
        }
        if (scale < 1) {
            throw new IllegalArgumentException("Scale must be at least 1: " + scale);
        }
        this.target = target;
        this.screen = screen;
        this.scale = scale;
    }

    /**
     * Linear range mapping
     */
    public static double map(double value, double minA, double maxA, double minB, double maxB) {
        return ((value - minA) / (maxA - minA)) * (maxB - minB) + minB;
    }

    /**
     * Dot radius for a luminance: dark is large unless inverted. Ranges from 0 to {@code dotSize / 2}.
     */
    public static double radiusFor(double luminance, double dotSize, boolean invert) {
        double maxRadius = dotSize / 2.0;
        return invert
                ? map(luminance, 0, HalftoneConstants.MAX_LUMINANCE, 0, maxRadius)
                : map(luminance, 0, HalftoneConstants.MAX_LUMINANCE, maxRadius, 0);
    }

    public double radiusFor(DotSample sample) {
        return radiusFor(sample.luminance(), screen.dotSize(), screen.invert());
    }

    /**
     * Draw the dot for one sample
     * @return false when the dot is too small to be visible and nothing was drawn
     */
    public boolean draw(DotSample sample) {
        double radius = radiusFor(sample);
        if (radius <= HalftoneConstants.MIN_VISIBLE_RADIUS) {
            belowThreshold++;
            return false;
        }
        Point2D center = sample.anchor().scale(scale);
        fillCircle(center.x(), center.y(), radius * scale, screen.color());
        drawn++;
        return true;
    }

    public int getDrawnCount() {
        return drawn;
    }

    public int getBelowThresholdCount() {
        return belowThreshold;
    }

    /**
     * Fill a circle given in canvas pixels. Pixel (x, y) covers [x, x+1) x [y, y+1).
     */
    void fillCircle(double cx, double cy, double radius, RgbColor color) {
        int minX = Math.max(0, (int) Math.floor(cx - radius));
        int minY = Math.max(0, (int) Math.floor(cy - radius));
        int maxX = Math.min(target.getWidth() - 1, (int) Math.ceil(cx + radius));
        int maxY = Math.min(target.getHeight() - 1, (int) Math.ceil(cy + radius));

        double inner = radius - HALF_PIXEL_DIAGONAL;
        double outer = radius + HALF_PIXEL_DIAGONAL;
        double innerSquared = inner > 0 ? inner * inner : -1;
        double outerSquared = outer * outer;

        for (int y = minY; y <= maxY; y++) {
            double dy = y + 0.5 - cy;
            for (int x = minX; x <= maxX; x++) {
                double dx = x + 0.5 - cx;
                double distanceSquared = dx * dx + dy * dy;
                if (distanceSquared >= outerSquared) {
                    continue;
                }
                if (distanceSquared <= innerSquared) {
                    target.setPixel(x, y, color);
                } else {
                    double coverage = edgeCoverage(x, y, cx, cy, radius);
                    if (coverage > 0) {
                        blend(x, y, color, coverage);
                    }
                }
            }
        }
    }

    private static double edgeCoverage(int x, int y, double cx, double cy, double radius) {
        int n = HalftoneConstants.EDGE_SUBSAMPLES;
        double radiusSquared = radius * radius;
        int inside = 0;
        for (int sy = 0; sy < n; sy++) {
            double dy = y + (sy + 0.5) / n - cy;
            for (int sx = 0; sx < n; sx++) {
                double dx = x + (sx + 0.5) / n - cx;
                if (dx * dx + dy * dy <= radiusSquared) {
                    inside++;
                }
            }
        }
        return (double) inside / (n * n);
    }

    /**
     * Source-over of an opaque color with partial coverage
     */
    private void blend(int x, int y, RgbColor color, double coverage) {
        if (coverage >= 1.0) {
            target.setPixel(x, y, color);
            return;
        }
        double dstAlpha = target.getAlpha(x, y) / 255.0;
        double dstWeight = dstAlpha * (1.0 - coverage);
        double outAlpha = coverage + dstWeight;

        int red = (int) Math.round((color.red() * coverage + target.getRed(x, y) * dstWeight) / outAlpha);
        int green = (int) Math.round((color.green() * coverage + target.getGreen(x, y) * dstWeight) / outAlpha);
        int blue = (int) Math.round((color.blue() * coverage + target.getBlue(x, y) * dstWeight) / outAlpha);
        target.setPixel(x, y, red, green, blue, (int) Math.round(outAlpha * 255.0));
    }
}
