package rastr.domain.halftone;

import rastr.domain.image.Point2D;

/**
 * Bounding box of a canvas rotated about its center
 * @since 19/10/2026
 */
public final class ScreenGeometryCalculator {
    // cos(90deg) is 6e-17, not 0; keep such noise from growing the box by a pixel
    private static final double SNAP_EPSILON = 1e-9;

    private ScreenGeometryCalculator() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static Point2D center(int width, int height) {
        return new Point2D(width / 2.0, height / 2.0);
    }

    /**
     * Rotate the four canvas corners by {@code angleDegrees} about the canvas center and
     * return the enclosing integer box (min floored, max ceiled). At 0 degrees this is (0, 0, width, height).
     */
    public static GridBounds rotatedBounds(int width, int height, double angleDegrees) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Canvas dimensions must be positive: " + width + "x" + height);
        }
        double radians = Math.toRadians(angleDegrees);
        Point2D center = center(width, height);
        Point2D[] corners = {
                new Point2D(0, 0),
                new Point2D(width, 0),
                new Point2D(width, height),
                new Point2D(0, height)
        };

        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (Point2D corner : corners) {
            Point2D rotated = corner.rotateAbout(center, radians);
            minX = Math.min(minX, rotated.x());
            minY = Math.min(minY, rotated.y());
            maxX = Math.max(maxX, rotated.x());
            maxY = Math.max(maxY, rotated.y());
        }

        return new GridBounds(floor(minX), floor(minY), ceil(maxX), ceil(maxY));
    }

    private static int floor(double value) {
        double nearest = Math.rint(value);
        return (int) (Math.abs(value - nearest) < SNAP_EPSILON ? nearest : Math.floor(value));
    }

    private static int ceil(double value) {
        double nearest = Math.rint(value);
        return (int) (Math.abs(value - nearest) < SNAP_EPSILON ? nearest : Math.ceil(value));
    }
}
