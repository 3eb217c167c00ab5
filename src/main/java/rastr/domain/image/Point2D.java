package rastr.domain.image;

/**
 * Real-valued point in canvas coordinates
 * @since 19/10/2026
 */
public record Point2D(double x, double y) {

    /**
     * Rotate this point about {@code center} by {@code radians} (positive is clockwise on a y-down canvas)
     */
    public Point2D rotateAbout(Point2D center, double radians) {
        double cos = Math.cos(radians);
        double sin = Math.sin(radians);
        double dx = x - center.x;
        double dy = y - center.y;
        return new Point2D(
                dx * cos - dy * sin + center.x,
                dx * sin + dy * cos + center.y);
    }

    public Point2D scale(double factor) {
        return new Point2D(x * factor, y * factor);
    }

    public double distanceTo(Point2D other) {
        return Math.hypot(x - other.x, y - other.y);
    }
}
