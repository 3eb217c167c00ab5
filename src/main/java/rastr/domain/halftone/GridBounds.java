package rastr.domain.halftone;

/**
 * Integer box enclosing the canvas after rotation about its center; max edges are exclusive for the grid walk
 * @since 19/10/2026
 */
public record GridBounds(int minX, int minY, int maxX, int maxY) {

    public GridBounds {
        if (maxX < minX || maxY < minY) {
            throw new IllegalArgumentException(String.format(
                    "Inverted bounds (%d, %d, %d, %d)", minX, minY, maxX, maxY));
        }
    }

    public int width() {
        return maxX - minX;
    }

    public int height() {
        return maxY - minY;
    }

    /**
     * Number of grid cells visited when stepping by {@code resolution}
     */
    public long cellCount(int resolution) {
        long columns = (width() + resolution - 1L) / resolution;
        long rows = (height() + resolution - 1L) / resolution;
        return columns * rows;
    }
}
