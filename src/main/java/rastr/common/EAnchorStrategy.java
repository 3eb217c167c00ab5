package rastr.common;

import rastr.domain.image.Point2D;

/**
 * Where a halftone dot is centered once its grid cell has been sampled.
 * Each strategy picks the anchor itself, so adding one does not touch the sampler.
 * @since 19/10/2026
 */
public enum EAnchorStrategy {
    /**
     * Dot sits on the screen grid coordinate, only the sample comes from the rotated point
     */
    TRADITIONAL("Dot anchored at the grid coordinate") {
        @Override
        public Point2D anchor(Point2D gridPoint, Point2D samplePoint) {
            return gridPoint;
        }
    },

    /**
     * Dot sits on the inverse-rotated sample coordinate. Kept for comparison output.
     */
    LEGACY("Dot anchored at the inverse-rotated sample coordinate") {
        @Override
        public Point2D anchor(Point2D gridPoint, Point2D samplePoint) {
            return samplePoint;
        }
    };

    private final String description;

    EAnchorStrategy(String description) {
        this.description = description;
    }

    public abstract Point2D anchor(Point2D gridPoint, Point2D samplePoint);

    public String getDescription() {
        return description;
    }

    /**
     * Case-insensitive lookup
     * @throws IllegalArgumentException for an unknown or empty name
     */
    public static EAnchorStrategy fromString(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Anchor strategy cannot be empty");
        }
        for (EAnchorStrategy strategy : values()) {
            if (strategy.name().equalsIgnoreCase(name.trim())) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unsupported anchor strategy: " + name);
    }
}
