package rastr.common;

/**
 * Halftone screen rendering constants
 * @since 19/10/2026
 */
public final class HalftoneConstants {
    private HalftoneConstants() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    // ITU-R BT.601 luma weights
    public static final double LUMA_RED = 0.299;
    public static final double LUMA_GREEN = 0.587;
    public static final double LUMA_BLUE = 0.114;

    public static final double MAX_LUMINANCE = 255.0;

    /* Dots with a radius at or below this value (in nominal, not supersampled, units) are not drawn */
    public static final double MIN_VISIBLE_RADIUS = 0.1;

    /* Duotone shadow mask: luminance below this is stretched to 0..255, the rest becomes white */
    public static final double SHADOW_THRESHOLD = 127.0;

    public static final double DUOTONE_HIGHLIGHT_ANGLE_OFFSET = 15.0;
    public static final double TRITONE_SECOND_ANGLE_OFFSET = 30.0;
    public static final double TRITONE_THIRD_ANGLE_OFFSET = 60.0;

    public static final int SUPERSAMPLE_FACTOR = 2;
    public static final int MAX_SUPERSAMPLE_FACTOR = 8;
    public static final int MAX_LAYERS = 3;

    public static final double DEFAULT_DOT_SIZE = 8.0;
    public static final int DEFAULT_DOT_RESOLUTION = 5;
    public static final double RECOMMENDED_MAX_DOT_SIZE = 40.0;

    public static final String DEFAULT_COLOR = "#000000";
    public static final String DEFAULT_BACKGROUND = "#FFFFFF";
    public static final String DEFAULT_DUOTONE_COLORS = "#8B4513,#000000";   // Brown highlights, black shadows
    public static final String DEFAULT_TRITONE_COLORS = "#FFD700,#FF6347,#000000"; // Gold, tomato, black

    /* Edge pixels of a dot are resolved on an N x N sub-pixel grid */
    public static final int EDGE_SUBSAMPLES = 4;
}
