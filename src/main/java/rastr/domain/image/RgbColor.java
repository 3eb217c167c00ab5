package rastr.domain.image;

import rastr.common.HalftoneConstants;

import java.util.ArrayList;
import java.util.List;

/**
 * Opaque 8-bit RGB color
 * @since 19/10/2026
 */
public record RgbColor(int red, int green, int blue) {

    public static final RgbColor BLACK = new RgbColor(0, 0, 0);
    public static final RgbColor WHITE = new RgbColor(255, 255, 255);

    public RgbColor {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Color channel " + name + " out of range 0-255: " + value);
        }
    }

    /**
     * Parse {@code #RRGGBB} or {@code RRGGBB}
     */
    public static RgbColor fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Color cannot be null");
        }
        String value = hex.trim();
        if (value.startsWith("#")) {
            value = value.substring(1);
        }
        if (value.length() != 6) {
            throw new IllegalArgumentException("Invalid color '" + hex + "', expected #RRGGBB");
        }
        try {
            int rgb = Integer.parseInt(value, 16);
            return new RgbColor((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid color '" + hex + "', expected #RRGGBB", e);
        }
    }

    /**
     * Parse a comma separated list of hex colors, blank entries are ignored
     */
    public static List<RgbColor> parseList(String csv) {
        List<RgbColor> colors = new ArrayList<>();
        if (csv == null) {
            return colors;
        }
        for (String part : csv.split(",")) {
            if (!part.trim().isEmpty()) {
                colors.add(fromHex(part));
            }
        }
        return colors;
    }

    public String toHex() {
        return String.format("#%02X%02X%02X", red, green, blue);
    }

    public double luminance() {
        return HalftoneConstants.LUMA_RED * red
                + HalftoneConstants.LUMA_GREEN * green
                + HalftoneConstants.LUMA_BLUE * blue;
    }

    @Override
    public String toString() {
        return toHex();
    }
}
