package rastr.common;

/**
 * Built-in halftone layer recipes
 * @since 19/10/2026
 */
public enum EHalftoneMode {
    BASIC("Single screen in the chosen color", 1),
    DUOTONE("Highlight screen plus shadow-only screen", 2),
    TRITONE("Three screens at 30 degree steps", 3);

    private final String description;
    private final int colorCount;

    EHalftoneMode(String description, int colorCount) {
        this.description = description;
        this.colorCount = colorCount;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Number of layer colors the recipe expects
     */
    public int getColorCount() {
        return colorCount;
    }

    /**
     * Case-insensitive lookup
     * @throws IllegalArgumentException for an unknown or empty name
     */
    public static EHalftoneMode fromString(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Halftone mode cannot be empty");
        }
        for (EHalftoneMode mode : values()) {
            if (mode.name().equalsIgnoreCase(name.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported halftone mode: " + name);
    }
}
