package rastr.common;

/**
 * Call-level failure kinds of the halftone engine
 * @since 19/10/2026
 */
public enum EHalftoneError {
    INVALID_PARAMETER("Invalid parameter"),
    SOURCE_IMAGE_MISSING("Source image missing"),
    CANCELLED("Conversion cancelled");

    private final String description;

    EHalftoneError(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
