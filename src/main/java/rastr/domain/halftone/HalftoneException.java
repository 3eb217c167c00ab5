package rastr.domain.halftone;

import rastr.common.EHalftoneError;

/**
 * Call-level halftone conversion failure. Raised before any output pixel is handed back.
 * @since 19/10/2026
 */
public class HalftoneException extends RuntimeException {
    private final EHalftoneError error;

    public HalftoneException(EHalftoneError error, String message) {
        super(error.getDescription() + ": " + message);
        this.error = error;
    }

    public HalftoneException(EHalftoneError error, String message, Throwable cause) {
        super(error.getDescription() + ": " + message, cause);
        this.error = error;
    }

    public static HalftoneException invalidParameter(String message) {
        return new HalftoneException(EHalftoneError.INVALID_PARAMETER, message);
    }

    public static HalftoneException invalidParameter(String message, Throwable cause) {
        return new HalftoneException(EHalftoneError.INVALID_PARAMETER, message, cause);
    }

    public static HalftoneException sourceImageMissing() {
        return new HalftoneException(EHalftoneError.SOURCE_IMAGE_MISSING, "no source image supplied");
    }

    public static HalftoneException cancelled(String message) {
        return new HalftoneException(EHalftoneError.CANCELLED, message);
    }

    public EHalftoneError getError() {
        return error;
    }
}
