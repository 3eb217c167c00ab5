package rastr.common;

/**
 * Image a halftone layer samples from
 * @since 19/10/2026
 */
public enum ELayerSource {
    /** The caller's source image as is */
    ORIGINAL,
    /** Shadow-only image derived from the source, see ShadowMaskFactory */
    SHADOW_MASK
}
