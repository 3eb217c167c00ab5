package rastr.domain.halftone;

import rastr.common.ELayerSource;

/**
 * Per-layer counters of one conversion
 *
 * @param index           position of the layer in its job
 * @param angle           normalized screen angle
 * @param color           dot color as #RRGGBB
 * @param source          sampled image
 * @param drawnDots       dots painted
 * @param invisibleDots   accepted samples whose dot was below the visible radius
 * @param rejectedSamples grid cells outside the source or on transparent pixels
 * @since 19/10/2026
 */
public record LayerStats(
        int index,
        double angle,
        String color,
        ELayerSource source,
        int drawnDots,
        int invisibleDots,
        int rejectedSamples) {
}
