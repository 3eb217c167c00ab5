package rastr.domain.halftone;

import rastr.domain.image.Point2D;

/**
 * One accepted grid cell
 *
 * @param anchor      dot center in nominal output coordinates
 * @param samplePoint inverse-rotated point the luminance was read at
 * @param luminance   0..255
 * @since 19/10/2026
 */
public record DotSample(Point2D anchor, Point2D samplePoint, double luminance) {
}
