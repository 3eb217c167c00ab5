package rastr.domain.halftone;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rastr.common.EAnchorStrategy;
import rastr.domain.image.Point2D;
import rastr.domain.image.RasterImage;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Walks the rotated screen grid and reads the source luminance under each cell.
 * <p>
 * Cells whose inverse-rotated point falls outside the source, or lands on a fully transparent pixel,
 * produce no sample and are only counted. The sequence is lazy and can be iterated once.
 *
 * @since 19/10/2026
 */
public final class GridSampler implements Iterable<DotSample> {
    private static final Logger logger = LoggerFactory.getLogger(GridSampler.class);

    private final RasterImage source;
    private final GridBounds bounds;
    private final int resolution;
    private final double radians;
    private final EAnchorStrategy anchor;
    private final ICancellationHook cancellationHook;
    private final Point2D center;

    private boolean consumed;
    private int emitted;
    private int outOfBounds;
    private int transparent;

    public GridSampler(RasterImage source, GridBounds bounds, int resolution, double angleDegrees,
                       EAnchorStrategy anchor, ICancellationHook cancellationHook) {
        if (source == null) {
            throw HalftoneException.sourceImageMissing();
        }
        if (resolution < 1) {
            throw HalftoneException.invalidParameter("dot resolution must be >= 1, got " + resolution);
        }
        if (anchor == null) {
            throw HalftoneException.invalidParameter("anchor strategy cannot be null");
        }
        this.source = source;
        this.bounds = bounds;
        this.resolution = resolution;
        this.radians = Math.toRadians(angleDegrees);
        this.anchor = anchor;
        this.cancellationHook = cancellationHook != null ? cancellationHook : ICancellationHook.NONE;
        this.center = ScreenGeometryCalculator.center(source.getWidth(), source.getHeight());
    }

    /**
     * Sampler for one screen over the whole source canvas
     */
    public static GridSampler forScreen(RasterImage source, ScreenConfig screen, ICancellationHook cancellationHook) {
        if (source == null) {
            throw HalftoneException.sourceImageMissing();
        }
        GridBounds bounds = ScreenGeometryCalculator.rotatedBounds(source.getWidth(), source.getHeight(), screen.angle());
        return new GridSampler(source, bounds, screen.dotResolution(), screen.angle(), screen.anchor(), cancellationHook);
    }

    @Override
    public Iterator<DotSample> iterator() {
        if (consumed) {
            throw new IllegalStateException("Grid sampler can only be iterated once");
        }
        consumed = true;
        logger.trace("Sampling grid {} step {} ({} cells)", bounds, resolution, bounds.cellCount(resolution));
        return new CellIterator();
    }

    public int getEmittedCount() {
        return emitted;
    }

    /**
     * Cells dropped because they mapped outside the source or onto a transparent pixel
     */
    public int getRejectedCount() {
        return outOfBounds + transparent;
    }

    public int getOutOfBoundsCount() {
        return outOfBounds;
    }

    public int getTransparentCount() {
        return transparent;
    }

    public GridBounds getBounds() {
        return bounds;
    }

    private DotSample sampleCell(int gx, int gy) {
        Point2D gridPoint = new Point2D(gx, gy);
        Point2D samplePoint = gridPoint.rotateAbout(center, -radians);

        double sx = samplePoint.x();
        double sy = samplePoint.y();
        if (sx < 0 || sy < 0 || sx >= source.getWidth() || sy >= source.getHeight()) {
            outOfBounds++;
            return null;
        }

        int px = (int) Math.floor(sx);
        int py = (int) Math.floor(sy);
        if (source.getAlpha(px, py) == 0) {
            transparent++;
            return null;
        }

        emitted++;
        return new DotSample(anchor.anchor(gridPoint, samplePoint), samplePoint, source.getLuminance(px, py));
    }

    private final class CellIterator implements Iterator<DotSample> {
        private int gx = bounds.minX();
        private int gy = bounds.minY();
        private DotSample next;

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public DotSample next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            DotSample sample = next;
            next = null;
            return sample;
        }

        private DotSample advance() {
            while (gy < bounds.maxY()) {
                if (gx == bounds.minX() && cancellationHook.isCancelled()) {
                    throw HalftoneException.cancelled("stopped at grid row " + gy);
                }
                while (gx < bounds.maxX()) {
                    int x = gx;
                    gx += resolution;
                    DotSample sample = sampleCell(x, gy);
                    if (sample != null) {
                        return sample;
                    }
                }
                gx = bounds.minX();
                gy += resolution;
            }
            return null;
        }
    }
}
