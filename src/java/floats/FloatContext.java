package floats;

import java.util.List;

import static floats.Types.*;

/**
 * Float bookkeeping for one block formatting context.
 *
 * The layout engine creates one context per formatting context, feeds it the
 * floats in document order and queries it for the width left over for line
 * boxes and for clearance.  Floats are only ever added.  Not thread-safe.
 */
public final class FloatContext {
    private final long containingWidth;
    private final ContextOptions opts;
    private final BandProfile bands = new BandProfile();
    private final long[] lowestBottom = new long[2];
    private long maxTop;
    private int floatCount;

    public FloatContext(long containingWidth) {
        this(containingWidth, new ContextOptions());
    }

    public FloatContext(long containingWidth, ContextOptions opts) {
        if (containingWidth <= 0)
            throw new InvalidDimensionsException("containing width must be > 0, got " + containingWidth);
        this.containingWidth = containingWidth;
        this.opts = opts;
    }

    public long containingWidth() { return containingWidth; }

    /** Floats and exclusions recorded so far. */
    public int floatCount() { return floatCount; }

    public int bandCount() { return bands.size(); }

    public List<Band> bands() { return bands.bands(); }

    /**
     * Place a float and record it.
     *
     * @return the float's top-left corner; y &gt;= minTop
     * @throws InvalidWidthException if width exceeds the containing width
     * @throws InvalidDimensionsException on negative or overflowing geometry
     */
    public Point addFloat(Side side, long width, long height, long minTop) {
        Point at = Placement.place(bands, side, width, height, startTop(width, height, minTop),
            containingWidth, opts.verbose);
        record(side, at.y, height);
        return at;
    }

    /** Where addFloat would place this float, without recording it. */
    public Point probe(Side side, long width, long height, long minTop) {
        return Placement.find(bands, side, width, height, startTop(width, height, minTop),
            containingWidth, opts.verbose);
    }

    /**
     * Record an intrusion of extent from side's edge over [top, top + height)
     * positioned by the caller.
     *
     * @throws InvalidWidthException if the intrusion would leave negative width
     */
    public void exclude(Side side, long top, long height, long extent) {
        if (extent < 0 || height < 0 || top < 0)
            throw new InvalidDimensionsException(String.format(
                "negative exclusion geometry: extent=%d height=%d top=%d", extent, height, top));
        if (extent > containingWidth)
            throw new InvalidWidthException(String.format(
                "exclusion extent %d exceeds containing width %d", extent, containingWidth));
        long bottom = Placement.bottomOf(top, height);
        Side other = side == Side.LEFT ? Side.RIGHT : Side.LEFT;
        long[] opposite = {0};
        bands.forEachIn(top, bottom, (t, b, l, r) ->
            opposite[0] = Math.max(opposite[0], other == Side.LEFT ? l : r));
        if (opposite[0] + extent > containingWidth)
            throw new InvalidWidthException(String.format(
                "%s exclusion of %d over [%d, %d) overlaps %d from the %s edge",
                side.name().toLowerCase(), extent, top, bottom, opposite[0],
                other.name().toLowerCase()));

        if (extent > 0) bands.raiseExtent(top, bottom, side, extent);
        if (opts.verbose) {
            System.err.printf("exclude: %s %d over [%d, %d), %d band(s)%n",
                side.name().toLowerCase(), extent, top, bottom, bands.size());
        }
        record(side, top, height);
    }

    public long leftExtentAt(long y) { return bands.leftExtentAt(checkY(y)); }

    public long rightExtentAt(long y) { return bands.rightExtentAt(checkY(y)); }

    /** Width left for inline content at y. */
    public long availableWidthAt(long y) {
        checkY(y);
        return containingWidth - bands.leftExtentAt(y) - bands.rightExtentAt(y);
    }

    /** Width left for a line box spanning [top, bottom). */
    public long availableWidthIn(long top, long bottom) {
        checkY(top);
        if (bottom <= top) return availableWidthAt(top);
        return containingWidth - bands.maxCombinedExtent(top, bottom);
    }

    /** The y a box with the given 'clear' value must start at or below. */
    public long clearance(Clear clear) {
        switch (clear) {
            case NONE:  return 0;
            case LEFT:  return lowestBottom[Side.LEFT.index()];
            case RIGHT: return lowestBottom[Side.RIGHT.index()];
            case BOTH:  return Math.max(lowestBottom[0], lowestBottom[1]);
            default:
                throw new IllegalArgumentException("unknown clear value: " + clear);
        }
    }

    // Validate before the source-order floor can mask a negative minTop.
    private long startTop(long width, long height, long minTop) {
        Placement.validate(width, height, minTop, containingWidth);
        return opts.sourceOrder ? Math.max(minTop, maxTop) : minTop;
    }

    private void record(Side side, long top, long height) {
        int i = side.index();
        lowestBottom[i] = Math.max(lowestBottom[i], top + height);
        maxTop = Math.max(maxTop, top);
        floatCount++;
        if (opts.checkInvariants) {
            bands.verify();
            if (bands.size() > 2 * floatCount + 1)
                throw new IllegalStateException(String.format(
                    "%d bands after %d floats", bands.size(), floatCount));
        }
    }

    private static long checkY(long y) {
        if (y < 0) throw new InvalidDimensionsException("negative y: " + y);
        return y;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("FloatContext(containing_width=%d, floats=%d): bands:%n",
            containingWidth, floatCount));
        for (Band b : bands.bands())
            sb.append("    ").append(b).append(String.format("%n"));
        return sb.toString();
    }
}
