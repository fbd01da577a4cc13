package floats;

import static floats.Types.*;

/**
 * Float placement search (CSS 2.1 Section 9.5.1, rules 2, 3, 7 and 8).
 *
 * Starting at the requested minimum top, sweeps the bands a float of the
 * given height would cover.  If the widest left intrusion plus the widest
 * right intrusion leave less than the float's width, the candidate top jumps
 * past the furthest band proven to obstruct every top in between, and the
 * sweep repeats.  Each retry lands on an existing band boundary, so the
 * search makes at most one probe per band.
 *
 * Time: O(b) probes over b bands, each a short run of splay accesses near
 * the previous one.
 */
public final class Placement {
    private Placement() {}

    /** Collects the maxima of one candidate span and where they end. */
    private static final class Sweep implements BandProfile.BandVisitor {
        final long room; // containingWidth - width
        long maxLeft, maxRight;
        long leftEnd, rightEnd, overfullEnd;

        Sweep(long room) { this.room = room; }

        void reset(long y) {
            maxLeft = maxRight = 0;
            leftEnd = rightEnd = overfullEnd = y;
        }

        @Override
        public void visit(long top, long bottom, long left, long right) {
            if (left >= maxLeft) { maxLeft = left; leftEnd = bottom; }
            if (right >= maxRight) { maxRight = right; rightEnd = bottom; }
            if (left + right > room) overfullEnd = bottom;
        }

        boolean fits() { return maxLeft + maxRight <= room; }

        // Every top before this point still overlaps a band that rules it out.
        long nextCandidate() { return Math.max(overfullEnd, Math.min(leftEnd, rightEnd)); }
    }

    /**
     * Find where a float would go without recording it.
     *
     * @throws InvalidDimensionsException on negative input or coordinate overflow
     * @throws InvalidWidthException if width exceeds containingWidth
     */
    public static Point find(BandProfile bands, Side side, long width, long height,
                             long minTop, long containingWidth, boolean verbose) {
        return search(bands, side, width, height, minTop, containingWidth, verbose ? "find" : null);
    }

    /** Record a float already positioned by find(). */
    public static void commit(BandProfile bands, Side side, Point at, long width, long height,
                              long containingWidth) {
        if (width == 0 || height == 0) return;
        long edge = side == Side.LEFT ? at.x + width : containingWidth - at.x;
        bands.raiseExtent(at.y, at.y + height, side, edge);
    }

    /** Find and commit in one step. */
    public static Point place(BandProfile bands, Side side, long width, long height,
                              long minTop, long containingWidth, boolean verbose) {
        Point at = search(bands, side, width, height, minTop, containingWidth, verbose ? "place" : null);
        commit(bands, side, at, width, height, containingWidth);
        return at;
    }

    // tag prefixes the stderr trace; null keeps the search quiet.
    private static Point search(BandProfile bands, Side side, long width, long height,
                                long minTop, long containingWidth, String tag) {
        validate(width, height, minTop, containingWidth);

        long x, y = minTop;
        int probes = 0;
        if (height == 0) {
            // Nothing to clear: stay at minTop, but keep the float inside the block.
            long extent = bands.extentAt(minTop, side);
            x = side == Side.LEFT
                ? Math.min(extent, containingWidth - width)
                : Math.max(0, containingWidth - extent - width);
        } else {
            Sweep s = new Sweep(containingWidth - width);
            for (;;) {
                long bottom = bottomOf(y, height);
                s.reset(y);
                bands.forEachIn(y, bottom, s);
                probes++;
                if (s.fits()) break;
                long next = s.nextCandidate();
                assert next > y && next != INFINITY : "placement search stalled at " + y;
                y = next;
            }
            x = side == Side.LEFT ? s.maxLeft : containingWidth - s.maxRight - width;
        }

        if (tag != null) {
            System.err.printf("%s: %s %dx%d min_top=%d -> (%d, %d), %d probe(s), %d band(s)%n",
                tag, side.name().toLowerCase(), width, height, minTop, x, y, probes, bands.size());
        }
        return new Point(x, y);
    }

    static void validate(long width, long height, long minTop, long containingWidth) {
        if (containingWidth <= 0)
            throw new InvalidDimensionsException("containing width must be > 0, got " + containingWidth);
        if (width < 0 || height < 0 || minTop < 0)
            throw new InvalidDimensionsException(String.format(
                "negative float geometry: width=%d height=%d min_top=%d", width, height, minTop));
        if (width > containingWidth)
            throw new InvalidWidthException(String.format(
                "float width %d exceeds containing width %d", width, containingWidth));
        bottomOf(minTop, height);
    }

    static long bottomOf(long top, long height) {
        // INFINITY itself is reserved for the open band.
        if (height >= INFINITY - top)
            throw new InvalidDimensionsException(String.format(
                "float bottom overflows: top=%d height=%d", top, height));
        return top + height;
    }
}
