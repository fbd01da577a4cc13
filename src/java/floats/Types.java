package floats;

/** Shared types and constants for float placement (CSS 2.1 Section 9.5.1). */
public final class Types {
    private Types() {}

    /** Open bottom of the last band. */
    public static final long INFINITY = Long.MAX_VALUE;

    public enum Side {
        LEFT, RIGHT;

        public int index() { return this == LEFT ? 0 : 1; }
    }

    /** Values of the CSS 'clear' property. */
    public enum Clear { NONE, LEFT, RIGHT, BOTH }

    // ── Placement result ──

    public static final class Point {
        public final long x, y;
        public Point(long x, long y) { this.x = x; this.y = y; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Point)) return false;
            Point p = (Point) o;
            return x == p.x && y == p.y;
        }

        @Override
        public int hashCode() { return Long.hashCode(x) * 31 + Long.hashCode(y); }

        @Override
        public String toString() { return "(" + x + ", " + y + ")"; }
    }

    // ── Band snapshot (bottom == INFINITY for the last band) ──

    public static final class Band {
        public final long top, bottom, left, right;
        public Band(long top, long bottom, long left, long right) {
            this.top = top;
            this.bottom = bottom;
            this.left = left;
            this.right = right;
        }

        @Override
        public String toString() {
            String b = bottom == INFINITY ? "inf" : Long.toString(bottom);
            return String.format("[%d, %s) left=%d right=%d", top, b, left, right);
        }
    }

    // ── Context options ──

    public static final class ContextOptions {
        public boolean verbose = false;
        /** Run BandProfile.verify() after every committed change. */
        public boolean checkInvariants = false;
        /** Rule 5: a float's top is never above the top of an earlier float. */
        public boolean sourceOrder = false;
    }

    // ── Errors ──

    /** The float (or exclusion) does not fit in the containing block at any y. */
    public static final class InvalidWidthException extends IllegalArgumentException {
        public InvalidWidthException(String msg) { super(msg); }
    }

    /** Negative or overflowing geometry, rejected before any mutation. */
    public static final class InvalidDimensionsException extends IllegalArgumentException {
        public InvalidDimensionsException(String msg) { super(msg); }
    }
}
