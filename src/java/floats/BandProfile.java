package floats;

import java.util.ArrayList;
import java.util.List;

import static floats.Types.*;

/**
 * Piecewise-constant occupied-width profile over [0, infinity).
 *
 * Each band [top, bottom) records how far left floats intrude from the left
 * edge and right floats from the right edge.  Band tops are the keys of a
 * splay tree; a band's bottom is the next key (or INFINITY).  Adjacent bands
 * never carry equal extents, so the band count stays within 2n + 1 after n
 * committed floats.
 */
public final class BandProfile {

    /** Mutable per-band payload. */
    private static final class Extents {
        long left, right;

        Extents(long left, long right) {
            this.left = left;
            this.right = right;
        }

        long get(Side side) { return side == Side.LEFT ? left : right; }

        void raise(Side side, long value) {
            if (side == Side.LEFT) left = Math.max(left, value);
            else right = Math.max(right, value);
        }

        boolean sameAs(Extents o) { return left == o.left && right == o.right; }
    }

    /** Receives the bands of a range in order; must not modify the profile. */
    public interface BandVisitor {
        void visit(long top, long bottom, long left, long right);
    }

    private final SplayTree<Extents> tree = new SplayTree<>();

    public BandProfile() {
        tree.insert(0, new Extents(0, 0));
    }

    /** Number of live bands. */
    public int size() { return tree.size(); }

    /** Ensure a boundary exists at y; the containing band is cut in two. */
    public void splitAt(long y) {
        if (y < 0 || y == INFINITY) throw new IllegalArgumentException("cannot split at " + y);
        containing(y);
        if (tree.rootKey() == y) return;
        Extents e = tree.rootValue();
        tree.insert(y, new Extents(e.left, e.right));
    }

    public long extentAt(long y, Side side) { return containing(y).get(side); }
    public long leftExtentAt(long y) { return containing(y).left; }
    public long rightExtentAt(long y) { return containing(y).right; }

    /** Top of the band containing y. */
    public long topOf(long y) {
        containing(y);
        return tree.rootKey();
    }

    /** Bottom of the band containing y. */
    public long bottomOf(long y) {
        return tree.higher(y) ? tree.rootKey() : INFINITY;
    }

    /**
     * Raise side's extent to at least value over every band inside
     * [top, bottom), then merge neighbours left equal by the change.
     */
    public void raiseExtent(long top, long bottom, Side side, long value) {
        if (top >= bottom) return;
        splitAt(top);
        splitAt(bottom);

        tree.find(top);
        long k = top;
        for (;;) {
            tree.rootValue().raise(side, value);
            if (!tree.higher(k) || tree.rootKey() >= bottom) break;
            k = tree.rootKey();
        }
        mergeAround(top, bottom);
    }

    /** Max of left + right over the bands intersecting [top, bottom); 0 if empty. */
    public long maxCombinedExtent(long top, long bottom) {
        long[] max = {0};
        forEachIn(top, bottom, (t, b, l, r) -> max[0] = Math.max(max[0], l + r));
        return max[0];
    }

    /** Visit the bands intersecting [top, bottom) in increasing y. */
    public void forEachIn(long top, long bottom, BandVisitor visitor) {
        if (top >= bottom) return;
        Extents e = containing(top);
        long k = tree.rootKey();
        for (;;) {
            boolean more = tree.higher(k);
            long next = more ? tree.rootKey() : INFINITY;
            Extents ne = more ? tree.rootValue() : null;
            visitor.visit(k, next, e.left, e.right);
            if (next >= bottom) return;
            k = next;
            e = ne;
        }
    }

    /** Snapshot of all bands in order. */
    public List<Band> bands() {
        List<Band> out = new ArrayList<>(tree.size());
        long[] prev = {-1};
        Extents[] prevExt = {null};
        tree.forEach((key, e) -> {
            if (prevExt[0] != null)
                out.add(new Band(prev[0], key, prevExt[0].left, prevExt[0].right));
            prev[0] = key;
            prevExt[0] = e;
        });
        out.add(new Band(prev[0], INFINITY, prevExt[0].left, prevExt[0].right));
        return out;
    }

    /** Check the partition and merge invariants; throws IllegalStateException. */
    public void verify() {
        List<Band> bands = bands();
        if (bands.get(0).top != 0)
            throw new IllegalStateException("first band starts at " + bands.get(0).top);
        Band last = bands.get(bands.size() - 1);
        if (last.left != 0 || last.right != 0)
            throw new IllegalStateException("open band carries extents: " + last);
        for (int i = 0; i < bands.size(); i++) {
            Band b = bands.get(i);
            if (b.left < 0 || b.right < 0)
                throw new IllegalStateException("negative extent: " + b);
            if (b.top >= b.bottom)
                throw new IllegalStateException("empty band: " + b);
            if (i > 0) {
                Band p = bands.get(i - 1);
                if (p.left == b.left && p.right == b.right)
                    throw new IllegalStateException("unmerged bands: " + p + " / " + b);
            }
        }
    }

    // Splay the band containing y to the root and return its extents.
    private Extents containing(long y) {
        if (y < 0) throw new IllegalArgumentException("negative y: " + y);
        tree.floor(y);
        return tree.rootValue();
    }

    // Drop boundaries in [pred(top), bottom] whose band equals the one above.
    private void mergeAround(long top, long bottom) {
        long prevKey = tree.lower(top) ? tree.rootKey() : top;
        Extents prev = tree.find(prevKey);
        while (tree.higher(prevKey) && tree.rootKey() <= bottom) {
            long key = tree.rootKey();
            Extents cur = tree.rootValue();
            if (cur.sameAs(prev)) {
                tree.remove(key);
            } else {
                prevKey = key;
                prev = cur;
            }
        }
    }
}
