package floats;

import java.util.ArrayDeque;

/**
 * Tarjan-Sleator splay tree keyed on long (band boundary y-coordinate).
 *
 * A self-adjusting binary search tree: every access (find/insert/floor/
 * higher/lower/remove) splays the accessed node to the root via
 * zig/zig-zig/zig-zag rotations.  Amortized O(log n) per operation, and
 * close to O(1) when successive accesses land near the previous one.
 * A single operation may still cost O(n).
 *
 * The root doubles as a cursor: after a successful access, rootKey() and
 * rootValue() describe the node that was found; the value is mutable in place.
 *
 * Reference: Sleator &amp; Tarjan, "Self-Adjusting Binary Search Trees",
 * JACM 32(3), 1985.
 *
 * @param <V> value type
 */
public final class SplayTree<V> {
    private static final class Node<V> {
        long key;
        V value;
        Node<V> left, right;

        Node(long key, V value) {
            this.key = key;
            this.value = value;
        }
    }

    /** In-order visitor; must not modify the tree. */
    public interface Visitor<V> {
        void visit(long key, V value);
    }

    private Node<V> root;
    private int size;

    public int size() { return size; }
    public boolean isEmpty() { return size == 0; }

    /** Key of the most recently accessed node. */
    public long rootKey() {
        if (root == null) throw new IllegalStateException("empty tree");
        return root.key;
    }

    /** Value of the most recently accessed node. */
    public V rootValue() {
        if (root == null) throw new IllegalStateException("empty tree");
        return root.value;
    }

    /** Find key; returns value or null. Splays found node to root. */
    public V find(long key) {
        if (root == null) return null;
        root = splay(root, key);
        return root.key == key ? root.value : null;
    }

    /** Insert key with value, overwriting any existing entry. */
    public void insert(long key, V value) {
        if (root == null) {
            root = new Node<>(key, value);
            size++;
            return;
        }
        root = splay(root, key);
        if (root.key == key) {
            root.value = value;
            return;
        }
        link(new Node<>(key, value));
    }

    /** Remove key; returns its value or null if absent. */
    public V remove(long key) {
        if (root == null) return null;
        root = splay(root, key);
        if (root.key != key) return null;

        V value = root.value;
        if (root.left == null) {
            root = root.right;
        } else {
            // Every key on the left is smaller, so the splay surfaces its maximum.
            Node<V> l = splay(root.left, key);
            l.right = root.right;
            root = l;
        }
        size--;
        return value;
    }

    /** Splay the greatest key &lt;= key to the root. Returns false if none. */
    public boolean floor(long key) {
        if (root == null) return false;
        root = splay(root, key);
        if (root.key <= key) return true;
        return raisePredecessor(key);
    }

    /** Splay the greatest key &lt; key to the root. Returns false if none. */
    public boolean lower(long key) {
        if (root == null) return false;
        root = splay(root, key);
        if (root.key < key) return true;
        return raisePredecessor(key);
    }

    /** Splay the least key &gt; key to the root. Returns false if none. */
    public boolean higher(long key) {
        if (root == null) return false;
        root = splay(root, key);
        if (root.key > key) return true;
        if (root.right == null) return false;

        // root.key <= key, so the right subtree holds exactly the keys > key.
        Node<V> r = splay(root.right, key);
        root.right = r.left;
        r.left = root;
        root = r;
        return true;
    }

    /** Visit all entries in key order without splaying. */
    public void forEach(Visitor<V> visitor) {
        ArrayDeque<Node<V>> stack = new ArrayDeque<>();
        Node<V> t = root;
        while (t != null || !stack.isEmpty()) {
            while (t != null) {
                stack.push(t);
                t = t.left;
            }
            t = stack.pop();
            visitor.visit(t.key, t.value);
            t = t.right;
        }
    }

    // After splay(key) left root.key >= key: the left subtree holds exactly
    // the keys < key; rotate its maximum up to the root.
    private boolean raisePredecessor(long key) {
        if (root.left == null) return false;
        Node<V> l = splay(root.left, key);
        root.left = l.right;
        l.right = root;
        root = l;
        return true;
    }

    // Make node the new root, splitting the current root (already splayed
    // on node.key) to either side.
    private void link(Node<V> node) {
        size++;
        if (node.key < root.key) {
            node.left = root.left;
            node.right = root;
            root.left = null;
        } else {
            node.right = root.right;
            node.left = root;
            root.right = null;
        }
        root = node;
    }

    /** Top-down splay (Sleator &amp; Tarjan 1985) of the subtree rooted at t. */
    private static <V> Node<V> splay(Node<V> t, long key) {
        // Sentinel header: only left/right used.
        Node<V> header = new Node<>(0, null);
        Node<V> l = header, r = header;

        for (;;) {
            if (key < t.key) {
                if (t.left == null) break;
                if (key < t.left.key) {
                    // Zig-zig: rotate right
                    Node<V> y = t.left;
                    t.left = y.right;
                    y.right = t;
                    t = y;
                    if (t.left == null) break;
                }
                // Link right
                r.left = t;
                r = t;
                t = t.left;
            } else if (key > t.key) {
                if (t.right == null) break;
                if (key > t.right.key) {
                    // Zig-zig: rotate left
                    Node<V> y = t.right;
                    t.right = y.left;
                    y.left = t;
                    t = y;
                    if (t.right == null) break;
                }
                // Link left
                l.right = t;
                l = t;
                t = t.right;
            } else {
                break; // found
            }
        }

        // Assemble
        l.right = t.left;
        r.left = t.right;
        t.left = header.right;
        t.right = header.left;
        return t;
    }
}
