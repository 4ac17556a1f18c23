package suffixtree;

import it.unimi.dsi.fastutil.ints.Int2IntMap;

import java.util.BitSet;

/**
 * Structural checks for a suffix tree. Each failed check raises an
 * {@link InvariantViolationException} naming the offending node.
 *
 * Checked:
 *   - every edge is keyed by its first symbol and has a non-empty label;
 *   - every internal node except the root branches and has a suffix link one symbol shallower,
 *     and following links from it reaches the root;
 *   - a finished tree has one leaf per suffix of the terminated text, each spelling its suffix.
 */
public final class TreeInvariants {

    private TreeInvariants() {
    }

    public static void check(SuffixTree tree) {
        TreeStore store = tree.store();
        int nodeCount = store.nodeCount();

        for (int node = 0; node < nodeCount; node++) {
            checkEdges(store, node);
        }
        for (int node = 1; node < nodeCount; node++) {
            if (!store.isLeaf(node)) {
                checkInternal(store, node, tree.isFinished());
            }
        }
        if (tree.isFinished()) {
            checkLeaves(store);
        }
    }

    private static void checkEdges(TreeStore store, int node) {
        for (Int2IntMap.Entry entry : store.edgeEntries(node)) {
            int child = entry.getIntValue();
            if (store.parent(child) != node) {
                throw new InvariantViolationException("child " + child + " does not point back to parent " + node);
            }
            int start = store.edgeStart(child);
            if (store.symbolAt(start) != entry.getIntKey()) {
                throw new InvariantViolationException(
                        "edge into " + child + " is keyed " + entry.getIntKey() + " but starts with " + store.symbolAt(start));
            }
            if (start > store.edgeEnd(child)) {
                throw new InvariantViolationException("edge into " + child + " has an empty label");
            }
        }
    }

    private static void checkInternal(TreeStore store, int node, boolean finished) {
        if (finished && store.childCount(node) < 2) {
            throw new InvariantViolationException("internal node " + node + " has " + store.childCount(node) + " children");
        }
        int link = store.getSuffixLink(node);
        if (link == TreeStore.NO_NODE) {
            throw new InvariantViolationException("internal node " + node + " has no suffix link");
        }
        if (store.stringDepth(link) != store.stringDepth(node) - 1) {
            throw new InvariantViolationException("suffix link " + node + " -> " + link + " does not drop exactly one symbol");
        }
        int current = node;
        int steps = 0;
        while (current != TreeStore.ROOT) {
            current = store.getSuffixLink(current);
            if (current == TreeStore.NO_NODE || ++steps > store.nodeCount()) {
                throw new InvariantViolationException("suffix link chain from " + node + " does not reach the root");
            }
        }
    }

    private static void checkLeaves(TreeStore store) {
        int textLength = store.textLength();
        if (store.leafCount() != textLength) {
            throw new InvariantViolationException(
                    "expected " + textLength + " leaves, found " + store.leafCount());
        }
        BitSet seen = new BitSet(textLength);
        for (int node = 1; node < store.nodeCount(); node++) {
            if (!store.isLeaf(node)) {
                continue;
            }
            int start = store.suffixIndex(node);
            if (start < 0 || start >= textLength || seen.get(start)) {
                throw new InvariantViolationException("leaf " + node + " has duplicate or invalid suffix index " + start);
            }
            seen.set(start);
            if (store.edgeEnd(node) != textLength - 1) {
                throw new InvariantViolationException("leaf " + node + " does not end at the terminator");
            }
            if (pathStart(store, node) != start) {
                throw new InvariantViolationException("leaf " + node + " does not spell suffix " + start);
            }
        }
    }

    // Offset where the path label of a leaf begins, assuming it is a suffix of the text.
    private static int pathStart(TreeStore store, int leaf) {
        int depth = 0;
        int current = leaf;
        int lastEdgeEnd = store.edgeEnd(leaf);
        while (current != TreeStore.ROOT) {
            int start = store.edgeStart(current);
            int length = store.edgeLength(current);
            // the edge label must equal the text right before what we have matched so far
            int expectedEnd = lastEdgeEnd - depth;
            for (int i = length - 1; i >= 0; i--) {
                if (store.symbolAt(start + i) != store.symbolAt(expectedEnd - (length - 1 - i))) {
                    return -1;
                }
            }
            depth += length;
            current = store.parent(current);
        }
        return lastEdgeEnd - depth + 1;
    }
}
