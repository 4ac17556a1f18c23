package suffixtree;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntIterable;
import it.unimi.dsi.fastutil.ints.IntIterator;

import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * Start offsets of a pattern, produced lazily by walking the subtree below the matched
 * position. Restartable: every {@link #iterator()} walks the subtree again.
 *
 * <p>Order: pre-order over outgoing edges sorted by ascending first symbol. For a tree that
 * is still being built, suffixes that are not leaves yet are checked directly against the
 * text and reported after the leaves, in increasing offset order.
 */
public final class Occurrences implements IntIterable {

    private static final Occurrences NONE = new Occurrences(null, TreeStore.NO_NODE, null, 0);

    private final TreeStore store;
    private final int subtreeRoot;
    private final int[] pattern;
    private final int pendingFrom;

    Occurrences(TreeStore store, int subtreeRoot, int[] pattern, int pendingFrom) {
        this.store = store;
        this.subtreeRoot = subtreeRoot;
        this.pattern = pattern;
        this.pendingFrom = pendingFrom;
    }

    static Occurrences none() {
        return NONE;
    }

    @Override
    public IntIterator iterator() {
        if (subtreeRoot == TreeStore.NO_NODE) {
            return new LeafIterator(null, TreeStore.NO_NODE, null, 0);
        }
        return new LeafIterator(store, subtreeRoot, pattern, pendingFrom);
    }

    public boolean isEmpty() {
        return !iterator().hasNext();
    }

    public int count() {
        int n = 0;
        IntIterator it = iterator();
        while (it.hasNext()) {
            it.nextInt();
            n++;
        }
        return n;
    }

    /** All offsets in traversal order. */
    public IntArrayList toList() {
        IntArrayList out = new IntArrayList();
        IntIterator it = iterator();
        while (it.hasNext()) {
            out.add(it.nextInt());
        }
        return out;
    }

    public int[] toSortedArray() {
        int[] out = toList().toIntArray();
        Arrays.sort(out);
        return out;
    }

    @Override
    public String toString() {
        return toList().toString();
    }

    private static final class LeafIterator implements IntIterator {
        private final TreeStore store;
        private final int[] pattern;
        private final IntArrayList stack = new IntArrayList();
        private int pendingCursor;
        private int next = -1;

        LeafIterator(TreeStore store, int subtreeRoot, int[] pattern, int pendingFrom) {
            this.store = store;
            this.pattern = pattern;
            this.pendingCursor = store == null ? 0 : pendingFrom;
            if (store != null) {
                stack.add(subtreeRoot);
            }
        }

        @Override
        public boolean hasNext() {
            if (next >= 0) {
                return true;
            }
            next = advance();
            return next >= 0;
        }

        @Override
        public int nextInt() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int out = next;
            next = -1;
            return out;
        }

        private int advance() {
            while (!stack.isEmpty()) {
                int node = stack.popInt();
                if (store.isLeaf(node)) {
                    return store.suffixIndex(node);
                }
                int[] children = store.children(node);
                for (int i = children.length - 1; i >= 0; i--) {
                    stack.add(children[i]);
                }
            }
            if (store == null) {
                return -1;
            }
            // implicit suffixes of a tree under construction
            int textLength = store.textLength();
            while (pendingCursor + pattern.length <= textLength) {
                int candidate = pendingCursor++;
                if (matchesAt(candidate)) {
                    return candidate;
                }
            }
            return -1;
        }

        private boolean matchesAt(int offset) {
            for (int i = 0; i < pattern.length; i++) {
                if (store.symbolAt(offset + i) != pattern[i]) {
                    return false;
                }
            }
            return true;
        }
    }
}
