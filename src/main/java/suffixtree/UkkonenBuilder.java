package suffixtree;

import utilities.SuffixTreeLogger;

import java.util.Locale;
import java.util.Objects;

/**
 * Online suffix tree construction with Ukkonen's algorithm.
 *
 * <p>Each {@link #append(int)} is one phase: the shared leaf end moves forward (rule 1 for
 * every leaf at once), then the pending suffixes are inserted until one of them is found to
 * be present already (rule 3). {@link #build()} appends the terminator, which turns every
 * implicit suffix into a leaf, and hands the finished store to a {@link SuffixTree}.
 *
 * <p>The tree may be queried between phases through {@link #contains(int[])} and
 * {@link #occurrences(int[])}. Not thread-safe: a single writer owns the builder.
 */
public final class UkkonenBuilder {

    private final TreeStore store;
    private final SuffixTreeConfiguration configuration;
    private final int terminator;

    // Ukkonen active point
    private int activeNode = TreeStore.ROOT;
    private int activeEdge = -1;     // offset in the text naming the active edge
    private int activeLength = 0;    // symbols matched along the active edge

    // Ukkonen bookkeeping
    private int remainingSuffixCount = 0;
    private int lastInternalNode = TreeStore.NO_NODE;
    private boolean finished = false;

    // counters, reported at FINE when the tree is built
    private long splits;
    private long walkDowns;
    private long showStoppers;

    public UkkonenBuilder() {
        this(SuffixTreeConfiguration.defaults());
    }

    public UkkonenBuilder(SuffixTreeConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.terminator = configuration.terminator();
        this.store = new TreeStore(configuration.expectedLength());
    }

    /** Number of symbols appended so far, excluding the terminator. */
    public int length() {
        return finished ? store.textLength() - 1 : store.textLength();
    }

    public int terminator() {
        return terminator;
    }

    public boolean isFinished() {
        return finished;
    }

    /** Extend the tree by one symbol. */
    public UkkonenBuilder append(int symbol) {
        if (finished) {
            throw new IllegalStateException("tree already built; no more symbols can be appended");
        }
        if (symbol == terminator) {
            throw new IllegalArgumentException(
                    "symbol at offset " + store.textLength() + " is the reserved terminator " + terminator);
        }
        extend(store.appendSymbol(symbol));
        return this;
    }

    public UkkonenBuilder appendAll(int[] symbols) {
        Objects.requireNonNull(symbols, "symbols");
        for (int symbol : symbols) {
            append(symbol);
        }
        return this;
    }

    /** Substring test against the implicit tree built so far. */
    public boolean contains(int[] pattern) {
        return view().contains(pattern);
    }

    /**
     * Occurrences in the symbols appended so far. The result reads the live tree and is only
     * valid until the next {@link #append(int)}.
     */
    public Occurrences occurrences(int[] pattern) {
        return view().occurrences(pattern);
    }

    private SuffixTree view() {
        if (finished) {
            throw new IllegalStateException("builder already produced its tree");
        }
        return new SuffixTree(store, store.textLength(), terminator, false, false, configuration);
    }

    /** Append the terminator and freeze the tree. */
    public SuffixTree build() {
        return build(false);
    }

    SuffixTree build(boolean textual) {
        if (finished) {
            throw new IllegalStateException("build() may only be called once");
        }
        int originalLength = store.textLength();
        extend(store.appendSymbol(terminator));
        finished = true;

        if (remainingSuffixCount != 0 || store.leafCount() != store.textLength()) {
            throw new InvariantViolationException(String.format(Locale.ROOT,
                    "terminator left %d pending suffixes, %d leaves for %d suffixes",
                    remainingSuffixCount, store.leafCount(), store.textLength()));
        }
        store.compact();

        SuffixTree tree = new SuffixTree(store, originalLength, terminator, true, textual, configuration);
        if (configuration.verify()) {
            TreeInvariants.check(tree);
        }
        if (SuffixTreeLogger.isDebugEnabled()) {
            SuffixTreeLogger.debug(String.format(Locale.ROOT,
                    "built suffix tree: length=%d nodes=%d leaves=%d splits=%d walkDowns=%d showStoppers=%d",
                    originalLength, store.nodeCount(), store.leafCount(), splits, walkDowns, showStoppers));
        }
        return tree;
    }

    /** One Ukkonen phase for the symbol at {@code pos}. */
    private void extend(int pos) {
        store.advanceGlobalEnd(pos);
        remainingSuffixCount++;
        lastInternalNode = TreeStore.NO_NODE;
        int symbol = store.symbolAt(pos);

        while (remainingSuffixCount > 0) {
            if (activeLength == 0) {
                activeEdge = pos;
            }

            int edgeSymbol = store.symbolAt(activeEdge);
            int next = store.walk(activeNode, edgeSymbol);

            if (next == TreeStore.NO_NODE) {
                if (activeLength != 0) {
                    throw new InvariantViolationException(
                            "active point (" + activeNode + ", " + activeEdge + ", " + activeLength
                                    + ") references a missing edge");
                }
                // rule 2: new leaf straight off the active node
                int leaf = store.createLeaf(pos - remainingSuffixCount + 1);
                store.addEdge(activeNode, leaf, pos, TreeStore.OPEN);
                linkPending(activeNode);
            } else {
                if (walkDown(next)) {
                    continue;
                }

                int edgeStart = store.edgeStart(next);
                if (store.symbolAt(edgeStart + activeLength) == symbol) {
                    // rule 3: already present, the rest of this phase is implicit
                    linkPending(activeNode);
                    activeLength++;
                    showStoppers++;
                    break;
                }

                // rule 2: mismatch inside the edge
                int split = store.splitEdge(next, edgeStart + activeLength);
                int leaf = store.createLeaf(pos - remainingSuffixCount + 1);
                store.addEdge(split, leaf, pos, TreeStore.OPEN);
                linkPending(split);
                lastInternalNode = split;
                splits++;
            }

            remainingSuffixCount--;

            if (activeNode == TreeStore.ROOT && activeLength > 0) {
                activeLength--;
                activeEdge = pos - remainingSuffixCount + 1;
            } else if (activeNode != TreeStore.ROOT) {
                int link = store.getSuffixLink(activeNode);
                if (link == TreeStore.NO_NODE) {
                    throw new InvariantViolationException("internal node " + activeNode + " has no suffix link");
                }
                activeNode = link;
            }
        }

        if (SuffixTreeLogger.isTraceEnabled()) {
            SuffixTreeLogger.trace(String.format(Locale.ROOT,
                    "phase %d: active=(%d, %d, %d) remaining=%d nodes=%d",
                    pos, activeNode, activeEdge, activeLength, remainingSuffixCount, store.nodeCount()));
        }
    }

    /** Give the internal node created earlier in this phase its suffix link. */
    private void linkPending(int target) {
        if (lastInternalNode != TreeStore.NO_NODE) {
            store.setSuffixLink(lastInternalNode, target);
            lastInternalNode = TreeStore.NO_NODE;
        }
    }

    /**
     * Skip/count: if the active length covers the whole edge into {@code next}, move the
     * active point down to {@code next} and report true so the caller retries from there.
     */
    private boolean walkDown(int next) {
        int edgeLength = store.edgeLength(next);
        if (activeLength >= edgeLength) {
            activeEdge += edgeLength;
            activeLength -= edgeLength;
            activeNode = next;
            walkDowns++;
            return true;
        }
        return false;
    }
}
