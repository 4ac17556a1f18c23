package suffixtree;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.openjdk.jol.info.GraphLayout;
import org.openjdk.jol.vm.VM;
import utilities.MemoryUsageReport;
import utilities.SuffixTreeLogger;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Suffix tree over an integer symbol sequence with a unique terminator appended, built online
 * with Ukkonen's algorithm ({@link UkkonenBuilder}).
 *
 * Query:
 *   contains(pattern) walks edges from the root against the shared text.
 *   occurrences(pattern) lists every start offset of the pattern in the original text.
 *   longestRepeatedSubstring() returns the deepest internal node.
 *
 * Empty patterns and patterns holding the terminator are answered negatively, never with an
 * exception. Children are always visited in ascending first-symbol order, so every traversal
 * and tie-break is deterministic.
 */
public final class SuffixTree {

    private final TreeStore store;
    private final int originalLength;
    private final int terminator;
    private final boolean finished;
    private final boolean textual;
    private final SuffixTreeConfiguration configuration;

    SuffixTree(TreeStore store,
               int originalLength,
               int terminator,
               boolean finished,
               boolean textual,
               SuffixTreeConfiguration configuration) {
        this.store = store;
        this.originalLength = originalLength;
        this.terminator = terminator;
        this.finished = finished;
        this.textual = textual;
        this.configuration = configuration;
    }

    // ---------------------------------------------------------------------
    // Construction entry points
    // ---------------------------------------------------------------------

    /** Build a suffix tree for {@code input} with the default terminator (-1). */
    public static SuffixTree build(int[] input) {
        return build(input, SuffixTreeConfiguration.defaults());
    }

    /** Build a suffix tree for {@code input}, appending {@code terminator}. */
    public static SuffixTree build(int[] input, int terminator) {
        return build(input, SuffixTreeConfiguration.builder().terminator(terminator).build());
    }

    public static SuffixTree build(int[] input, SuffixTreeConfiguration configuration) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(configuration, "configuration");
        requireNoTerminator(input, configuration.terminator());

        long startNanos = System.nanoTime();
        UkkonenBuilder builder = new UkkonenBuilder(sized(configuration, input.length));
        builder.appendAll(input);
        SuffixTree tree = builder.build();
        logBuilt(input.length, startNanos);
        return tree;
    }

    /** Build a suffix tree over the UTF-16 code units of {@code text}. */
    public static SuffixTree of(CharSequence text) {
        return of(text, SuffixTreeConfiguration.defaults());
    }

    public static SuffixTree of(CharSequence text, SuffixTreeConfiguration configuration) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(configuration, "configuration");
        int[] symbols = toSymbols(text, configuration.caseSensitive());
        requireNoTerminator(symbols, configuration.terminator());

        long startNanos = System.nanoTime();
        UkkonenBuilder builder = new UkkonenBuilder(sized(configuration, symbols.length));
        builder.appendAll(symbols);
        SuffixTree tree = builder.build(true);
        logBuilt(symbols.length, startNanos);
        return tree;
    }

    private static SuffixTreeConfiguration sized(SuffixTreeConfiguration configuration, int length) {
        if (configuration.expectedLength() >= length) {
            return configuration;
        }
        return configuration.toBuilder().expectedLength(length).build();
    }

    private static void requireNoTerminator(int[] input, int terminator) {
        for (int i = 0; i < input.length; i++) {
            if (input[i] == terminator) {
                throw new IllegalArgumentException(
                        "input contains the reserved terminator " + terminator + " at offset " + i);
            }
        }
    }

    private static void logBuilt(int length, long startNanos) {
        if (SuffixTreeLogger.isDebugEnabled()) {
            SuffixTreeLogger.debug(String.format(Locale.ROOT,
                    "suffix tree over %d symbols built in %.3f ms", length, (System.nanoTime() - startNanos) / 1e6));
        }
    }

    static int[] toSymbols(CharSequence text, boolean caseSensitive) {
        int[] symbols = new int[text.length()];
        for (int i = 0; i < symbols.length; i++) {
            char c = text.charAt(i);
            // per code unit so that offsets stay aligned with the caller's text
            symbols[i] = caseSensitive ? c : Character.toLowerCase(c);
        }
        return symbols;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public int getRoot() {
        return TreeStore.ROOT;
    }

    /** Number of input symbols, excluding the terminator. */
    public int getOriginalLength() {
        return originalLength;
    }

    /** Copy of the indexed text, including the terminator when the tree is finished. */
    public int[] getText() {
        return store.textCopy();
    }

    public int terminator() {
        return terminator;
    }

    public boolean isFinished() {
        return finished;
    }

    public boolean isTextual() {
        return textual;
    }

    public SuffixTreeConfiguration configuration() {
        return configuration;
    }

    TreeStore store() {
        return store;
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public boolean contains(int[] pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return pattern.length > 0 && locate(pattern) != null;
    }

    public boolean contains(CharSequence pattern) {
        return contains(querySymbols(pattern));
    }

    /** Start offsets of {@code pattern}, in pre-order over ascending edge symbols. */
    public Occurrences occurrences(int[] pattern) {
        Objects.requireNonNull(pattern, "pattern");
        if (pattern.length == 0) {
            return Occurrences.none();
        }
        Locus locus = locate(pattern);
        if (locus == null) {
            return Occurrences.none();
        }
        int pendingFrom = finished ? store.textLength() : store.leafCount();
        return new Occurrences(store, locus.subtreeRoot(), pattern.clone(), pendingFrom);
    }

    public Occurrences occurrences(CharSequence pattern) {
        return occurrences(querySymbols(pattern));
    }

    /**
     * Walk {@code pattern} down from the root. Returns null when it is not spelled by any path;
     * the empty pattern locates the root.
     */
    public Locus locate(int[] pattern) {
        Objects.requireNonNull(pattern, "pattern");
        int node = TreeStore.ROOT;
        int i = 0;
        while (i < pattern.length) {
            if (pattern[i] == terminator) {
                return null;
            }
            int child = store.walk(node, pattern[i]);
            if (child == TreeStore.NO_NODE) {
                return null;
            }
            int edgeStart = store.edgeStart(child);
            int edgeLength = store.edgeLength(child);
            int consumed = 0;
            while (consumed < edgeLength && i < pattern.length) {
                if (pattern[i] == terminator || store.symbolAt(edgeStart + consumed) != pattern[i]) {
                    return null;
                }
                consumed++;
                i++;
            }
            if (consumed < edgeLength) {
                // pattern ran out in the middle of this edge
                return new Locus(node, child, consumed, pattern.length);
            }
            node = child;
        }
        return new Locus(node, TreeStore.NO_NODE, 0, pattern.length);
    }

    public Locus locate(CharSequence pattern) {
        return locate(querySymbols(pattern));
    }

    private int[] querySymbols(CharSequence pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return toSymbols(pattern, configuration.caseSensitive());
    }

    /**
     * Longest substring occurring at least twice: the internal node of greatest string depth.
     * Ties go to the substring whose leftmost occurrence comes first; {@code start} is that
     * leftmost occurrence. Returns {@link Match#NONE} when no symbol repeats.
     */
    public Match longestRepeatedSubstring() {
        if (!finished) {
            throw new IllegalStateException("longest repeated substring needs a finished tree");
        }
        int nodeCount = store.nodeCount();
        int[] leftmost = new int[nodeCount];
        Arrays.fill(leftmost, Integer.MAX_VALUE);

        IntArrayList preorder = depthFirst();
        for (int k = preorder.size() - 1; k >= 0; k--) {
            int node = preorder.getInt(k);
            if (store.isLeaf(node)) {
                leftmost[node] = store.suffixIndex(node);
            }
            int up = store.parent(node);
            if (up != TreeStore.NO_NODE && leftmost[node] < leftmost[up]) {
                leftmost[up] = leftmost[node];
            }
        }

        int bestDepth = 0;
        int bestStart = -1;
        for (int k = 0; k < preorder.size(); k++) {
            int node = preorder.getInt(k);
            if (node == TreeStore.ROOT || store.isLeaf(node)) {
                continue;
            }
            int depth = store.stringDepth(node);
            if (depth > bestDepth || (depth == bestDepth && leftmost[node] < bestStart)) {
                bestDepth = depth;
                bestStart = leftmost[node];
            }
        }
        return bestDepth == 0 ? Match.NONE : new Match(bestStart, bestDepth);
    }

    /** {@link #longestRepeatedSubstring()} as text; empty when nothing repeats. */
    public String longestRepeatedSubstringText() {
        Match match = longestRepeatedSubstring();
        return match.isEmpty() ? "" : render(match.start(), match.end());
    }

    // ---------------------------------------------------------------------
    // Traversal
    // ---------------------------------------------------------------------

    /** Node ids in pre-order, children by ascending first symbol. */
    public IntArrayList depthFirst() {
        IntArrayList out = new IntArrayList(store.nodeCount());
        IntArrayList stack = new IntArrayList();
        stack.add(TreeStore.ROOT);
        while (!stack.isEmpty()) {
            int node = stack.popInt();
            out.add(node);
            int[] children = store.children(node);
            for (int i = children.length - 1; i >= 0; i--) {
                stack.add(children[i]);
            }
        }
        return out;
    }

    /** Node ids level by level, children by ascending first symbol. */
    public IntArrayList breadthFirst() {
        IntArrayList out = new IntArrayList(store.nodeCount());
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(TreeStore.ROOT);
        while (!queue.isEmpty()) {
            int node = queue.dequeueInt();
            out.add(node);
            for (int child : store.children(node)) {
                queue.enqueue(child);
            }
        }
        return out;
    }

    /** Symbols spelled on the path from the root to {@code node}. */
    public int[] pathLabel(int node) {
        int[] label = new int[store.stringDepth(node)];
        int pos = label.length;
        int current = node;
        while (current != TreeStore.ROOT) {
            int start = store.edgeStart(current);
            int length = store.edgeLength(current);
            pos -= length;
            for (int i = 0; i < length; i++) {
                label[pos + i] = store.symbolAt(start + i);
            }
            current = store.parent(current);
        }
        return label;
    }

    public String pathLabelText(int node) {
        int[] label = pathLabel(node);
        return renderSymbols(label, 0, label.length);
    }

    /** text[from, to) in display form. */
    String render(int from, int to) {
        int[] symbols = new int[to - from];
        for (int i = 0; i < symbols.length; i++) {
            symbols[i] = store.symbolAt(from + i);
        }
        return renderSymbols(symbols, 0, symbols.length);
    }

    // Characters for text trees, space separated ids otherwise; the terminator prints as '$'.
    String renderSymbols(int[] symbols, int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            int symbol = symbols[i];
            if (!textual && sb.length() > 0) {
                sb.append(' ');
            }
            if (symbol == terminator) {
                sb.append('$');
            } else if (textual) {
                sb.append((char) symbol);
            } else {
                sb.append(symbol);
            }
        }
        return sb.toString();
    }

    // ---------------------------------------------------------------------
    // Reporting
    // ---------------------------------------------------------------------

    public TreeStats stats() {
        int maxInternalDepth = 0;
        int nodeCount = store.nodeCount();
        for (int node = 1; node < nodeCount; node++) {
            if (!store.isLeaf(node)) {
                maxInternalDepth = Math.max(maxInternalDepth, store.stringDepth(node));
            }
        }
        int leaves = store.leafCount();
        return new TreeStats(originalLength, nodeCount, nodeCount - leaves - 1, leaves, maxInternalDepth);
    }

    /**
     * Memory footprint of the tree measured with JOL.
     *
     * @param includeFootprintTable when true, append the class histogram of the store
     */
    public MemoryUsageReport memoryReport(boolean includeFootprintTable) {
        GraphLayout layout = GraphLayout.parseInstance(store);
        long totalBytes = layout.totalSize();
        TreeStats stats = stats();

        StringBuilder sb = new StringBuilder(1_024);
        sb.append("=== JOL / VM details ===\n");
        sb.append(VM.current().details()).append('\n');
        sb.append(String.format(Locale.ROOT, "Total: %d B (%.3f MiB)%n", totalBytes, totalBytes / (1024.0 * 1024.0)));
        sb.append(String.format(Locale.ROOT, "Nodes: %d (internal %d, leaves %d)%n",
                stats.nodes(), stats.internalNodes(), stats.leaves()));
        double perSymbol = totalBytes / (double) Math.max(1, store.textLength());
        sb.append(String.format(Locale.ROOT, "Bytes per symbol: %.1f%n", perSymbol));
        if (includeFootprintTable) {
            sb.append("\n--- Class footprint (tree store) ---\n");
            sb.append(layout.toFootprint()).append('\n');
        }
        return new MemoryUsageReport(sb.toString(), totalBytes, perSymbol);
    }
}
