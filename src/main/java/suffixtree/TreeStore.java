package suffixtree;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.Arrays;
import java.util.Collections;

/**
 * Arena that owns every node and edge of a suffix tree.
 *
 * Nodes are dense int ids; every attribute lives in its own column. The incoming edge of a
 * node is stored on the node itself (start, end), so an edge is addressed by its child id.
 * Edge labels are never copied: they are ranges over the shared text buffer.
 *
 * Memory layout:
 *  - Lazy children: a node's Int2IntOpenHashMap (first symbol -> child) is null until the
 *    first outgoing edge is added, so leaves carry no map at all.
 *  - One shared global end. Leaf edges store {@link #OPEN} and resolve it on read, which is
 *    what lets a phase extend every leaf in O(1).
 *  - Suffix links are plain id-to-id associations with no ownership.
 */
public final class TreeStore {

    public static final int ROOT = 0;
    public static final int NO_NODE = -1;
    public static final int OPEN = -1;

    private final IntArrayList text;

    private final IntArrayList edgeStart;
    private final IntArrayList edgeEnd;
    private final IntArrayList parent;
    private final IntArrayList suffixLink;
    private final IntArrayList suffixIndex;
    private final IntArrayList stringDepth;
    private final ObjectArrayList<Int2IntOpenHashMap> children;

    private int globalEnd = -1;
    private int leafCount = 0;

    public TreeStore() {
        this(16);
    }

    public TreeStore(int expectedLength) {
        int textCapacity = Math.max(16, expectedLength + 1);
        int nodeCapacity = Math.max(16, 2 * textCapacity);
        this.text = new IntArrayList(textCapacity);
        this.edgeStart = new IntArrayList(nodeCapacity);
        this.edgeEnd = new IntArrayList(nodeCapacity);
        this.parent = new IntArrayList(nodeCapacity);
        this.suffixLink = new IntArrayList(nodeCapacity);
        this.suffixIndex = new IntArrayList(nodeCapacity);
        this.stringDepth = new IntArrayList(nodeCapacity);
        this.children = new ObjectArrayList<>(nodeCapacity);

        int root = createNode();
        stringDepth.set(root, 0);
        suffixLink.set(root, root); // the root is its own suffix-link base case
    }

    // ---------------------------------------------------------------------
    // Text buffer and global end
    // ---------------------------------------------------------------------

    /** Append one symbol and return its offset. Does not advance the global end. */
    int appendSymbol(int symbol) {
        text.add(symbol);
        return text.size() - 1;
    }

    public int symbolAt(int offset) {
        return text.getInt(offset);
    }

    public int textLength() {
        return text.size();
    }

    int[] textCopy() {
        return text.toIntArray();
    }

    public int globalEnd() {
        return globalEnd;
    }

    /** Every open (leaf) edge now ends at {@code end}. */
    void advanceGlobalEnd(int end) {
        if (end < globalEnd || end >= text.size()) {
            throw new InvariantViolationException(
                    "global end cannot move from " + globalEnd + " to " + end + " (text length " + text.size() + ")");
        }
        globalEnd = end;
    }

    // ---------------------------------------------------------------------
    // Node creation
    // ---------------------------------------------------------------------

    /** Allocate an internal node with no edges and no suffix link. */
    public int createNode() {
        int id = edgeStart.size();
        edgeStart.add(-1);
        edgeEnd.add(-1);
        parent.add(NO_NODE);
        suffixLink.add(NO_NODE);
        suffixIndex.add(-1);
        stringDepth.add(-1);
        children.add(null);
        return id;
    }

    /** Allocate a leaf for the suffix starting at {@code suffixStart}. */
    public int createLeaf(int suffixStart) {
        int id = createNode();
        suffixIndex.set(id, suffixStart);
        leafCount++;
        return id;
    }

    // ---------------------------------------------------------------------
    // Edges
    // ---------------------------------------------------------------------

    /**
     * Insert an edge parent -> child labelled text[start .. end]. Pass {@link #OPEN} as
     * {@code end} for a leaf edge that follows the global end.
     */
    public void addEdge(int parentNode, int child, int start, int end) {
        if (child == ROOT || parent.getInt(child) != NO_NODE) {
            throw new InvariantViolationException("node " + child + " already has an incoming edge");
        }
        if (end != OPEN && end < start) {
            throw new InvariantViolationException("empty edge label [" + start + ", " + end + "]");
        }
        int key = text.getInt(start);
        Int2IntOpenHashMap map = children.get(parentNode);
        if (map == null) {
            map = new Int2IntOpenHashMap(2);
            map.defaultReturnValue(NO_NODE);
            children.set(parentNode, map);
        } else if (map.containsKey(key)) {
            throw new InvariantViolationException(
                    "duplicate edge key " + key + " on node " + parentNode);
        }
        map.put(key, child);
        edgeStart.set(child, start);
        edgeEnd.set(child, end);
        parent.set(child, parentNode);
    }

    /**
     * Split the edge entering {@code child} so that a new internal node sits right before
     * offset {@code atOffset}. The upper half becomes text[start .. atOffset - 1]; the lower
     * half keeps the child and its original end marker, open or not.
     *
     * @return id of the new internal node
     */
    public int splitEdge(int child, int atOffset) {
        if (child == ROOT) {
            throw new InvariantViolationException("the root has no incoming edge to split");
        }
        int start = edgeStart.getInt(child);
        int end = edgeEnd(child);
        if (atOffset <= start || atOffset > end) {
            throw new InvariantViolationException(
                    "split offset " + atOffset + " outside edge [" + start + ", " + end + "]");
        }
        int up = parent.getInt(child);

        int mid = createNode();
        stringDepth.set(mid, stringDepth.getInt(up) + (atOffset - start));

        // upper half replaces the old edge under the same key
        children.get(up).put(text.getInt(start), mid);
        edgeStart.set(mid, start);
        edgeEnd.set(mid, atOffset - 1);
        parent.set(mid, up);

        // lower half moves under the new node
        edgeStart.set(child, atOffset);
        parent.set(child, mid);
        Int2IntOpenHashMap map = new Int2IntOpenHashMap(2);
        map.defaultReturnValue(NO_NODE);
        map.put(text.getInt(atOffset), child);
        children.set(mid, map);
        return mid;
    }

    /** Child reached from {@code node} by the edge starting with {@code symbol}, or {@link #NO_NODE}. */
    public int walk(int node, int symbol) {
        Int2IntOpenHashMap map = children.get(node);
        return map == null ? NO_NODE : map.get(symbol);
    }

    /** Snapshot of the edge starting with {@code symbol}, or null when there is none. */
    public Edge getEdge(int node, int symbol) {
        int child = walk(node, symbol);
        return child == NO_NODE ? null : edgeInto(child);
    }

    /** Snapshot of the incoming edge of {@code child}. */
    public Edge edgeInto(int child) {
        if (child == ROOT) {
            throw new IllegalArgumentException("the root has no incoming edge");
        }
        return new Edge(parent.getInt(child), child, edgeStart.getInt(child), edgeEnd(child),
                edgeEnd.getInt(child) == OPEN);
    }

    public int edgeStart(int child) {
        return edgeStart.getInt(child);
    }

    /** Inclusive end of the incoming edge, resolving {@link #OPEN} to the global end. */
    public int edgeEnd(int child) {
        int end = edgeEnd.getInt(child);
        return end == OPEN ? globalEnd : end;
    }

    public int edgeLength(int child) {
        return edgeEnd(child) - edgeStart.getInt(child) + 1;
    }

    public boolean isOpen(int child) {
        return child != ROOT && edgeEnd.getInt(child) == OPEN;
    }

    // ---------------------------------------------------------------------
    // Suffix links
    // ---------------------------------------------------------------------

    public void setSuffixLink(int node, int target) {
        if (target < 0 || target >= nodeCount()) {
            throw new InvariantViolationException("suffix link target " + target + " is not a node");
        }
        suffixLink.set(node, target);
    }

    /** Suffix link of {@code node}, or {@link #NO_NODE} when not set yet. */
    public int getSuffixLink(int node) {
        return suffixLink.getInt(node);
    }

    // ---------------------------------------------------------------------
    // Structure
    // ---------------------------------------------------------------------

    public int nodeCount() {
        return edgeStart.size();
    }

    public int leafCount() {
        return leafCount;
    }

    public int parent(int node) {
        return parent.getInt(node);
    }

    public boolean isLeaf(int node) {
        return suffixIndex.getInt(node) >= 0;
    }

    /** Start offset of the suffix a leaf spells, -1 for root and internal nodes. */
    public int suffixIndex(int node) {
        return suffixIndex.getInt(node);
    }

    /** Number of symbols on the path from the root to {@code node}. */
    public int stringDepth(int node) {
        if (isLeaf(node)) {
            return globalEnd - suffixIndex.getInt(node) + 1;
        }
        return stringDepth.getInt(node);
    }

    public int childCount(int node) {
        Int2IntOpenHashMap map = children.get(node);
        return map == null ? 0 : map.size();
    }

    /** First symbols of the outgoing edges, ascending. */
    public int[] edgeKeys(int node) {
        Int2IntOpenHashMap map = children.get(node);
        if (map == null || map.isEmpty()) {
            return new int[0];
        }
        int[] keys = map.keySet().toIntArray();
        Arrays.sort(keys);
        return keys;
    }

    /** Children ordered by the first symbol of their incoming edge, ascending. */
    public int[] children(int node) {
        Int2IntOpenHashMap map = children.get(node);
        if (map == null || map.isEmpty()) {
            return new int[0];
        }
        int[] keys = edgeKeys(node);
        int[] out = new int[keys.length];
        for (int i = 0; i < keys.length; i++) {
            out[i] = map.get(keys[i]);
        }
        return out;
    }

    /** Raw (key, child) entries in hash order, for checks that do not care about ordering. */
    Iterable<Int2IntMap.Entry> edgeEntries(int node) {
        Int2IntOpenHashMap map = children.get(node);
        if (map == null) {
            return Collections.emptyList();
        }
        return map.int2IntEntrySet();
    }

    /** Trim every column to its exact size once no more symbols will be appended. */
    void compact() {
        text.trim();
        edgeStart.trim();
        edgeEnd.trim();
        parent.trim();
        suffixLink.trim();
        suffixIndex.trim();
        stringDepth.trim();
        children.trim();
        for (Int2IntOpenHashMap map : children) {
            if (map != null) {
                map.trim();
            }
        }
    }
}
