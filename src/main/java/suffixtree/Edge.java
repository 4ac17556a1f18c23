package suffixtree;

/**
 * Read-only snapshot of an edge. The label is text[start .. end], end inclusive, resolved
 * against the global end at the time the snapshot was taken. An edge is identified by its
 * child, since every non-root node has exactly one incoming edge.
 */
public record Edge(int parent, int child, int start, int end, boolean open) {

    public int length() {
        return end - start + 1;
    }
}
