package suffixtree;

/**
 * Position reached after spelling a string from the root.
 *
 * <p>{@code node} is the deepest explicit node on the path. When the string ends inside an
 * edge, {@code child} is the node that edge enters and {@code offset} is the number of
 * symbols consumed on it; when it ends exactly on {@code node}, child is
 * {@link TreeStore#NO_NODE} and offset is 0.
 */
public record Locus(int node, int child, int offset, int depth) {

    public boolean endsOnNode() {
        return offset == 0;
    }

    /** Node whose subtree holds every suffix that starts with the located string. */
    public int subtreeRoot() {
        return endsOnNode() ? node : child;
    }
}
