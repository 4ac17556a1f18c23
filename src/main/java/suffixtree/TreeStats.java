package suffixtree;

/** Shape of a built tree. {@code textLength} excludes the terminator. */
public record TreeStats(int textLength,
                        int nodes,
                        int internalNodes,
                        int leaves,
                        int maxInternalDepth) {
}
