package suffixtree;

/**
 * Raised when the tree or the construction state is internally inconsistent: a duplicate
 * edge key, a missing suffix link where one must be followed, a split outside an edge.
 * Always a construction bug, never a user error; the build is aborted.
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
