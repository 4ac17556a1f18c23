package suffixtree;

/**
 * A substring of the indexed text given as (start, length). {@link #NONE} stands for
 * "no such substring".
 */
public record Match(int start, int length) {

    public static final Match NONE = new Match(-1, 0);

    public boolean isEmpty() {
        return length == 0;
    }

    public int end() {
        return start + length;
    }
}
