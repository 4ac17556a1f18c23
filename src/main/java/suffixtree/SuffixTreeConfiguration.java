package suffixtree;

// Immutable configuration for building suffix trees.
public final class SuffixTreeConfiguration {

    public static final int DEFAULT_TERMINATOR = -1;

    private static final SuffixTreeConfiguration DEFAULTS = builder().build();

    private final int terminator;
    private final boolean caseSensitive;
    private final boolean verify;
    private final int expectedLength;

    private SuffixTreeConfiguration(Builder builder) {
        this.terminator = builder.terminator;
        this.caseSensitive = builder.caseSensitive;
        this.verify = builder.verify;
        this.expectedLength = builder.expectedLength;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    public static SuffixTreeConfiguration defaults() { return DEFAULTS; }

    private void validate() {
        if (expectedLength < 0) {
            throw new IllegalArgumentException("expectedLength must be non-negative");
        }
    }

    // Symbol appended after the input; must not occur in it.
    public int terminator() { return terminator; }
    // When false, text and CharSequence queries are lower-cased symbol by symbol.
    public boolean caseSensitive() { return caseSensitive; }
    // Run TreeInvariants.check on every finished tree.
    public boolean verify() { return verify; }
    // Capacity hint for the store columns.
    public int expectedLength() { return expectedLength; }

    public Builder toBuilder() {
        return new Builder()
                .terminator(terminator)
                .caseSensitive(caseSensitive)
                .verify(verify)
                .expectedLength(expectedLength);
    }

    public static final class Builder {
        private int terminator = DEFAULT_TERMINATOR;
        private boolean caseSensitive = true;
        private boolean verify;
        private int expectedLength = 16;

        private Builder() {
        }

        public Builder terminator(int terminator) {
            this.terminator = terminator;
            return this;
        }

        public Builder caseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
            return this;
        }

        public Builder verify(boolean verify) {
            this.verify = verify;
            return this;
        }

        public Builder expectedLength(int expectedLength) {
            this.expectedLength = expectedLength;
            return this;
        }

        public SuffixTreeConfiguration build() {
            return new SuffixTreeConfiguration(this);
        }
    }
}
