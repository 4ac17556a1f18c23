package suffixtree;

import utilities.AlphabetMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Suffix tree over a sequence of arbitrary tokens (words, ids, records with proper equals and
 * hashCode). Tokens are mapped to dense ids by an {@link AlphabetMapper}; edge order, and so
 * traversal order, follows first appearance in the input. Query tokens that never occur in
 * the input simply produce no match.
 */
public final class TokenSuffixTree<T> {

    private final AlphabetMapper<T> alphabet;
    private final List<T> tokens;
    private final SuffixTree tree;

    private TokenSuffixTree(AlphabetMapper<T> alphabet, List<T> tokens, SuffixTree tree) {
        this.alphabet = alphabet;
        this.tokens = tokens;
        this.tree = tree;
    }

    public static <T> TokenSuffixTree<T> build(List<? extends T> tokens) {
        return build(tokens, SuffixTreeConfiguration.defaults());
    }

    public static <T> TokenSuffixTree<T> build(List<? extends T> tokens, SuffixTreeConfiguration configuration) {
        Objects.requireNonNull(tokens, "tokens");
        Objects.requireNonNull(configuration, "configuration");
        if (configuration.terminator() >= 0) {
            throw new IllegalArgumentException(
                    "token ids start at 0; the terminator must be negative, got " + configuration.terminator());
        }
        AlphabetMapper<T> alphabet = new AlphabetMapper<>(Math.max(16, tokens.size() / 4));
        int[] ids = alphabet.encode(tokens);
        SuffixTree tree = SuffixTree.build(ids, configuration);
        return new TokenSuffixTree<>(alphabet, Collections.unmodifiableList(new ArrayList<T>(tokens)), tree);
    }

    public boolean contains(List<? extends T> pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return tree.contains(alphabet.lookupAll(pattern));
    }

    public Occurrences occurrences(List<? extends T> pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return tree.occurrences(alphabet.lookupAll(pattern));
    }

    public Match longestRepeatedMatch() {
        return tree.longestRepeatedSubstring();
    }

    /** Tokens of the longest repeated run; empty when no token repeats. */
    public List<T> longestRepeatedSubstring() {
        Match match = tree.longestRepeatedSubstring();
        if (match.isEmpty()) {
            return Collections.emptyList();
        }
        return tokens.subList(match.start(), match.end());
    }

    public int alphabetSize() {
        return alphabet.getSize();
    }

    public List<T> tokens() {
        return tokens;
    }

    public SuffixTree tree() {
        return tree;
    }
}
