package suffixtree;

import datagenerators.RandomSequences;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class UkkonenBuilderTest {

    private static int[] symbols(String s) {
        return SuffixTree.toSymbols(s, true);
    }

    @Test
    void rejectsTerminatorSymbol() {
        UkkonenBuilder builder = new UkkonenBuilder();
        builder.append('a');
        assertThatThrownBy(() -> builder.append(SuffixTreeConfiguration.DEFAULT_TERMINATOR))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("offset 1");
        // a rejected symbol leaves the builder usable
        assertThat(builder.append('b').length()).isEqualTo(2);
    }

    @Test
    void customTerminatorIsReserved() {
        UkkonenBuilder builder = new UkkonenBuilder(SuffixTreeConfiguration.builder().terminator(0).build());
        assertThat(builder.terminator()).isZero();
        assertThatThrownBy(() -> builder.append(0)).isInstanceOf(IllegalArgumentException.class);
        builder.append(-1);
        assertThat(builder.build().contains(new int[]{-1})).isTrue();
    }

    @Test
    void noAppendAfterBuild() {
        UkkonenBuilder builder = new UkkonenBuilder().appendAll(symbols("abc"));
        SuffixTree tree = builder.build();

        assertThat(tree.isFinished()).isTrue();
        assertThat(builder.isFinished()).isTrue();
        assertThat(builder.length()).isEqualTo(3);
        assertThatThrownBy(() -> builder.append('d')).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> builder.contains(symbols("a"))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void queriesImplicitTreeBetweenPhases() {
        UkkonenBuilder builder = new UkkonenBuilder().appendAll(symbols("abcab"));

        assertThat(builder.length()).isEqualTo(5);
        assertThat(builder.contains(symbols("ab"))).isTrue();
        assertThat(builder.contains(symbols("cab"))).isTrue();
        assertThat(builder.contains(symbols("ba"))).isFalse();
        // "ab" at 3 is still an implicit suffix, found by scanning the pending tail
        assertThat(builder.occurrences(symbols("ab")).toSortedArray()).containsExactly(0, 3);
        assertThat(builder.occurrences(symbols("b")).toSortedArray()).containsExactly(1, 4);
        assertThat(builder.occurrences(symbols("abcabc")).isEmpty()).isTrue();

        builder.append('x');
        assertThat(builder.occurrences(symbols("abx")).toSortedArray()).containsExactly(3);
        assertThat(builder.occurrences(symbols("ab")).toSortedArray()).containsExactly(0, 3);
    }

    @Test
    void everyPrefixAgreesWithBruteForce() {
        String text = RandomSequences.uniform(120, new char[]{'a', 'b'}, 7L);
        UkkonenBuilder builder = new UkkonenBuilder();

        for (int end = 0; end < text.length(); end++) {
            builder.append(text.charAt(end));
            String prefix = text.substring(0, end + 1);
            for (int len = 1; len <= 4 && len <= prefix.length(); len++) {
                String pattern = prefix.substring(prefix.length() - len);
                assertThat(builder.occurrences(symbols(pattern)).toSortedArray())
                        .as("'%s' in prefix of length %d", pattern, prefix.length())
                        .containsExactly(BruteForce.occurrences(prefix, pattern));
            }
        }

        SuffixTree tree = builder.build();
        TreeInvariants.check(tree);
        assertThat(tree.getOriginalLength()).isEqualTo(text.length());
    }

    @Test
    void verifyingBuildRunsInvariantChecks() {
        SuffixTreeConfiguration configuration = SuffixTreeConfiguration.builder().verify(true).build();
        SuffixTree tree = new UkkonenBuilder(configuration).appendAll(symbols("mississippi")).build();

        assertThat(tree.configuration().verify()).isTrue();
        assertThat(tree.stats().leaves()).isEqualTo(12);
    }

    @Test
    void allSuffixesAreLeavesOnceTerminated() {
        SuffixTree tree = new UkkonenBuilder().appendAll(symbols("aaaa")).build();
        TreeStore store = tree.store();

        assertThat(store.leafCount()).isEqualTo(5);
        assertThat(store.textLength()).isEqualTo(5);
        assertThat(store.globalEnd()).isEqualTo(4);
        for (int node : tree.depthFirst()) {
            if (store.isLeaf(node)) {
                assertThat(store.edgeEnd(node)).isEqualTo(4);
            }
        }
    }
}
