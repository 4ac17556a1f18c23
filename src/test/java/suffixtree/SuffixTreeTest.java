package suffixtree;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SuffixTreeTest {

    @Test
    void abcabxabcdScenario() {
        SuffixTree tree = SuffixTree.of("abcabxabcd");

        assertThat(tree.contains("bxa")).isTrue();
        assertThat(tree.contains("abcd")).isTrue();
        assertThat(tree.contains("abd")).isFalse();
        // pre-order: "abc" (edge 'c') before "abx" (edge 'x'), and below "abc" 'a' before 'd'
        assertThat(tree.occurrences("ab").toList().toIntArray()).containsExactly(0, 6, 3);
        assertThat(tree.occurrences("ab").count()).isEqualTo(3);
        assertThat(tree.longestRepeatedSubstring()).isEqualTo(new Match(0, 3));
        assertThat(tree.longestRepeatedSubstringText()).isEqualTo("abc");
        TreeInvariants.check(tree);
    }

    @Test
    void singleSymbolRun() {
        SuffixTree tree = SuffixTree.of("aaaa");

        assertThat(tree.occurrences("a").toList().toIntArray()).containsExactly(3, 2, 1, 0);
        assertThat(tree.occurrences("aaaa").toList().toIntArray()).containsExactly(0);
        assertThat(tree.occurrences("aaaaa").isEmpty()).isTrue();
        assertThat(tree.longestRepeatedSubstring()).isEqualTo(new Match(0, 3));

        TreeStats stats = tree.stats();
        assertThat(stats.textLength()).isEqualTo(4);
        assertThat(stats.leaves()).isEqualTo(5);
        assertThat(stats.internalNodes()).isEqualTo(3);
        assertThat(stats.nodes()).isEqualTo(9);
        assertThat(stats.maxInternalDepth()).isEqualTo(3);
    }

    @Test
    void emptyInput() {
        SuffixTree tree = SuffixTree.of("");

        assertThat(tree.getOriginalLength()).isZero();
        assertThat(tree.stats().leaves()).isEqualTo(1);
        assertThat(tree.stats().internalNodes()).isZero();
        assertThat(tree.depthFirst().toIntArray()).containsExactly(0, 1);
        assertThat(tree.contains("a")).isFalse();
        assertThat(tree.occurrences("a").toList().toIntArray()).isEmpty();
        assertThat(tree.longestRepeatedSubstring()).isEqualTo(Match.NONE);
        assertThat(tree.longestRepeatedSubstringText()).isEmpty();
        TreeInvariants.check(tree);
    }

    @Test
    void emptyPatternIsNeverFound() {
        SuffixTree tree = SuffixTree.of("banana");

        assertThat(tree.contains("")).isFalse();
        assertThat(tree.occurrences("").isEmpty()).isTrue();
        assertThat(tree.locate("").node()).isEqualTo(tree.getRoot());
    }

    @Test
    void inputWithTerminatorIsRejected() {
        assertThatThrownBy(() -> SuffixTree.build(new int[]{1, -1, 2}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("offset 1");
        assertThatThrownBy(() -> SuffixTree.of("ab$c", SuffixTreeConfiguration.builder().terminator('$').build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("offset 2");
    }

    @Test
    void patternWithTerminatorIsNotFound() {
        SuffixTree tree = SuffixTree.build(new int[]{1, 2, 1, 2}, 0);

        assertThat(tree.terminator()).isZero();
        assertThat(tree.contains(new int[]{1, 2})).isTrue();
        assertThat(tree.contains(new int[]{2, 0})).isFalse();
        assertThat(tree.occurrences(new int[]{2, 0}).isEmpty()).isTrue();
        assertThat(tree.locate(new int[]{0})).isNull();
        assertThat(tree.occurrences(new int[]{1, 2}).toSortedArray()).containsExactly(0, 2);
        assertThat(tree.longestRepeatedSubstring()).isEqualTo(new Match(0, 2));
    }

    @Test
    void integerTextRendersSpaceSeparated() {
        SuffixTree tree = SuffixTree.build(new int[]{10, 20, 10, 20, 30});

        assertThat(tree.isTextual()).isFalse();
        assertThat(tree.longestRepeatedSubstringText()).isEqualTo("10 20");
        assertThat(tree.getText()).containsExactly(10, 20, 10, 20, 30, -1);
    }

    @Test
    void tiesGoToLeftmostOccurrence() {
        // "cd" at 0 and 6, "ab" at 3 and 8; "ab" sorts first but "cd" starts earlier
        SuffixTree tree = SuffixTree.of("cdxabycdab");
        assertThat(tree.longestRepeatedSubstring()).isEqualTo(new Match(0, 2));
        assertThat(tree.longestRepeatedSubstringText()).isEqualTo("cd");
    }

    @Test
    void noRepeatGivesNone() {
        SuffixTree tree = SuffixTree.of("abcdef");
        assertThat(tree.longestRepeatedSubstring().isEmpty()).isTrue();
        assertThat(tree.stats().internalNodes()).isZero();
    }

    @Test
    void caseInsensitiveTreeFoldsTextAndQueries() {
        SuffixTreeConfiguration ignoreCase = SuffixTreeConfiguration.builder().caseSensitive(false).build();
        SuffixTree folded = SuffixTree.of("Hello hELLo", ignoreCase);
        SuffixTree exact = SuffixTree.of("Hello hELLo");

        assertThat(folded.contains("HELLO")).isTrue();
        assertThat(folded.occurrences("hello").toSortedArray()).containsExactly(0, 6);
        assertThat(folded.longestRepeatedSubstringText()).isEqualTo("hello");
        assertThat(exact.contains("HELLO")).isFalse();
        assertThat(exact.occurrences("ello").toSortedArray()).containsExactly(1);
    }

    @Test
    void locateReportsNodeOrEdgePosition() {
        SuffixTree tree = SuffixTree.of("abcabxabcd");

        Locus onNode = tree.locate("ab");
        assertThat(onNode.endsOnNode()).isTrue();
        assertThat(onNode.depth()).isEqualTo(2);
        assertThat(onNode.child()).isEqualTo(TreeStore.NO_NODE);
        assertThat(tree.pathLabelText(onNode.node())).isEqualTo("ab");

        Locus onEdge = tree.locate("abca");
        assertThat(onEdge.endsOnNode()).isFalse();
        assertThat(onEdge.offset()).isEqualTo(1);
        assertThat(tree.pathLabelText(onEdge.node())).isEqualTo("abc");
        assertThat(tree.store().suffixIndex(onEdge.child())).isZero();

        assertThat(tree.locate("zz")).isNull();
        assertThat(tree.locate("abcx")).isNull();
    }

    @Test
    void leafPathLabelSpellsTerminatedSuffix() {
        SuffixTree tree = SuffixTree.of("abcabxabcd");
        TreeStore store = tree.store();

        for (int node : tree.depthFirst()) {
            if (store.isLeaf(node) && store.suffixIndex(node) == 6) {
                assertThat(tree.pathLabelText(node)).isEqualTo("abcd$");
                assertThat(tree.pathLabel(node)).endsWith(-1);
            }
        }
        assertThat(tree.pathLabel(tree.getRoot())).isEmpty();
    }

    @Test
    void traversalsVisitEveryNodeOnce() {
        SuffixTree tree = SuffixTree.of("mississippi");
        int[] dfs = tree.depthFirst().toIntArray();
        int[] bfs = tree.breadthFirst().toIntArray();
        int nodes = tree.stats().nodes();

        assertThat(dfs).hasSize(nodes).doesNotHaveDuplicates();
        assertThat(bfs).hasSize(nodes).doesNotHaveDuplicates();
        assertThat(dfs).containsExactlyInAnyOrder(bfs);
        assertThat(dfs[0]).isEqualTo(tree.getRoot());
        assertThat(bfs[0]).isEqualTo(tree.getRoot());

        // first child of the root is the terminator leaf, which sorts below every character
        int first = dfs[1];
        assertThat(tree.store().suffixIndex(first)).isEqualTo(11);
        assertThat(bfs[1]).isEqualTo(first);
    }

    @Test
    void buildingTwiceGivesTheSameAnswers() {
        SuffixTree a = SuffixTree.of("abracadabra");
        SuffixTree b = SuffixTree.of("abracadabra");

        assertThat(a.depthFirst().toIntArray()).isEqualTo(b.depthFirst().toIntArray());
        assertThat(a.occurrences("abra").toList().toIntArray()).isEqualTo(b.occurrences("abra").toList().toIntArray());
        assertThat(a.longestRepeatedSubstring()).isEqualTo(b.longestRepeatedSubstring());
        assertThat(a.longestRepeatedSubstringText()).isEqualTo("abra");
    }

    @Test
    void occurrencesAreRestartable() {
        SuffixTree tree = SuffixTree.of("banana");
        Occurrences ana = tree.occurrences("ana");

        assertThat(ana.toList().toIntArray()).isEqualTo(ana.toList().toIntArray());
        assertThat(ana.toSortedArray()).containsExactly(1, 3);
        assertThat(ana.toString()).isEqualTo(ana.toList().toString());
    }

    @Test
    void unfinishedTreeHasNoLongestRepeat() {
        SuffixTree unfinished = new SuffixTree(new TreeStore(), 0, -1, false, false, SuffixTreeConfiguration.defaults());
        assertThatThrownBy(unfinished::longestRepeatedSubstring).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void nullPatternIsRejected() {
        SuffixTree tree = SuffixTree.of("abc");
        assertThatThrownBy(() -> tree.contains((int[]) null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> tree.occurrences((CharSequence) null)).isInstanceOf(NullPointerException.class);
    }
}
