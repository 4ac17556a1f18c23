package datagenerators;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class GeneratorsTest {

    @Test
    void sameSeedSameSequence() {
        assertThat(RandomSequences.uniform(200, RandomSequences.DNA, 5L))
                .isEqualTo(RandomSequences.uniform(200, RandomSequences.DNA, 5L))
                .hasSize(200)
                .matches("[ACGT]*");
        assertThat(RandomSequences.uniformSymbols(50, 3, 1L)).isEqualTo(RandomSequences.uniformSymbols(50, 3, 1L));
    }

    @Test
    void symbolsStayInRange() {
        for (int symbol : RandomSequences.uniformSymbols(1_000, 7, 2L)) {
            assertThat(symbol).isBetween(0, 6);
        }
        int zeros = 0;
        for (int symbol : RandomSequences.zipfSymbols(1_000, 5, 1.5, 3L)) {
            assertThat(symbol).isBetween(0, 4);
            if (symbol == 0) {
                zeros++;
            }
        }
        // rank 1 carries well over a third of the mass at exponent 1.5
        assertThat(zeros).isGreaterThan(300);
    }

    @Test
    void invalidArgumentsAreRejected() {
        assertThatThrownBy(() -> RandomSequences.uniform(-1, RandomSequences.DNA, 0L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RandomSequences.uniform(3, new char[0], 0L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RandomSequences.zipfSymbols(3, 2, 0.0, 0L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AdversarialGenerators.deBruijn(new char[]{'a'}, 2, 4))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AdversarialGenerators.repeated('a', 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void adversarialShapes() {
        assertThat(AdversarialGenerators.repeated('z', 3)).isEqualTo("zzz");
        assertThat(AdversarialGenerators.strictlyIncreasing(3, 'a')).isEqualTo("abc");
        assertThat(AdversarialGenerators.fibonacciWord(8)).isEqualTo("abaababa");
        assertThat(AdversarialGenerators.fibonacciWord(1)).isEqualTo("a");
        assertThat(AdversarialGenerators.alternatingBlocks(7, 2, new char[]{'x', 'y'})).isEqualTo("xxyyxxy");
        assertThat(AdversarialGenerators.deBruijn(new char[]{'a', 'b'}, 2, 4)).isEqualTo("aabb");
        assertThat(AdversarialGenerators.deBruijn(new char[]{'a', 'b'}, 2, 6)).isEqualTo("aabbaa");
        assertThat(AdversarialGenerators.deBruijn(new char[]{'0', '1'}, 3, 8)).isEqualTo("00010111");
    }

    @Test
    void palindromeReadsTheSameBackwards() {
        for (int length : new int[]{1, 2, 9, 40}) {
            String s = AdversarialGenerators.palindrome(length, RandomSequences.DNA, length);
            assertThat(s).hasSize(length).isEqualTo(new StringBuilder(s).reverse().toString());
        }
    }

    @Test
    void deBruijnContainsEveryWordOnce() {
        char[] alphabet = {'a', 'b', 'c'};
        String cycle = AdversarialGenerators.deBruijn(alphabet, 3, 27);
        String wrapped = cycle + cycle.substring(0, 2);
        for (char x : alphabet) {
            for (char y : alphabet) {
                for (char z : alphabet) {
                    String word = "" + x + y + z;
                    int first = wrapped.indexOf(word);
                    assertThat(first).as(word).isNotNegative();
                    assertThat(wrapped.indexOf(word, first + 1)).as(word).isNegative();
                }
            }
        }
    }
}
