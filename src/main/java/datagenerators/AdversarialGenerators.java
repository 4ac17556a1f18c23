package datagenerators;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.Objects;

// Inputs that stress particular paths of Ukkonen's algorithm.
public final class AdversarialGenerators {

    private AdversarialGenerators() {
    }

    // One symbol repeated: every phase ends in rule 3 and the pending count grows to n.
    public static String repeated(char symbol, int length) {
        requirePositive(length, "length");
        return String.valueOf(symbol).repeat(length);
    }

    // Strictly increasing code units starting at base: no repeats, no internal nodes.
    public static String strictlyIncreasing(int length, char base) {
        requirePositive(length, "length");
        if (base + length - 1 > Character.MAX_VALUE) {
            throw new IllegalArgumentException("alphabet exceeds character range");
        }
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append((char) (base + i));
        }
        return sb.toString();
    }

    // Random palindrome over the alphabet; odd lengths get a random middle symbol.
    public static String palindrome(int length, char[] alphabet, long seed) {
        requirePositive(length, "length");
        requireAlphabet(alphabet, 1);
        RandomGenerator rng = new Well19937c(seed);
        char[] chars = new char[length];
        for (int i = 0, j = length - 1; i <= j; i++, j--) {
            char c = alphabet[rng.nextInt(alphabet.length)];
            chars[i] = c;
            chars[j] = c;
        }
        return new String(chars);
    }

    // Fibonacci word over {a, b}: maximally repetitive, many nested repeats.
    public static String fibonacciWord(int length) {
        requirePositive(length, "length");
        StringBuilder previous = new StringBuilder("a");
        StringBuilder current = new StringBuilder("ab");
        while (current.length() < length) {
            StringBuilder next = new StringBuilder(current).append(previous);
            previous = current;
            current = next;
        }
        return current.substring(0, length);
    }

    // Alternating mono-character blocks.
    public static String alternatingBlocks(int totalLength, int blockLength, char[] alphabet) {
        requirePositive(totalLength, "totalLength");
        requirePositive(blockLength, "blockLength");
        requireAlphabet(alphabet, 1);

        StringBuilder sb = new StringBuilder(totalLength);
        int symbolIndex = 0;
        while (sb.length() < totalLength) {
            int runLength = Math.min(blockLength, totalLength - sb.length());
            sb.append(String.valueOf(alphabet[symbolIndex % alphabet.length]).repeat(runLength));
            symbolIndex++;
        }
        return sb.toString();
    }

    /**
     * De Bruijn sequence B(k, order) over the alphabet, cut or cycled to totalLength. Every
     * word of the given order appears exactly once per cycle, which maximises branching.
     */
    public static String deBruijn(char[] alphabet, int order, int totalLength) {
        requireAlphabet(alphabet, 2);
        requirePositive(order, "order");
        requirePositive(totalLength, "totalLength");
        long workSize = (long) alphabet.length * order;
        if (workSize > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("alphabet size * order exceeds supported range");
        }

        StringBuilder out = new StringBuilder(totalLength);
        while (out.length() < totalLength) {
            int[] word = new int[(int) workSize + 1];
            if (!lyndonCycle(1, 1, order, word, alphabet, out, totalLength)) {
                break;
            }
        }
        return out.toString();
    }

    // Concatenates Lyndon words whose length divides order; false once the limit is reached.
    private static boolean lyndonCycle(int t, int period, int order, int[] word,
                                       char[] alphabet, StringBuilder out, int limit) {
        if (t > order) {
            if (order % period != 0) {
                return true;
            }
            for (int i = 1; i <= period; i++) {
                out.append(alphabet[word[i]]);
                if (out.length() >= limit) {
                    return false;
                }
            }
            return true;
        }
        word[t] = word[t - period];
        if (!lyndonCycle(t + 1, period, order, word, alphabet, out, limit)) {
            return false;
        }
        for (int symbol = word[t - period] + 1; symbol < alphabet.length; symbol++) {
            word[t] = symbol;
            if (!lyndonCycle(t + 1, t, order, word, alphabet, out, limit)) {
                return false;
            }
        }
        return true;
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    private static void requireAlphabet(char[] alphabet, int minSize) {
        Objects.requireNonNull(alphabet, "alphabet");
        if (alphabet.length < minSize) {
            throw new IllegalArgumentException("alphabet must contain at least " + minSize + " symbol(s)");
        }
    }
}
