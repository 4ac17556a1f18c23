package datagenerators;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Seeded random inputs for suffix tree tests and benchmarks. Every method takes a seed so
 * that a failing input can be regenerated exactly.
 */
public final class RandomSequences {

    public static final char[] DNA = "ACGT".toCharArray();

    private RandomSequences() {
    }

    // Uniform text over the given characters.
    public static String uniform(int length, char[] alphabet, long seed) {
        requireLength(length);
        if (alphabet == null || alphabet.length == 0) {
            throw new IllegalArgumentException("alphabet must contain at least one character");
        }
        RandomGenerator rng = new Well19937c(seed);
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = alphabet[rng.nextInt(alphabet.length)];
        }
        return new String(chars);
    }

    // Uniform symbols in [0, sigma).
    public static int[] uniformSymbols(int length, int sigma, long seed) {
        requireLength(length);
        if (sigma <= 0) {
            throw new IllegalArgumentException("sigma must be positive");
        }
        RandomGenerator rng = new Well19937c(seed);
        int[] out = new int[length];
        for (int i = 0; i < length; i++) {
            out[i] = rng.nextInt(sigma);
        }
        return out;
    }

    /**
     * Skewed symbols in [0, sigma): rank r is drawn with probability proportional to
     * 1 / r^exponent, so low ids dominate and long repeats become likely.
     */
    public static int[] zipfSymbols(int length, int sigma, double exponent, long seed) {
        requireLength(length);
        if (sigma <= 0) {
            throw new IllegalArgumentException("sigma must be positive");
        }
        if (exponent <= 0.0) {
            throw new IllegalArgumentException("exponent must be positive");
        }
        RandomGenerator rng = new Well19937c(seed);
        // ZipfDistribution samples integers in the closed interval [1, sigma]
        ZipfDistribution dist = new ZipfDistribution(rng, sigma, exponent);
        int[] out = new int[length];
        for (int i = 0; i < length; i++) {
            out[i] = dist.sample() - 1;
        }
        return out;
    }

    private static void requireLength(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative");
        }
    }
}
