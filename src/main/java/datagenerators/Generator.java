package datagenerators;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import utilities.BenchmarkEnums.Distribution;

import java.util.Arrays;

// Integer datasets for the selection benchmark. Every random draw comes from a seeded generator.
public class Generator {

    public static final int ALL_EQUAL_VALUE = 42;
    public static final int DEFAULT_FEW_UNIQUE_VALUES = 5;
    public static final double DEFAULT_ZIPF_EXPONENT = 1.0;

    private Generator() {
    }

    public static int[] generate(Distribution distribution, int size, long seed) {
        return generate(distribution, size, seed, DEFAULT_FEW_UNIQUE_VALUES, DEFAULT_ZIPF_EXPONENT);
    }

    public static int[] generate(Distribution distribution,
                                 int size,
                                 long seed,
                                 int fewUniqueValues,
                                 double zipfExponent) {
        return switch (distribution) {
            case RANDOM -> generateUniform(size, 1, Math.max(1, size * 10), seed);
            case SORTED -> generateSorted(size);
            case REVERSE_SORTED -> generateReverseSorted(size);
            case ALL_EQUAL -> generateConstant(size, ALL_EQUAL_VALUE);
            case FEW_UNIQUE -> generateUniform(size, 1, fewUniqueValues, seed);
            case ZIPF -> generateZipf(size, Math.max(2, size / 10), zipfExponent, seed);
            case ORGAN_PIPE -> AdversarialGenerators.generateOrganPipe(size);
            case ALTERNATING_BLOCKS -> size == 0
                    ? new int[0]
                    : AdversarialGenerators.generateAlternatingBlocks(size, Math.max(1, size / 10), new int[] {3, 1, 2});
        };
    }

    // Uniform integers in the closed interval [min, max].
    public static int[] generateUniform(int length, int min, int max, long seed) {
        requireNonNegative(length);
        if (max < min) throw new IllegalArgumentException("max < min");

        RandomGenerator rng = new Well19937c(seed);
        int span = max - min + 1;
        int[] values = new int[length];
        for (int i = 0; i < length; i++) {
            values[i] = min + rng.nextInt(span);
        }
        return values;
    }

    public static int[] generateSorted(int length) {
        requireNonNegative(length);
        int[] values = new int[length];
        for (int i = 0; i < length; i++) {
            values[i] = i + 1;
        }
        return values;
    }

    public static int[] generateReverseSorted(int length) {
        requireNonNegative(length);
        int[] values = new int[length];
        for (int i = 0; i < length; i++) {
            values[i] = length - i;
        }
        return values;
    }

    public static int[] generateConstant(int length, int value) {
        requireNonNegative(length);
        int[] values = new int[length];
        Arrays.fill(values, value);
        return values;
    }

    // Ranks in [1, alphabetSize]; small ranks dominate, so the output is duplicate-heavy.
    public static int[] generateZipf(int length, int alphabetSize, double exponent, long seed) {
        requireNonNegative(length);
        if (alphabetSize <= 0) {
            throw new IllegalArgumentException("alphabetSize must be positive");
        }

        RandomGenerator rng = new Well19937c(seed);
        ZipfDistribution dist = new ZipfDistribution(rng, alphabetSize, exponent);

        int[] values = new int[length];
        for (int i = 0; i < length; i++) {
            values[i] = dist.sample();
        }
        return values;
    }

    private static void requireNonNegative(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be >= 0");
        }
    }
}
