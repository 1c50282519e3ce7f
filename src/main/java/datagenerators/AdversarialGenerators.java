package datagenerators;

import java.util.Objects;

// Inputs that stress pivot choice: structured runs and long stretches of equal keys.
public final class AdversarialGenerators {

    private AdversarialGenerators() {
    }

    // 1, 2, ..., peak, ..., 2, 1. Ascending then descending halves.
    public static int[] generateOrganPipe(int totalLength) {
        if (totalLength < 0) {
            throw new IllegalArgumentException("totalLength must be >= 0");
        }
        int[] values = new int[totalLength];
        int half = (totalLength + 1) / 2;
        for (int i = 0; i < totalLength; i++) {
            values[i] = (i < half) ? i + 1 : totalLength - i;
        }
        return values;
    }

    // Runs of blockLength equal values, cycling through the alphabet.
    public static int[] generateAlternatingBlocks(int totalLength,
                                                  int blockLength,
                                                  int[] alphabet) {
        if (totalLength <= 0) {
            throw new IllegalArgumentException("totalLength must be positive");
        }
        if (blockLength <= 0) {
            throw new IllegalArgumentException("blockLength must be positive");
        }
        Objects.requireNonNull(alphabet, "alphabet");
        if (alphabet.length == 0) {
            throw new IllegalArgumentException("alphabet must contain at least one value");
        }

        int[] values = new int[totalLength];
        int produced = 0;
        int symbolIndex = 0;
        while (produced < totalLength) {
            int symbol = alphabet[symbolIndex % alphabet.length];
            int runLength = Math.min(blockLength, totalLength - produced);
            for (int i = 0; i < runLength; i++) {
                values[produced + i] = symbol;
            }
            produced += runLength;
            symbolIndex++;
        }
        return values;
    }
}
