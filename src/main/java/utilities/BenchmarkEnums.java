package utilities;

import java.util.EnumSet;

public final class BenchmarkEnums {
    private BenchmarkEnums() {}

    public enum Algorithm {
        RANDOMIZED("Randomized", "randomized"),
        DETERMINISTIC("Deterministic", "deterministic");

        private final String displayName;
        private final String csvLabel;

        Algorithm(String displayName, String csvLabel) {
            this.displayName = displayName;
            this.csvLabel = csvLabel;
        }

        public String displayName() { return displayName; }
        public String csvLabel() { return csvLabel; }
    }

    public enum Distribution {
        RANDOM("random"),
        SORTED("sorted"),
        REVERSE_SORTED("reverse_sorted"),
        ALL_EQUAL("all_equal"),
        FEW_UNIQUE("few_unique"),
        ZIPF("zipf"),
        ORGAN_PIPE("organ_pipe"),
        ALTERNATING_BLOCKS("alternating_blocks");

        private final String token;
        Distribution(String token) { this.token = token; }
        public String token() { return token; }

        // The five distributions of the standard sweep.
        public static EnumSet<Distribution> standard() {
            return EnumSet.of(RANDOM, SORTED, REVERSE_SORTED, ALL_EQUAL, FEW_UNIQUE);
        }

        public static Distribution fromString(String value) {
            return EnumSet.allOf(Distribution.class).stream()
                    .filter(d -> d.token.equalsIgnoreCase(value) || d.name().equalsIgnoreCase(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown distribution: " + value));
        }
    }
}
