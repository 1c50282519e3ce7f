package selection;

import java.util.EnumSet;

/**
 * How {@link DeterministicSelector} picks the median among the group medians.
 */
public enum MedianOfMediansStrategy {

    /**
     * Same deterministic routine applied to the group medians. Worst case O(n).
     */
    RECURSIVE("recursive"),

    /**
     * Randomized selection over the group medians. Cheaper constant factors in
     * practice, but the O(n) worst-case bound no longer holds.
     */
    RANDOMIZED("randomized");

    private final String token;

    MedianOfMediansStrategy(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static MedianOfMediansStrategy fromString(String value) {
        return EnumSet.allOf(MedianOfMediansStrategy.class).stream()
                .filter(s -> s.token.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown median-of-medians strategy: " + value));
    }
}
