package selection;

import java.util.Comparator;

// Median of a run of at most five elements. The run is left sorted in place.
public final class GroupMedian {

    public static final int GROUP_SIZE = 5;

    private GroupMedian() {
    }

    /**
     * Sorts {@code a[left..right]} and returns the index of its lower median,
     * {@code left + (right - left) / 2}.
     */
    public static <T> int medianIndex(T[] a, int left, int right, Comparator<? super T> cmp) {
        if (left < 0 || right >= a.length || left > right) {
            throw new IllegalArgumentException(
                    "Invalid range [" + left + ", " + right + "] for length " + a.length);
        }
        if (right - left >= GROUP_SIZE) {
            throw new IllegalArgumentException(
                    "Group of " + (right - left + 1) + " exceeds " + GROUP_SIZE + " elements");
        }

        // insertion sort; at most 10 comparisons
        for (int i = left + 1; i <= right; i++) {
            T current = a[i];
            int j = i - 1;
            while (j >= left && cmp.compare(a[j], current) > 0) {
                a[j + 1] = a[j];
                j--;
            }
            a[j + 1] = current;
        }
        return left + (right - left) / 2;
    }
}
