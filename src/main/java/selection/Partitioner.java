package selection;

import java.util.Comparator;

/**
 * Lomuto partition around a chosen pivot.
 * <p>
 * After {@code p = partition(a, left, right, pivotIndex, cmp)} every element in
 * {@code [left, p)} compares strictly less than the pivot and every element in
 * {@code (p, right]} compares greater than or equal to it. Elements equal to the
 * pivot always go to the right side, so a range of equal values partitions to
 * {@code p == left}. Callers selecting on duplicate-heavy data pay for that
 * with unbalanced steps.
 */
public final class Partitioner {

    private Partitioner() {
    }

    public static <T> int partition(T[] a,
                                    int left,
                                    int right,
                                    int pivotIndex,
                                    Comparator<? super T> cmp) {
        if (left < 0 || right >= a.length || left > right) {
            throw new IllegalArgumentException(
                    "Invalid range [" + left + ", " + right + "] for length " + a.length);
        }
        if (pivotIndex < left || pivotIndex > right) {
            throw new IllegalArgumentException(
                    "pivotIndex " + pivotIndex + " outside [" + left + ", " + right + "]");
        }

        T pivotValue = a[pivotIndex];
        swap(a, pivotIndex, right); // park the pivot at the end
        int storeIndex = left;
        for (int i = left; i < right; i++) {
            if (cmp.compare(a[i], pivotValue) < 0) {
                swap(a, i, storeIndex);
                storeIndex++;
            }
        }
        swap(a, storeIndex, right);
        return storeIndex;
    }

    static void swap(Object[] a, int i, int j) {
        Object tmp = a[i];
        a[i] = a[j];
        a[j] = tmp;
    }
}
