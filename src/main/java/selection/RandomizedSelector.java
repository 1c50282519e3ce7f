package selection;

import it.unimi.dsi.fastutil.ints.IntList;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import utilities.SelectionLogger;

import java.util.Comparator;
import java.util.Objects;

/**
 * Quickselect with a uniformly random pivot. Expected linear time; quadratic in
 * the worst case, which duplicate-heavy input reaches easily because equal keys
 * all fall on one side of {@link Partitioner}.
 * <p>
 * Not thread-safe: instances share their random generator across calls.
 */
public final class RandomizedSelector extends AbstractSelector {

    private final RandomGenerator rng;

    public RandomizedSelector() {
        this(new Well19937c());
    }

    public RandomizedSelector(long seed) {
        this(new Well19937c(seed));
    }

    public RandomizedSelector(RandomGenerator rng) {
        this.rng = Objects.requireNonNull(rng, "rng");
    }

    @Override
    public String name() {
        return "randomized";
    }

    @Override
    protected <T> int selectIndex(T[] a, int left, int right, int k, Comparator<? super T> cmp) {
        int steps = 0;
        while (left < right) {
            int pivotIndex = left + rng.nextInt(right - left + 1);
            int p = Partitioner.partition(a, left, right, pivotIndex, cmp);
            steps++;
            if (k == p) {
                break;
            }
            if (k < p) {
                right = p - 1;
            } else {
                left = p + 1;
            }
        }
        if (SelectionLogger.isTraceEnabled()) {
            SelectionLogger.trace("randomized: rank " + k + " found after " + steps + " partition step(s)");
        }
        return k;
    }

    /**
     * Picks, among the positions listed in {@code indices}, the one whose value has
     * rank {@code rank} within that subset. Only the index list is reordered;
     * {@code a} is read, never written.
     */
    <T> int selectAmong(T[] a, IntList indices, int rank, Comparator<? super T> cmp) {
        Integer[] positions = indices.toArray(new Integer[0]);
        Comparator<Integer> byValue = (i, j) -> cmp.compare(a[i], a[j]);
        int found = selectIndex(positions, 0, positions.length - 1, rank, byValue);
        return positions[found];
    }
}
