package selection;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.apache.commons.math3.random.RandomGenerator;
import utilities.SelectionLogger;

import java.util.Comparator;
import java.util.Objects;

/**
 * Median-of-medians selection.
 * <p>
 * Each step splits the active range into groups of five, takes the median of
 * every group with {@link GroupMedian}, picks the median of those medians as the
 * pivot and partitions around it with {@link Partitioner}. With
 * {@link MedianOfMediansStrategy#RECURSIVE} at least roughly 3n/10 elements are
 * discarded per step and the running time is O(n) in the worst case.
 * <p>
 * {@link Partitioner} sends keys equal to the pivot to the right, which on
 * duplicate-heavy input would leave the pivot at the left edge step after step.
 * After each partition the run of pivot-equal keys is therefore gathered next to
 * the pivot, and the step ends as soon as the rank falls inside that run.
 * <p>
 * The pivot is always carried as an index; it is never looked up again by value,
 * which would be ambiguous when the range holds duplicates.
 */
public final class DeterministicSelector extends AbstractSelector {

    private final MedianOfMediansStrategy strategy;
    private final RandomizedSelector medianSelector;

    public DeterministicSelector() {
        this(MedianOfMediansStrategy.RECURSIVE);
    }

    public DeterministicSelector(MedianOfMediansStrategy strategy) {
        this(strategy, new RandomizedSelector());
    }

    public DeterministicSelector(MedianOfMediansStrategy strategy, RandomGenerator rng) {
        this(strategy, new RandomizedSelector(rng));
    }

    private DeterministicSelector(MedianOfMediansStrategy strategy, RandomizedSelector medianSelector) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.medianSelector = medianSelector;
    }

    public MedianOfMediansStrategy strategy() {
        return strategy;
    }

    @Override
    public String name() {
        return strategy == MedianOfMediansStrategy.RECURSIVE
                ? "deterministic"
                : "deterministic-" + strategy.token();
    }

    @Override
    protected <T> int selectIndex(T[] a, int left, int right, int k, Comparator<? super T> cmp) {
        int steps = 0;
        while (left < right) {
            int pivotIndex = medianOfMedians(a, left, right, cmp);
            int p = Partitioner.partition(a, left, right, pivotIndex, cmp);
            int q = gatherEqual(a, p, right, cmp);
            steps++;
            if (k >= p && k <= q) {
                break;
            }
            if (k < p) {
                right = p - 1;
            } else {
                left = q + 1;
            }
        }
        if (SelectionLogger.isTraceEnabled()) {
            SelectionLogger.trace(name() + ": rank " + k + " found after " + steps + " partition step(s)");
        }
        return k;
    }

    // Moves the keys in (p, right] equal to a[p] into p+1..q and returns q.
    static <T> int gatherEqual(T[] a, int p, int right, Comparator<? super T> cmp) {
        T pivotValue = a[p];
        int q = p;
        for (int i = p + 1; i <= right; i++) {
            if (cmp.compare(a[i], pivotValue) == 0) {
                Partitioner.swap(a, i, ++q);
            }
        }
        return q;
    }

    // Index (inside [left, right]) of the median of the group medians.
    <T> int medianOfMedians(T[] a, int left, int right, Comparator<? super T> cmp) {
        IntArrayList medians = new IntArrayList((right - left) / GroupMedian.GROUP_SIZE + 1);
        for (int i = left; i <= right; i += GroupMedian.GROUP_SIZE) {
            int groupRight = Math.min(i + GroupMedian.GROUP_SIZE - 1, right);
            medians.add(GroupMedian.medianIndex(a, i, groupRight, cmp));
        }

        int m = medians.size();
        if (m == 1) {
            return medians.getInt(0);
        }

        return switch (strategy) {
            case RECURSIVE -> {
                // The j-th median sits at or after left + 5j, so moving it to left + j
                // never displaces a median that has not been moved yet.
                for (int j = 0; j < m; j++) {
                    Partitioner.swap(a, left + j, medians.getInt(j));
                }
                yield selectIndex(a, left, left + m - 1, left + m / 2, cmp);
            }
            case RANDOMIZED -> medianSelector.selectAmong(a, medians, m / 2, cmp);
        };
    }
}
