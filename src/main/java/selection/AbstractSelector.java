package selection;

import java.util.Comparator;
import java.util.Objects;

/**
 * Shared entry point for selectors: validates once, hands a private working
 * copy to {@link #selectIndex}, and reads the answer out of that copy.
 */
public abstract class AbstractSelector implements OrderStatisticSelector {

    @Override
    public <T extends Comparable<? super T>> T select(OrderedSequence<T> sequence, int k) {
        return select(sequence, k, Comparator.naturalOrder());
    }

    @Override
    public <T> T select(OrderedSequence<T> sequence, int k, Comparator<? super T> comparator) {
        Objects.requireNonNull(sequence, "sequence");
        Objects.requireNonNull(comparator, "comparator");
        checkRank(sequence.size(), k);

        @SuppressWarnings("unchecked")
        T[] work = (T[]) sequence.toArray();
        int index = selectIndex(work, 0, work.length - 1, k, comparator);
        return work[index];
    }

    /**
     * Rearranges {@code a[left..right]} so that the element of rank {@code k}
     * (an absolute index inside the range) ends up at {@code a[k]}, and returns {@code k}.
     */
    protected abstract <T> int selectIndex(T[] a, int left, int right, int k, Comparator<? super T> cmp);

    static void checkRank(int size, int k) {
        if (size == 0) {
            throw new EmptyInputException();
        }
        if (k < 0 || k >= size) {
            throw new RankOutOfRangeException(k, size);
        }
    }

    @Override
    public String toString() {
        return name();
    }
}
