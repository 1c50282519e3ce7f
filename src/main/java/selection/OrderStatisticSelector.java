package selection;

import java.util.Comparator;

/**
 * Returns the element of zero-based rank {@code k} in the sorted order of a sequence.
 * Implementations never modify the sequence they are given.
 */
public interface OrderStatisticSelector {

    <T extends Comparable<? super T>> T select(OrderedSequence<T> sequence, int k);

    <T> T select(OrderedSequence<T> sequence, int k, Comparator<? super T> comparator);

    String name();
}
