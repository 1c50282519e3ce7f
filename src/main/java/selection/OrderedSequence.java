package selection;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.List;
import java.util.Objects;

/**
 * Read-only, randomly indexable view over a finite sequence of elements.
 * Selectors copy what they need out of it and never write back.
 */
public interface OrderedSequence<T> {

    int size();

    T get(int index);

    default boolean isEmpty() {
        return size() == 0;
    }

    // Copies the view into a fresh array owned by the caller.
    default Object[] toArray() {
        Object[] out = new Object[size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = get(i);
        }
        return out;
    }

    @SafeVarargs
    static <T> OrderedSequence<T> of(T... values) {
        Objects.requireNonNull(values, "values");
        return new OrderedSequence<>() {
            @Override
            public int size() {
                return values.length;
            }

            @Override
            public T get(int index) {
                return values[index];
            }

            @Override
            public Object[] toArray() {
                return values.clone();
            }
        };
    }

    static <T> OrderedSequence<T> of(List<T> values) {
        Objects.requireNonNull(values, "values");
        return new OrderedSequence<>() {
            @Override
            public int size() {
                return values.size();
            }

            @Override
            public T get(int index) {
                return values.get(index);
            }

            @Override
            public Object[] toArray() {
                return values.toArray();
            }
        };
    }

    static OrderedSequence<Integer> ofInts(int... values) {
        Objects.requireNonNull(values, "values");
        return ofInts(IntArrayList.wrap(values));
    }

    // Boxes lazily on get(); the backing list is not copied.
    static OrderedSequence<Integer> ofInts(IntList values) {
        Objects.requireNonNull(values, "values");
        return new OrderedSequence<>() {
            @Override
            public int size() {
                return values.size();
            }

            @Override
            public Integer get(int index) {
                return values.getInt(index);
            }
        };
    }
}
