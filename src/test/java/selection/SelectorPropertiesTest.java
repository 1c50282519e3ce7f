package selection;

import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.DynamicTest.dynamicTest;

/**
 * Behaviour every selector must share, run against each implementation.
 */
public class SelectorPropertiesTest {

    private static List<OrderStatisticSelector> selectors() {
        return List.of(
                new RandomizedSelector(11L),
                new DeterministicSelector(),
                new DeterministicSelector(MedianOfMediansStrategy.RANDOMIZED, new Well19937c(13L)));
    }

    private static Stream<DynamicTest> forEachSelector(String what, SelectorCheck check) {
        return selectors().stream()
                .map(selector -> dynamicTest(selector.name() + ": " + what, () -> check.run(selector)));
    }

    @FunctionalInterface
    private interface SelectorCheck {
        void run(OrderStatisticSelector selector) throws Exception;
    }

    @TestFactory
    Stream<DynamicTest> testSmallUnsortedInput() {
        return forEachSelector("[5,3,8,1,9,2] rank 2", selector ->
                assertEquals(3, selector.select(OrderedSequence.ofInts(5, 3, 8, 1, 9, 2), 2)));
    }

    @TestFactory
    Stream<DynamicTest> testAllEqualInput() {
        int[] sevens = new int[50];
        Arrays.fill(sevens, 7);
        return forEachSelector("fifty 7s rank 25", selector -> {
            assertEquals(7, selector.select(OrderedSequence.ofInts(sevens), 25));
            for (int k = 0; k < sevens.length; k++) {
                assertEquals(7, selector.select(OrderedSequence.ofInts(sevens), k));
            }
        });
    }

    @TestFactory
    Stream<DynamicTest> testReverseSortedInput() {
        int[] reverse = new int[1000];
        for (int i = 0; i < reverse.length; i++) {
            reverse[i] = 1000 - i;
        }
        return forEachSelector("1000..1 rank 500", selector ->
                assertEquals(501, selector.select(OrderedSequence.ofInts(reverse), 500)));
    }

    @TestFactory
    Stream<DynamicTest> testEmptyInput() {
        return forEachSelector("empty input", selector -> {
            EmptyInputException e = assertThrows(EmptyInputException.class,
                    () -> selector.select(OrderedSequence.ofInts(), 0));
            assertEquals(SelectionException.Kind.EMPTY_INPUT, e.kind());
            // reported as empty whatever the rank
            assertThrows(EmptyInputException.class, () -> selector.select(OrderedSequence.ofInts(), -1));
            assertThrows(EmptyInputException.class, () -> selector.select(OrderedSequence.ofInts(), 3));
        });
    }

    @TestFactory
    Stream<DynamicTest> testDuplicateHeavyInput() {
        return forEachSelector("[4,4,4,1,4] rank 0", selector -> {
            assertEquals(1, selector.select(OrderedSequence.ofInts(4, 4, 4, 1, 4), 0));
            for (int k = 1; k < 5; k++) {
                assertEquals(4, selector.select(OrderedSequence.ofInts(4, 4, 4, 1, 4), k));
            }
        });
    }

    @TestFactory
    Stream<DynamicTest> testRankOutOfRange() {
        return forEachSelector("rank -1 and rank n", selector -> {
            OrderedSequence<Integer> seq = OrderedSequence.ofInts(1, 2, 3);
            RankOutOfRangeException low = assertThrows(RankOutOfRangeException.class, () -> selector.select(seq, -1));
            assertEquals(SelectionException.Kind.RANK_OUT_OF_RANGE, low.kind());
            assertEquals(-1, low.rank());
            assertEquals(3, low.size());
            assertThrows(RankOutOfRangeException.class, () -> selector.select(seq, 3));
        });
    }

    @TestFactory
    Stream<DynamicTest> testBoundaries() {
        return forEachSelector("min, max and singleton", selector -> {
            OrderedSequence<Integer> seq = OrderedSequence.ofInts(12, -4, 33, 0, 7, 33, -4, 19);
            assertEquals(-4, selector.select(seq, 0));
            assertEquals(33, selector.select(seq, seq.size() - 1));
            assertEquals(42, selector.select(OrderedSequence.ofInts(42), 0));
        });
    }

    @TestFactory
    Stream<DynamicTest> testMatchesFullSort() {
        return forEachSelector("random inputs against Arrays.sort", selector -> {
            Well19937c rng = new Well19937c(2024);
            for (int trial = 0; trial < 150; trial++) {
                int n = 1 + rng.nextInt(300);
                int bound = 1 + rng.nextInt(trial % 3 == 0 ? 4 : 1000);
                int[] data = new int[n];
                for (int i = 0; i < n; i++) {
                    data[i] = rng.nextInt(bound);
                }
                int[] sorted = data.clone();
                Arrays.sort(sorted);
                int k = rng.nextInt(n);
                assertEquals(sorted[k], selector.select(OrderedSequence.ofInts(data), k),
                        "n=" + n + " k=" + k);
            }
        });
    }

    @TestFactory
    Stream<DynamicTest> testEveryRankOfAPermutation() {
        List<Integer> values = new ArrayList<>();
        for (int i = 0; i < 64; i++) {
            values.add((i * 37) % 64);
        }
        return forEachSelector("all ranks of a permutation of 0..63", selector -> {
            for (int k = 0; k < values.size(); k++) {
                assertEquals(k, selector.select(OrderedSequence.of(values), k));
            }
        });
    }

    @TestFactory
    Stream<DynamicTest> testDoesNotMutateInput() {
        return forEachSelector("caller data untouched", selector -> {
            Integer[] array = {9, 1, 8, 2, 7, 3, 6, 4, 5, 0, 9, 1};
            Integer[] arrayBefore = array.clone();
            selector.select(OrderedSequence.of(array), 6);
            assertArrayEquals(arrayBefore, array);

            int[] ints = {5, 3, 8, 1, 9, 2};
            int[] intsBefore = ints.clone();
            selector.select(OrderedSequence.ofInts(ints), 2);
            assertArrayEquals(intsBefore, ints);

            List<Integer> list = new ArrayList<>(List.of(3, 3, 1, 2));
            selector.select(OrderedSequence.of(list), 1);
            assertEquals(List.of(3, 3, 1, 2), list);
        });
    }

    @TestFactory
    Stream<DynamicTest> testRepeatedCallsAgree() {
        int[] data = {15, 3, 9, 3, 27, 1, 8, 8, 12, 4, 4, 30, 2};
        return forEachSelector("idempotent", selector -> {
            Integer first = selector.select(OrderedSequence.ofInts(data), 6);
            for (int i = 0; i < 20; i++) {
                assertEquals(first, selector.select(OrderedSequence.ofInts(data), 6));
            }
        });
    }

    @TestFactory
    Stream<DynamicTest> testCustomComparator() {
        return forEachSelector("reverse order and strings", selector -> {
            OrderedSequence<Integer> seq = OrderedSequence.ofInts(4, 9, 1, 7);
            assertEquals(9, selector.select(seq, 0, Comparator.reverseOrder()));
            assertEquals("pear", selector.select(OrderedSequence.of("kiwi", "apple", "pear", "fig"), 3));
            assertEquals("fig", selector.select(OrderedSequence.of("kiwi", "apple", "pear", "fig"), 1,
                    String.CASE_INSENSITIVE_ORDER));
        });
    }

    @TestFactory
    Stream<DynamicTest> testNullArguments() {
        return forEachSelector("nulls rejected", selector -> {
            assertThrows(NullPointerException.class, () -> selector.select((OrderedSequence<Integer>) null, 0));
            assertThrows(NullPointerException.class,
                    () -> selector.select(OrderedSequence.ofInts(1), 0, null));
        });
    }

    @Test
    void testRandomizedAndDeterministicAgree() {
        RandomizedSelector randomized = new RandomizedSelector(99L);
        DeterministicSelector deterministic = new DeterministicSelector();
        Well19937c rng = new Well19937c(5);
        for (int trial = 0; trial < 300; trial++) {
            int n = 1 + rng.nextInt(500);
            int[] data = new int[n];
            int bound = trial % 2 == 0 ? 5 : 10 * n;
            for (int i = 0; i < n; i++) {
                data[i] = rng.nextInt(bound);
            }
            int k = rng.nextInt(n);
            assertEquals(randomized.select(OrderedSequence.ofInts(data), k),
                    deterministic.select(OrderedSequence.ofInts(data), k),
                    "trial " + trial);
        }
    }
}
