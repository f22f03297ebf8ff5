package io.kwaymerge.core;

import io.kwaymerge.core.TestSequences.Tagged;
import org.junit.jupiter.api.Test;

import java.util.AbstractCollection;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end merges through {@link KWayMerger}.
 *
 * Focus:
 *  - result is sorted, has every element exactly once, and keeps input order on ties
 *  - small k (0, 1, 2) and odd k take the short paths correctly
 *  - empty sequences anywhere in the input
 *  - same output for every parallelism and in-place strategy
 *  - failures: unsorted input, null sequence, comparator errors, collections whose size lies
 */
class KWayMergerTest {

    @Test
    void merges_example_from_docs() {
        List<Integer> out = KWayMerge.merge(List.of(List.of(1, 4), List.of(2, 3), List.of(0)));
        assertEquals(List.of(0, 1, 2, 3, 4), out);
    }

    @Test
    void randomDoubles_match_stable_sort_for_many_k() {
        for (int k : new int[]{3, 4, 5, 6, 7, 9, 16, 17, 64}) {
            var in = TestSequences.randomDoubles(k * 31L, k, 0, 250);
            try (var merger = KWayMerger.create(MergeOptions.defaults().withSequentialThreshold(0))) {
                List<Double> out = merger.merge(in);

                assertEquals(in.stream().mapToInt(List::size).sum(), out.size(), "k=" + k);
                assertTrue(TestSequences.isSorted(out, Double::compare), "k=" + k);
                assertEquals(TestSequences.reference(in, Double::compare), out, "k=" + k);
            }
        }
    }

    @Test
    void ties_are_ordered_by_list_then_position() {
        var in = TestSequences.randomTagged(17, 37, 40, 5);
        for (var strategy : MergeOptions.InPlaceStrategy.values()) {
            var options = MergeOptions.defaults().withParallelism(3).withInPlaceStrategy(strategy).withSequentialThreshold(0);
            try (var merger = KWayMerger.create(options)) {
                List<Tagged> out = merger.merge(in, Tagged.BY_KEY);

                assertEquals(TestSequences.reference(in, Tagged.BY_KEY), out, "strategy=" + strategy);
                for (int i = 1; i < out.size(); i++) {
                    Tagged prev = out.get(i - 1);
                    Tagged cur = out.get(i);
                    if (prev.key() == cur.key()) {
                        assertTrue(prev.list() < cur.list() || (prev.list() == cur.list() && prev.pos() < cur.pos()),
                                "tie order broken at " + i + ": " + prev + " then " + cur);
                    }
                }
            }
        }
    }

    @Test
    void small_k_short_paths() {
        var merger = KWayMerger.create(MergeOptions.sequential());

        assertEquals(List.of(), merger.merge(List.<List<Integer>>of()));
        assertEquals(List.of(1, 2, 2, 9), merger.merge(List.of(List.of(1, 2, 2, 9))));
        assertEquals(List.of(1, 2, 3, 4, 5), merger.merge(List.of(List.of(1, 3, 5), List.of(2, 4))));
    }

    @Test
    void two_way_result_agrees_with_k_way_path() {
        var in = TestSequences.randomDoubles(5, 2, 100, 300);
        List<List<Double>> padded = new ArrayList<>(in);
        padded.add(new ArrayList<>());

        var merger = KWayMerger.create(MergeOptions.sequential());
        assertEquals(TestSequences.reference(in, Double::compare), merger.merge(in));
        assertEquals(merger.merge(in), merger.merge(padded));
    }

    @Test
    void empty_sequences_are_harmless() {
        var merger = KWayMerger.create(MergeOptions.sequential());

        assertEquals(List.of(1, 2, 3), merger.merge(List.of(List.<Integer>of(), List.of(1, 2, 3))));
        assertEquals(List.of(), merger.merge(List.of(List.<Integer>of(), List.<Integer>of())));
        assertEquals(List.of(), merger.merge(List.of(List.<Integer>of(), List.<Integer>of(), List.<Integer>of())));
        assertEquals(List.of(1, 2), merger.merge(List.of(List.of(2), List.<Integer>of(), List.<Integer>of(), List.of(1))));
    }

    @Test
    void hundred_lists_with_random_empties() {
        var in = TestSequences.randomDoubles(2024, 100, 0, 3);
        for (int i = 0; i < in.size(); i += 3) {
            in.get(i).clear();
        }

        List<Double> out = KWayMerge.merge(in, Double::compare, MergeOptions.defaults().withParallelism(4).withSequentialThreshold(0));

        assertEquals(TestSequences.reference(in, Double::compare), out);
    }

    @Test
    void merging_sorted_output_again_changes_nothing() {
        var in = TestSequences.randomDoubles(8, 12, 10, 60);
        List<Double> once = KWayMerge.merge(in);

        List<Double> twice = KWayMerge.merge(List.of(once));
        List<Double> withEmpties = KWayMerge.merge(List.of(List.<Double>of(), once, List.<Double>of()));

        assertEquals(once, twice);
        assertEquals(once, withEmpties);
    }

    @Test
    void every_parallelism_gives_the_same_result() {
        var in = TestSequences.randomDoubles(77, 23, 500, 2_000);
        List<Double> expected = KWayMerge.merge(in, Double::compare, MergeOptions.sequential());

        for (int p : new int[]{0, 2, 4, 8}) {
            for (var strategy : MergeOptions.InPlaceStrategy.values()) {
                var options = new MergeOptions(p, false, strategy, 0);
                assertEquals(expected, KWayMerge.merge(in, Double::compare, options), "p=" + p + " " + strategy);
            }
        }
    }

    @Test
    void descending_comparator() {
        List<List<Integer>> in = List.of(List.of(9, 5, 1), List.of(8, 8, 2), List.of(7), List.of(6, 0));

        List<Integer> out = KWayMerge.merge(in, Comparator.reverseOrder());

        assertEquals(List.of(9, 8, 8, 7, 6, 5, 2, 1, 0), out);
    }

    @Test
    void accepts_any_outer_and_inner_collection() {
        List<Collection<Integer>> parts = List.of(
                new LinkedList<>(List.of(1, 6)),
                new ArrayDeque<>(List.of(2, 5)),
                List.of(3, 4),
                new LinkedList<>(List.of(0))
        );
        List<Integer> expected = List.of(0, 1, 2, 3, 4, 5, 6);

        assertEquals(expected, KWayMerge.merge(new LinkedList<>(parts)));
        assertEquals(expected, KWayMerge.merge(new ArrayDeque<>(parts)));
        Iterable<Collection<Integer>> plain = parts::iterator;
        assertEquals(expected, KWayMerge.merge(plain));
    }

    @Test
    void single_use_iterable_is_read_once() {
        Stream<List<Integer>> lists = Stream.of(List.of(1, 4), List.of(2), List.of(3), List.of(0, 5));
        Iterable<List<Integer>> once = lists::iterator;

        assertEquals(List.of(0, 1, 2, 3, 4, 5), KWayMerge.merge(once));
    }

    @Test
    void inputs_are_not_modified() {
        var in = TestSequences.randomDoubles(3, 6, 5, 20);
        List<List<Double>> copy = new ArrayList<>();
        for (List<Double> s : in) copy.add(new ArrayList<>(s));

        KWayMerge.merge(in);

        assertEquals(copy, in);
    }

    @Test
    void validation_names_the_unsorted_sequence() {
        List<List<Integer>> in = List.of(List.of(1, 2), List.of(3, 4), List.of(5, 7, 6));
        var options = MergeOptions.sequential().withValidateInputs(true);

        var ex = assertThrows(UnsortedSequenceException.class,
                () -> KWayMerge.merge(in, Integer::compare, options));

        assertEquals(2, ex.sequenceIndex());
        assertEquals(2, ex.offset());
    }

    @Test
    void null_sequence_is_rejected() {
        List<List<Integer>> in = Arrays.asList(List.of(1), null, List.of(2));

        var ex = assertThrows(NullPointerException.class, () -> KWayMerge.merge(in));
        assertEquals("sequence 1 is null", ex.getMessage());
    }

    @Test
    void comparator_failure_propagates() {
        List<List<Integer>> in = List.of(List.of(1, 2), List.of(3), List.of(4, 13), List.of(5));
        Comparator<Integer> picky = (a, b) -> {
            if (a == 13 || b == 13) throw new IllegalStateException("unlucky");
            return Integer.compare(a, b);
        };

        var ex = assertThrows(IllegalStateException.class,
                () -> KWayMerge.merge(in, picky, MergeOptions.sequential()));
        assertEquals("unlucky", ex.getMessage());
    }

    @Test
    void size_that_disagrees_with_iteration_is_detected() {
        List<Collection<Integer>> shortCount = List.of(List.of(1, 4), new MisreportedSize<>(List.of(2, 3, 5), 2), List.of(6));
        List<Collection<Integer>> longCount = List.of(List.of(1, 4), new MisreportedSize<>(List.of(2, 3), 3), List.of(6));

        assertThrows(IllegalStateException.class, () -> KWayMerge.merge(shortCount, Integer::compare, MergeOptions.sequential()));
        assertThrows(IllegalStateException.class, () -> KWayMerge.merge(longCount, Integer::compare, MergeOptions.sequential()));
    }

    @Test
    void result_is_random_access_and_fixed_size() {
        List<Integer> out = KWayMerge.merge(List.of(List.of(2), List.of(1), List.of(3)));

        assertEquals(2, out.get(1));
        out.set(0, 10);
        assertEquals(10, out.get(0));
        assertThrows(UnsupportedOperationException.class, () -> out.add(4));
    }

    @Test
    void options_are_exposed() {
        var options = MergeOptions.defaults().withParallelism(2);
        try (var merger = KWayMerger.create(options)) {
            assertSame(options, merger.options());
        }
    }

    // ---------- helpers ----------

    /** Collection whose {@code size()} disagrees with what it iterates. */
    private static final class MisreportedSize<E> extends AbstractCollection<E> {
        private final List<E> items;
        private final int reported;

        MisreportedSize(List<E> items, int reported) {
            this.items = items;
            this.reported = reported;
        }

        @Override
        public Iterator<E> iterator() {
            return items.iterator();
        }

        @Override
        public int size() {
            return reported;
        }
    }
}
