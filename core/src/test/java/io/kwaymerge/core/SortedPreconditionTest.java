package io.kwaymerge.core;

import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SortedPreconditionTest {

    @Test
    void sorted_inputs_pass() {
        SortedPrecondition.check(List.of(List.of(), List.of(1), List.of(1, 1, 2)), Comparator.<Integer>naturalOrder());
        assertTrue(SortedPrecondition.isSorted(List.of(3, 2, 2, 1), Comparator.<Integer>reverseOrder()));
    }

    @Test
    void first_unsorted_sequence_is_named() {
        var in = List.of(List.of(1, 2), List.of(0, 5, 4, 3), List.of(9, 8));

        var ex = assertThrows(UnsortedSequenceException.class,
                () -> SortedPrecondition.check(in, Comparator.<Integer>naturalOrder()));

        assertEquals(1, ex.sequenceIndex());
        assertEquals(2, ex.offset());
        assertEquals("precondition violated: sequence 1 is not sorted at offset 2", ex.getMessage());
        assertInstanceOf(IllegalArgumentException.class, ex);
    }
}
