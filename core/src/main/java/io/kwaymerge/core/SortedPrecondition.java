// file: core/src/main/java/io/kwaymerge/core/SortedPrecondition.java
package io.kwaymerge.core;

import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Optional input check: every sequence must be non-decreasing under the
 * comparator. The merge itself never looks at sortedness; this is the
 * fail-fast diagnostic used when validation is switched on.
 */
public final class SortedPrecondition {

    private SortedPrecondition() {
        // utility
    }

    /**
     * @throws UnsortedSequenceException naming the first offending sequence and offset
     */
    public static <T> void check(List<? extends Collection<? extends T>> sequences, Comparator<? super T> comparator) {
        for (int i = 0; i < sequences.size(); i++) {
            long offset = firstDescent(sequences.get(i), comparator);
            if (offset >= 0) {
                throw new UnsortedSequenceException(i, offset);
            }
        }
    }

    /** True when {@code sequence} is non-decreasing under {@code comparator}. */
    public static <T> boolean isSorted(Iterable<? extends T> sequence, Comparator<? super T> comparator) {
        return firstDescent(sequence, comparator) < 0;
    }

    /** Offset of the first element smaller than its predecessor, or -1. */
    private static <T> long firstDescent(Iterable<? extends T> sequence, Comparator<? super T> comparator) {
        Iterator<? extends T> it = sequence.iterator();
        if (!it.hasNext()) return -1;
        T prev = it.next();
        long offset = 1;
        while (it.hasNext()) {
            T cur = it.next();
            if (comparator.compare(cur, prev) < 0) {
                return offset;
            }
            prev = cur;
            offset++;
        }
        return -1;
    }
}
