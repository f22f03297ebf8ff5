// file: core/src/main/java/io/kwaymerge/core/OutputSlice.java
package io.kwaymerge.core;

import java.util.Collection;
import java.util.Comparator;

/**
 * Exclusive write handle on {@code [from, to)} of an {@link OutputBuffer}.
 * <p>
 * Only {@link OutputBuffer} creates slices, and only for ranges that do not
 * overlap the other slices of the same partition, so a task holding a slice can
 * write without coordination.
 *
 * @param <T> element type
 */
final class OutputSlice<T> {

    private final Object[] elements;
    private final int from;
    private final int to;

    OutputSlice(Object[] elements, int from, int to) {
        this.elements = elements;
        this.from = from;
        this.to = to;
    }

    int from() {
        return from;
    }

    int to() {
        return to;
    }

    int length() {
        return to - from;
    }

    /** Copy a sorted sequence verbatim. Its size must equal the slice length. */
    void copyFrom(Collection<? extends T> source) {
        int end = Merges.copy(source, elements, from, to);
        checkFilled(end);
    }

    /** Stable two-way merge of {@code left} and {@code right} into this slice. */
    void mergeFrom(Collection<? extends T> left, Collection<? extends T> right, Comparator<? super T> comparator) {
        int end = Merges.merge(left, right, elements, from, to, comparator);
        checkFilled(end);
    }

    /**
     * Fuse the adjacent sorted runs {@code [from, split)} and {@code [split, to)}
     * into one sorted run over the same range.
     */
    void mergeInPlace(int split, Comparator<? super T> comparator, MergeOptions.InPlaceStrategy strategy) {
        if (split < from || split > to) {
            throw new IllegalArgumentException("split " + split + " outside [" + from + "," + to + "]");
        }
        switch (strategy) {
            case BUFFERED -> Merges.mergeInPlaceBuffered(elements, from, split, to, comparator);
            case ROTATION -> Merges.mergeInPlaceRotating(elements, from, split, to, comparator);
        }
    }

    private void checkFilled(int end) {
        if (end != to) {
            throw new IllegalStateException(
                    "sequence size changed during merge: wrote [%d,%d), expected [%d,%d)".formatted(from, end, from, to));
        }
    }

    @Override
    public String toString() {
        return "[" + from + "," + to + ")";
    }
}
