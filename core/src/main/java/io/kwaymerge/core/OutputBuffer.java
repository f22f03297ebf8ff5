// file: core/src/main/java/io/kwaymerge/core/OutputBuffer.java
package io.kwaymerge.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Pre-sized contiguous store for the merged result.
 * <p>
 * Every slot starts out {@code null}; the merge writes through existing slots
 * instead of appending. Work is handed to tasks only as {@link OutputSlice}s
 * obtained from {@link #partition(int...)}, which cuts the buffer into
 * adjacent, non-overlapping ranges.
 *
 * @param <T> element type
 */
final class OutputBuffer<T> {

    // Same headroom the JDK collections keep below Integer.MAX_VALUE.
    static final int MAX_LENGTH = Integer.MAX_VALUE - 8;

    private final Object[] elements;

    private OutputBuffer(int length) {
        this.elements = new Object[length];
    }

    /**
     * Allocate a buffer of exactly {@code length} slots.
     *
     * @throws OutOfMemoryError if the length cannot be backed by a single array
     */
    static <T> OutputBuffer<T> allocate(long length) {
        if (length < 0) throw new IllegalArgumentException("length must be >= 0");
        if (length > MAX_LENGTH) {
            throw new OutOfMemoryError("Cannot allocate a merge buffer of " + length + " elements");
        }
        return new OutputBuffer<>((int) length);
    }

    int length() {
        return elements.length;
    }

    /**
     * Cut the buffer at the given positions. With cuts {@code c0..cm} the result
     * holds the slices {@code [c0,c1), [c1,c2), ... [c(m-1),cm)}.
     *
     * @throws IllegalArgumentException if the cuts decrease or leave the buffer
     */
    List<OutputSlice<T>> partition(int... cuts) {
        if (cuts.length < 2) throw new IllegalArgumentException("need at least two cuts");
        List<OutputSlice<T>> out = new ArrayList<>(cuts.length - 1);
        for (int i = 0; i < cuts.length; i++) {
            int c = cuts[i];
            if (c < 0 || c > elements.length) {
                throw new IllegalArgumentException("cut " + c + " outside [0," + elements.length + "]");
            }
            if (i > 0) {
                if (c < cuts[i - 1]) {
                    throw new IllegalArgumentException("cuts must not decrease: " + Arrays.toString(cuts));
                }
                out.add(new OutputSlice<>(elements, cuts[i - 1], c));
            }
        }
        return out;
    }

    /** The whole buffer as one slice. */
    OutputSlice<T> whole() {
        return new OutputSlice<>(elements, 0, elements.length);
    }

    /** Fixed-size, mutable list view backed by the buffer. */
    @SuppressWarnings("unchecked")
    List<T> asList() {
        return (List<T>) Arrays.asList(elements);
    }
}
