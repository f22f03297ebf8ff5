// file: core/src/main/java/io/kwaymerge/core/SizeOracle.java
package io.kwaymerge.core;

import java.util.Collection;
import java.util.Iterator;
import java.util.Objects;

/**
 * Counts the sequences in an input collection.
 * <p>
 * Collections answer in O(1) through {@link Collection#size()}; any other
 * {@link Iterable} is walked once, O(k).
 */
public final class SizeOracle {

    private SizeOracle() {
        // utility
    }

    public static int sizeOf(Iterable<?> sequences) {
        Objects.requireNonNull(sequences, "sequences");
        if (sequences instanceof Collection<?> c) {
            return c.size();
        }
        long count = 0;
        for (Iterator<?> it = sequences.iterator(); it.hasNext(); it.next()) {
            count++;
        }
        if (count > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("too many sequences: " + count);
        }
        return (int) count;
    }
}
