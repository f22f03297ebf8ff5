// file: core/src/main/java/io/kwaymerge/core/KWayMerge.java
package io.kwaymerge.core;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Static entry points. Calls without options share one merger over the JVM
 * common pool; calls with options get a short-lived merger that is closed
 * before returning.
 *
 * Example:
 * <pre>{@code
 *   List<Integer> merged = KWayMerge.merge(List.of(List.of(1, 4), List.of(2, 3), List.of(0)));
 *   // [0, 1, 2, 3, 4]
 * }</pre>
 */
public final class KWayMerge {

    private static final KWayMerger SHARED = KWayMerger.create(MergeOptions.defaults());

    private KWayMerge() {
        // utility
    }

    public static <T extends Comparable<? super T>> List<T> merge(Iterable<? extends Collection<? extends T>> sequences) {
        return SHARED.merge(sequences);
    }

    public static <T> List<T> merge(
            Iterable<? extends Collection<? extends T>> sequences,
            Comparator<? super T> comparator
    ) {
        return SHARED.merge(sequences, comparator);
    }

    public static <T> List<T> merge(
            Iterable<? extends Collection<? extends T>> sequences,
            Comparator<? super T> comparator,
            MergeOptions options
    ) {
        try (KWayMerger merger = KWayMerger.create(options)) {
            return merger.merge(sequences, comparator);
        }
    }
}
