// file: core/src/main/java/io/kwaymerge/core/FirstRoundPairer.java
package io.kwaymerge.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * First round of the k-way merge.
 * <p>
 * Sequences {@code 2i} and {@code 2i+1} are merged straight into the output
 * buffer; with an odd count the last sequence is copied as is. Slice offsets
 * are prefix sums of the pair lengths, so every task owns its slice before any
 * task starts. All tasks of the round run behind one barrier.
 * <p>
 * The returned ledger reads {@code [0, end(pair 0), end(pair 1), ..., N]}.
 * A pair whose sequences are both empty produces no boundary.
 */
final class FirstRoundPairer {

    private final MergeScheduler scheduler;

    FirstRoundPairer(MergeScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * @param sequences  the k sorted inputs, in order
     * @param buffer     buffer of exactly the summed input length
     * @param comparator order every input is sorted by
     * @return ledger of the runs now present in {@code buffer}
     */
    <T> BoundaryLedger pairAndMerge(
            List<? extends Collection<? extends T>> sequences,
            OutputBuffer<T> buffer,
            Comparator<? super T> comparator
    ) {
        int k = sequences.size();
        int groups = k / 2 + k % 2;

        // Cut positions, one per group plus the start.
        int[] cuts = new int[groups + 1];
        long offset = 0;
        for (int g = 0; g < groups; g++) {
            int i = 2 * g;
            offset += sequences.get(i).size();
            if (i + 1 < k) {
                offset += sequences.get(i + 1).size();
            }
            cuts[g + 1] = Math.toIntExact(offset);
        }
        if (offset != buffer.length()) {
            throw new IllegalArgumentException(
                    "buffer length " + buffer.length() + " does not match input length " + offset);
        }

        List<OutputSlice<T>> slices = buffer.partition(cuts);
        BoundaryLedger ledger = BoundaryLedger.startingAt(0, groups + 1);
        List<Runnable> tasks = new ArrayList<>(groups);

        for (int g = 0; g < groups; g++) {
            OutputSlice<T> slice = slices.get(g);
            if (slice.length() == 0) {
                continue;
            }
            Collection<? extends T> left = sequences.get(2 * g);
            if (2 * g + 1 < k) {
                Collection<? extends T> right = sequences.get(2 * g + 1);
                tasks.add(() -> slice.mergeFrom(left, right, comparator));
            } else {
                tasks.add(() -> slice.copyFrom(left));
            }
            ledger.append(slice.to());
        }

        scheduler.runAll(tasks, buffer.length());
        return ledger;
    }
}
