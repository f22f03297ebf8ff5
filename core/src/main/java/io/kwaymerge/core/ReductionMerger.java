// file: core/src/main/java/io/kwaymerge/core/ReductionMerger.java
package io.kwaymerge.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Second phase of the k-way merge: fuse neighbouring runs until one is left.
 * <p>
 * Each pass walks the ledger from the head taking (left, middle, right)
 * triples. The two runs {@code [left, middle)} and {@code [middle, right)} are
 * merged in place, {@code middle} is dropped from the ledger and the walk
 * resumes at {@code right}. A trailing run without a partner is carried into
 * the next pass untouched. Triples of one pass cover disjoint ranges and are
 * merged concurrently; the scheduler call is the barrier between passes.
 * <p>
 * With s runs after the first round this takes ceil(log2(s)) passes.
 */
final class ReductionMerger {

    private static final Logger log = Logger.getLogger(ReductionMerger.class.getName());

    private final MergeScheduler scheduler;
    private final MergeOptions.InPlaceStrategy strategy;

    ReductionMerger(MergeScheduler scheduler, MergeOptions.InPlaceStrategy strategy) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    /**
     * Merge every run described by {@code ledger} into one. On return the
     * ledger holds only the start and end of the buffer.
     *
     * @return number of passes performed
     */
    <T> int reduce(OutputBuffer<T> buffer, BoundaryLedger ledger, Comparator<? super T> comparator) {
        if (ledger.size() < 2 || ledger.first() != 0 || ledger.last() != buffer.length()) {
            throw new IllegalArgumentException("ledger " + ledger + " does not span a buffer of " + buffer.length());
        }

        int passes = 0;
        while (ledger.size() > 2) {
            runPass(buffer, ledger, comparator, passes);
            passes++;
        }
        return passes;
    }

    private <T> void runPass(
            OutputBuffer<T> buffer,
            BoundaryLedger ledger,
            Comparator<? super T> comparator,
            int pass
    ) {
        int pairs = ledger.segmentCount() / 2;
        int[] cuts = new int[pairs + 1];
        int[] splits = new int[pairs];

        // Ledger edits happen here, on the coordinating thread, before any merge runs.
        BoundaryLedger.Cursor cursor = ledger.cursor();
        cuts[0] = cursor.position();
        int p = 0;
        while (cursor.hasTriple()) {
            splits[p] = cursor.nextPosition();
            cursor.removeNext();
            cuts[p + 1] = cursor.nextPosition();
            p++;
            cursor.advance();
        }

        List<OutputSlice<T>> slices = buffer.partition(cuts);
        List<Runnable> tasks = new ArrayList<>(pairs);
        for (int i = 0; i < pairs; i++) {
            OutputSlice<T> slice = slices.get(i);
            int split = splits[i];
            tasks.add(() -> slice.mergeInPlace(split, comparator, strategy));
        }

        long touched = (long) cuts[pairs] - cuts[0];
        if (log.isLoggable(Level.FINER)) {
            log.log(Level.FINER, String.format(
                    "pass %d: %d merges over %d elements, %d runs remain",
                    pass, pairs, touched, ledger.segmentCount()));
        }
        scheduler.runAll(tasks, touched);
    }
}
