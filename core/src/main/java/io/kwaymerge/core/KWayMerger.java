// file: core/src/main/java/io/kwaymerge/core/KWayMerger.java
package io.kwaymerge.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stable k-way merge of already sorted sequences.
 * <p>
 * The result holds every input element in comparator order. Ties are broken
 * by input position first, then by position inside the sequence.
 * <p>
 * How a call runs:
 *  1) Snapshot the input collection in one traversal and, when
 *     enabled, check each sequence is sorted.
 *  2) Allocate one buffer of N = total elements.
 *  3) k = 0, 1 or 2: empty result, copy, or a single two-way merge.
 *  4) Otherwise the {@link FirstRoundPairer} merges pairs of sequences into
 *     the buffer and the {@link ReductionMerger} fuses the resulting runs in
 *     place, in ceil(log2) passes.
 * <p>
 * Inputs are never modified. The same instance may be used from several
 * threads; each call owns its own buffer. Closing the merger releases a
 * dedicated worker pool, if the options asked for one.
 */
public final class KWayMerger implements AutoCloseable {

    private static final Logger log = Logger.getLogger(KWayMerger.class.getName());

    // Running with -ea turns validation on regardless of the options.
    private static final boolean ASSERTIONS_ENABLED = KWayMerger.class.desiredAssertionStatus();

    private final MergeOptions options;
    private final MergeScheduler scheduler;
    private final FirstRoundPairer pairer;
    private final ReductionMerger reducer;

    KWayMerger(MergeOptions options, MergeScheduler scheduler) {
        this.options = Objects.requireNonNull(options, "options");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.pairer = new FirstRoundPairer(scheduler);
        this.reducer = new ReductionMerger(scheduler, options.inPlaceStrategy());
    }

    /** Build a merger whose scheduling follows {@link MergeOptions#parallelism()}. */
    public static KWayMerger create(MergeOptions options) {
        Objects.requireNonNull(options, "options");
        MergeScheduler scheduler = switch (options.parallelism()) {
            case 0 -> ForkJoinMergeScheduler.commonPool(options.sequentialThreshold());
            case 1 -> MergeScheduler.sequential();
            default -> ForkJoinMergeScheduler.dedicated(options.parallelism(), options.sequentialThreshold());
        };
        return new KWayMerger(options, scheduler);
    }

    public MergeOptions options() {
        return options;
    }

    /** Merge sequences sorted by natural order. */
    public <T extends Comparable<? super T>> List<T> merge(Iterable<? extends Collection<? extends T>> sequences) {
        return merge(sequences, Comparator.<T>naturalOrder());
    }

    /**
     * Merge sequences sorted by {@code comparator}.
     *
     * @param sequences  k sorted sequences; order decides how ties are broken
     * @param comparator order every sequence is sorted by
     * @return a fixed-size, random-access list of all N elements in sorted order
     * @throws UnsortedSequenceException if validation is on and a sequence is not sorted
     * @throws OutOfMemoryError          if the result buffer cannot be allocated
     */
    public <T> List<T> merge(
            Iterable<? extends Collection<? extends T>> sequences,
            Comparator<? super T> comparator
    ) {
        Objects.requireNonNull(sequences, "sequences");
        Objects.requireNonNull(comparator, "comparator");
        long startNanos = System.nanoTime();

        List<Collection<? extends T>> inputs = snapshot(sequences);
        int k = inputs.size();

        if (options.validateInputs() || ASSERTIONS_ENABLED) {
            SortedPrecondition.check(inputs, comparator);
        }

        long total = 0;
        for (Collection<? extends T> s : inputs) {
            total += s.size();
        }
        OutputBuffer<T> buffer = OutputBuffer.allocate(total);

        if (k == 0 || total == 0) {
            return buffer.asList();
        }
        if (k == 1) {
            buffer.whole().copyFrom(inputs.get(0));
            return buffer.asList();
        }
        if (k == 2) {
            buffer.whole().mergeFrom(inputs.get(0), inputs.get(1), comparator);
            return buffer.asList();
        }

        BoundaryLedger ledger = pairer.pairAndMerge(inputs, buffer, comparator);
        int runs = ledger.segmentCount();
        int passes = reducer.reduce(buffer, ledger, comparator);

        if (log.isLoggable(Level.FINE)) {
            log.log(Level.FINE, String.format(
                    "merged k=%d N=%d (first-round runs=%d, passes=%d) in %.3fms on %s",
                    k, total, runs, passes, (System.nanoTime() - startNanos) / 1_000_000.0, scheduler));
        }
        return buffer.asList();
    }

    @Override
    public void close() {
        scheduler.close();
    }

    // ---------- helpers ----------

    private static <T> List<Collection<? extends T>> snapshot(Iterable<? extends Collection<? extends T>> sequences) {
        // A non-Collection iterable may be single-use, so it is read exactly once.
        List<Collection<? extends T>> out = sequences instanceof Collection<?> c
                ? new ArrayList<>(SizeOracle.sizeOf(c))
                : new ArrayList<>();
        for (Collection<? extends T> s : sequences) {
            if (s == null) {
                throw new NullPointerException("sequence " + out.size() + " is null");
            }
            out.add(s);
        }
        return out;
    }
}
