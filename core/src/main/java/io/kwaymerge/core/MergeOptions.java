// file: core/src/main/java/io/kwaymerge/core/MergeOptions.java
package io.kwaymerge.core;

import java.util.Objects;

/**
 * Tuning knobs for a {@link KWayMerger}.
 *
 * Supports:
 *  - parallelism:         0 = JVM common pool, 1 = run on the calling thread,
 *                         n > 1 = dedicated ForkJoinPool with n workers
 *  - validateInputs:      check every input is sorted before merging
 *  - inPlaceStrategy:     how adjacent runs are fused during the reduction phase
 *  - sequentialThreshold: batches touching fewer elements than this run on the
 *                         calling thread even when a pool is configured
 *
 * None of these change the result, only how it is computed.
 */
public record MergeOptions(
        int parallelism,
        boolean validateInputs,
        InPlaceStrategy inPlaceStrategy,
        int sequentialThreshold
) {

    /** Default batch size below which forking costs more than it saves. */
    public static final int DEFAULT_SEQUENTIAL_THRESHOLD = 8_192;

    /** How two adjacent sorted runs are merged inside the output buffer. */
    public enum InPlaceStrategy {
        /** Copy the shorter run aside and merge back. Linear time, extra space up to half the range. */
        BUFFERED,
        /** Binary search and rotate. No temporary arrays, n log n time. */
        ROTATION
    }

    public MergeOptions {
        Objects.requireNonNull(inPlaceStrategy, "inPlaceStrategy");
        if (parallelism < 0) throw new IllegalArgumentException("parallelism must be >= 0");
        if (parallelism > 32_767) throw new IllegalArgumentException("parallelism must be <= 32767");
        if (sequentialThreshold < 0) throw new IllegalArgumentException("sequentialThreshold must be >= 0");
    }

    public static MergeOptions defaults() {
        return new MergeOptions(0, false, InPlaceStrategy.BUFFERED, DEFAULT_SEQUENTIAL_THRESHOLD);
    }

    /** Single-threaded options: same result as any parallel configuration. */
    public static MergeOptions sequential() {
        return defaults().withParallelism(1);
    }

    public MergeOptions withParallelism(int parallelism) {
        return new MergeOptions(parallelism, validateInputs, inPlaceStrategy, sequentialThreshold);
    }

    public MergeOptions withValidateInputs(boolean validateInputs) {
        return new MergeOptions(parallelism, validateInputs, inPlaceStrategy, sequentialThreshold);
    }

    public MergeOptions withInPlaceStrategy(InPlaceStrategy inPlaceStrategy) {
        return new MergeOptions(parallelism, validateInputs, inPlaceStrategy, sequentialThreshold);
    }

    public MergeOptions withSequentialThreshold(int sequentialThreshold) {
        return new MergeOptions(parallelism, validateInputs, inPlaceStrategy, sequentialThreshold);
    }
}
