// file: core/src/main/java/io/kwaymerge/core/MergeScheduler.java
package io.kwaymerge.core;

import java.util.List;

/**
 * Runs one batch of independent merge tasks and returns once every task has
 * finished. Each call is a barrier: nothing from the next batch starts before
 * the previous call returned.
 * <p>
 * Tasks of one batch write to disjoint slices of the output buffer, so
 * implementations are free to run them in any order or concurrently.
 */
interface MergeScheduler extends AutoCloseable {

    /**
     * @param tasks    independent tasks
     * @param elements number of buffer elements the batch touches, used to skip
     *                 forking for small batches
     */
    void runAll(List<? extends Runnable> tasks, long elements);

    /** Release worker threads owned by this scheduler, if any. */
    @Override
    void close();

    /** Runs every task in list order on the calling thread. */
    static MergeScheduler sequential() {
        return new MergeScheduler() {
            @Override
            public void runAll(List<? extends Runnable> tasks, long elements) {
                for (Runnable task : tasks) {
                    task.run();
                }
            }

            @Override
            public void close() {
                // nothing owned
            }

            @Override
            public String toString() {
                return "sequential";
            }
        };
    }
}
