// file: core/src/main/java/io/kwaymerge/core/ForkJoinMergeScheduler.java
package io.kwaymerge.core;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.RecursiveAction;

/**
 * {@link MergeScheduler} backed by a {@link ForkJoinPool}.
 * <p>
 * A batch is wrapped in one coordinating action that forks every task and
 * joins them all ({@link ForkJoinTask#invokeAll(java.util.Collection)}), so on
 * success the caller blocks until the whole batch is done. If a task throws,
 * the remaining tasks are cancelled and the exception is rethrown as soon as it
 * is seen; tasks already running may still be writing to their slices, so the
 * buffer of a failed batch must be discarded.
 */
final class ForkJoinMergeScheduler implements MergeScheduler {

    private final ForkJoinPool pool;
    private final boolean owned;
    private final int sequentialThreshold;

    private ForkJoinMergeScheduler(ForkJoinPool pool, boolean owned, int sequentialThreshold) {
        this.pool = pool;
        this.owned = owned;
        this.sequentialThreshold = sequentialThreshold;
    }

    /** Scheduler over the JVM common pool. {@link #close()} leaves the pool alone. */
    static ForkJoinMergeScheduler commonPool(int sequentialThreshold) {
        return new ForkJoinMergeScheduler(ForkJoinPool.commonPool(), false, sequentialThreshold);
    }

    /** Scheduler with its own pool of {@code parallelism} workers, shut down on close. */
    static ForkJoinMergeScheduler dedicated(int parallelism, int sequentialThreshold) {
        if (parallelism <= 0) throw new IllegalArgumentException("parallelism must be > 0");
        return new ForkJoinMergeScheduler(new ForkJoinPool(parallelism), true, sequentialThreshold);
    }

    int parallelism() {
        return pool.getParallelism();
    }

    @Override
    public void runAll(List<? extends Runnable> tasks, long elements) {
        if (tasks.isEmpty()) {
            return;
        }
        if (tasks.size() == 1 || elements < sequentialThreshold) {
            for (Runnable task : tasks) {
                task.run();
            }
            return;
        }

        List<ForkJoinTask<?>> adapted = new ArrayList<>(tasks.size());
        for (Runnable task : tasks) {
            adapted.add(ForkJoinTask.adapt(task));
        }
        pool.invoke(new RecursiveAction() {
            @Override
            protected void compute() {
                invokeAll(adapted);
            }
        });
    }

    @Override
    public void close() {
        if (owned) {
            pool.shutdown();
        }
    }

    @Override
    public String toString() {
        return "fork-join(parallelism=" + pool.getParallelism() + (owned ? ", dedicated" : ", common") + ")";
    }
}
