package io.kwaymerge.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ForkJoinMergeSchedulerTest {

    @Test
    void every_task_has_finished_when_run_all_returns() {
        try (var scheduler = ForkJoinMergeScheduler.dedicated(4, 0)) {
            AtomicInteger done = new AtomicInteger();
            List<Runnable> tasks = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                tasks.add(() -> {
                    Thread.onSpinWait();
                    done.incrementAndGet();
                });
            }

            scheduler.runAll(tasks, Long.MAX_VALUE);

            assertEquals(64, done.get());
            assertEquals(4, scheduler.parallelism());
        }
    }

    @Test
    void small_batches_stay_on_the_calling_thread() {
        try (var scheduler = ForkJoinMergeScheduler.dedicated(2, 1_000)) {
            Set<Thread> threads = ConcurrentHashMap.newKeySet();
            List<Runnable> tasks = List.<Runnable>of(
                    () -> threads.add(Thread.currentThread()),
                    () -> threads.add(Thread.currentThread())
            );

            scheduler.runAll(tasks, 999);

            assertEquals(Set.of(Thread.currentThread()), threads);
        }
    }

    @Test
    void task_failure_reaches_the_caller() {
        try (var scheduler = ForkJoinMergeScheduler.dedicated(2, 0)) {
            List<Runnable> tasks = List.<Runnable>of(
                    () -> { },
                    () -> { throw new ClassCastException("boom"); }
            );

            assertThrows(ClassCastException.class, () -> scheduler.runAll(tasks, 100));
        }
    }

    @Test
    void sequential_scheduler_runs_in_list_order() {
        List<Integer> order = new ArrayList<>();
        var scheduler = MergeScheduler.sequential();

        scheduler.runAll(List.<Runnable>of(() -> order.add(1), () -> order.add(2), () -> order.add(3)), 3);

        assertEquals(List.of(1, 2, 3), order);
    }

    @Test
    void closing_a_common_pool_scheduler_leaves_the_pool_running() {
        var scheduler = ForkJoinMergeScheduler.commonPool(0);
        scheduler.close();

        AtomicInteger done = new AtomicInteger();
        scheduler.runAll(List.<Runnable>of(done::incrementAndGet, done::incrementAndGet), 10);
        assertEquals(2, done.get());
    }
}
