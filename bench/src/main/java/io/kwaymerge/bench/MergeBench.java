// file: bench/src/main/java/io/kwaymerge/bench/MergeBench.java
package io.kwaymerge.bench;

import io.kwaymerge.core.KWayMerger;
import io.kwaymerge.core.MergeOptions;
import io.kwaymerge.core.SortedPrecondition;

import java.util.*;

/**
 * Throughput driver for {@link KWayMerger} over random sorted doubles.
 *
 * Usage:
 *   java -cp bench.jar io.kwaymerge.bench.MergeBench \
 *     --lists 256 \
 *     --min-size 1000 \
 *     --max-size 2000 \
 *     --iterations 10 \
 *     --parallelism 0 \
 *     --seed 42 \
 *     --linked false
 *
 * Output:
 *   - Summary line to stderr.
 *   - CSV to stdout, one row per iteration:
 *       container,lists,elements,parallelism,millis
 */
public final class MergeBench {

    record Sample(String container, int lists, long elements, int parallelism, double millis) {}

    public static void main(String[] args) {
        Map<String, String> cfg = parseArgs(args);

        int lists = Integer.parseInt(cfg.getOrDefault("lists", "256"));
        int minSize = Integer.parseInt(cfg.getOrDefault("min-size", "1000"));
        int maxSize = Integer.parseInt(cfg.getOrDefault("max-size", "2000"));
        int iterations = Integer.parseInt(cfg.getOrDefault("iterations", "10"));
        int parallelism = Integer.parseInt(cfg.getOrDefault("parallelism", "0"));
        long seed = Long.parseLong(cfg.getOrDefault("seed", "42"));
        boolean linked = Boolean.parseBoolean(cfg.getOrDefault("linked", "false"));

        List<Sample> samples = run(lists, minSize, maxSize, iterations, parallelism, seed, linked);
        summarizeAndPrint(samples);
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String key = a.substring(2);
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + a);
                }
                out.put(key, args[++i]);
            } else {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
        }
        return out;
    }

    static List<Sample> run(
            int lists,
            int minSize,
            int maxSize,
            int iterations,
            int parallelism,
            long seed,
            boolean linked
    ) {
        if (iterations <= 0) throw new IllegalArgumentException("iterations must be > 0");

        RandomSortedSequences gen = new RandomSortedSequences(seed);
        Collection<List<Double>> input = linked
                ? gen.batch(lists, minSize, maxSize, LinkedList::new)
                : gen.batch(lists, minSize, maxSize, ArrayList::new);
        String container = linked ? "linked" : "array";

        List<Sample> samples = new ArrayList<>(iterations);
        try (KWayMerger merger = KWayMerger.create(MergeOptions.defaults().withParallelism(parallelism))) {
            for (int it = 0; it < iterations; it++) {
                long start = System.nanoTime();
                List<Double> merged = merger.merge(input);
                double millis = (System.nanoTime() - start) / 1_000_000.0;

                if (!SortedPrecondition.isSorted(merged, Comparator.naturalOrder())) {
                    throw new IllegalStateException("iteration " + it + " produced unsorted output");
                }
                samples.add(new Sample(container, lists, merged.size(), parallelism, millis));
            }
        }
        return samples;
    }

    private static void summarizeAndPrint(List<Sample> all) {
        List<Double> millis = new ArrayList<>(all.size());
        for (Sample s : all) {
            millis.add(s.millis());
        }
        Collections.sort(millis);

        Sample first = all.get(0);
        double p50 = percentile(millis, 0.50);
        double throughput = first.elements() / (p50 / 1_000.0);

        System.err.printf(
                "container=%s, lists=%d, elements=%d, parallelism=%d, min=%.2fms, p50=%.2fms, max=%.2fms, throughput=%.0f elem/s%n",
                first.container(), first.lists(), first.elements(), first.parallelism(),
                millis.get(0), p50, millis.get(millis.size() - 1), throughput
        );

        // CSV to stdout.
        System.out.println("container,lists,elements,parallelism,millis");
        for (Sample s : all) {
            System.out.printf("%s,%d,%d,%d,%.3f%n", s.container(), s.lists(), s.elements(), s.parallelism(), s.millis());
        }
    }

    static double percentile(List<Double> sorted, double q) {
        if (sorted.isEmpty()) return Double.NaN;
        double idx = q * (sorted.size() - 1);
        int lo = (int) Math.floor(idx);
        int hi = (int) Math.ceil(idx);
        if (lo == hi) return sorted.get(lo);
        double w = idx - lo;
        return sorted.get(lo) * (1 - w) + sorted.get(hi) * w;
    }
}
