package io.kwaymerge.bench;

import io.kwaymerge.core.KWayMerge;
import io.kwaymerge.core.SortedPrecondition;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Merges 256 random sorted lists of 100k to 200k doubles each.
 * Exit status 0 if the result is sorted, 1 otherwise.
 */
public final class ExampleRun {

    static final int LISTS = 1 << 8;
    static final int MIN_SIZE = 100_000;
    static final int MAX_SIZE = 200_000;

    public static void main(String[] args) {
        long seed = args.length > 0 ? Long.parseLong(args[0]) : System.nanoTime();
        System.exit(run(seed, LISTS, MIN_SIZE, MAX_SIZE) ? 0 : 1);
    }

    static boolean run(long seed, int lists, int minSize, int maxSize) {
        List<List<Double>> input = new RandomSortedSequences(seed).batch(lists, minSize, maxSize, ArrayList::new);
        System.out.println("Generation over!");

        List<Double> merged = KWayMerge.merge(input);
        return SortedPrecondition.isSorted(merged, Comparator.naturalOrder());
    }
}
