// file: bench/src/main/java/io/kwaymerge/bench/RandomSortedSequences.java
package io.kwaymerge.bench;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Seeded generator of sorted double sequences, uniform in [min, max).
 *
 * The same seed always yields the same data, so benchmark runs are
 * comparable across parallelism settings.
 */
public final class RandomSortedSequences {

    private final Random rnd;
    private final double min;
    private final double max;

    public RandomSortedSequences(long seed, double min, double max) {
        if (!(min < max)) throw new IllegalArgumentException("min must be < max");
        this.rnd = new Random(seed);
        this.min = min;
        this.max = max;
    }

    public RandomSortedSequences(long seed) {
        this(seed, 0.0, 1.0);
    }

    /** One sequence of {@code size} values sorted by {@code comparator}. */
    public List<Double> next(int size, Comparator<? super Double> comparator) {
        if (size < 0) throw new IllegalArgumentException("size must be >= 0");
        Double[] values = new Double[size];
        for (int i = 0; i < size; i++) {
            values[i] = min + (max - min) * rnd.nextDouble();
        }
        Arrays.sort(values, comparator);
        return new ArrayList<>(Arrays.asList(values));
    }

    public List<Double> next(int size) {
        return next(size, Comparator.naturalOrder());
    }

    /**
     * {@code count} ascending sequences with sizes uniform in [minSize, maxSize],
     * collected into the outer container made by {@code container}.
     */
    public <C extends Collection<List<Double>>> C batch(int count, int minSize, int maxSize, Supplier<C> container) {
        if (count < 0) throw new IllegalArgumentException("count must be >= 0");
        if (minSize < 0 || maxSize < minSize) throw new IllegalArgumentException("need 0 <= minSize <= maxSize");
        C out = container.get();
        for (int i = 0; i < count; i++) {
            out.add(next(minSize + rnd.nextInt(maxSize - minSize + 1)));
        }
        return out;
    }
}
