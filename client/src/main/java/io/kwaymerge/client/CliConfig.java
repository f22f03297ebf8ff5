// file: client/src/main/java/io/kwaymerge/client/CliConfig.java
package io.kwaymerge.client;

import io.kwaymerge.core.MergeOptions;

import java.util.Locale;

/**
 * Command-line configuration for {@link Cli}.
 *
 * Supports:
 *  - input:       JSON file to read, "-" for stdin
 *  - output:      file to write, null for stdout
 *  - parallelism: 0 = common pool, 1 = calling thread, n = dedicated pool
 *  - validate:    reject unsorted input lists
 *  - descending:  lists are sorted largest first
 *  - strategy:    in-place merge strategy for the reduction passes
 *  - threshold:   batches smaller than this run on one thread
 *  - verbose:     log merge statistics to stderr
 *  - help:        print usage and exit
 */
public record CliConfig(
        String input,
        String output,
        int parallelism,
        boolean validate,
        boolean descending,
        MergeOptions.InPlaceStrategy strategy,
        int threshold,
        boolean verbose,
        boolean help
) {

    public CliConfig {
        if (!help && (input == null || input.isBlank())) {
            throw new IllegalArgumentException("input must be a file path or -");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy must not be null");
        }
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --parallelism, -p <n>
     *   --validate
     *   --descending
     *   --strategy        buffered|rotation
     *   --threshold       <n>
     *   --output,      -o <path>
     *   --verbose,     -v
     *   --help,        -h
     *
     * Exactly one positional argument names the input ("-" for stdin).
     *
     * @throws IllegalArgumentException on unknown flags, missing or malformed values
     */
    public static CliConfig fromArgs(String[] args) {
        // Defaults
        String input = null;
        String output = null;
        int parallelism = 0;
        boolean validate = false;
        boolean descending = false;
        MergeOptions.InPlaceStrategy strategy = MergeOptions.InPlaceStrategy.BUFFERED;
        int threshold = MergeOptions.DEFAULT_SEQUENTIAL_THRESHOLD;
        boolean verbose = false;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> help = true;

                case "--parallelism", "-p" -> {
                    ensureValue(args, i);
                    parallelism = parseInt("parallelism", args[++i]);
                }

                case "--validate" -> validate = true;

                case "--descending" -> descending = true;

                case "--strategy" -> {
                    ensureValue(args, i);
                    String name = args[++i];
                    try {
                        strategy = MergeOptions.InPlaceStrategy.valueOf(name.toUpperCase(Locale.ROOT));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid strategy: " + name + " (expected buffered or rotation)");
                    }
                }

                case "--threshold" -> {
                    ensureValue(args, i);
                    threshold = parseInt("threshold", args[++i]);
                }

                case "--output", "-o" -> {
                    ensureValue(args, i);
                    output = args[++i];
                }

                case "--verbose", "-v" -> verbose = true;

                default -> {
                    String a = args[i];
                    if (a.startsWith("-") && !a.equals("-")) {
                        throw new IllegalArgumentException("Unknown option: " + a);
                    }
                    if (input != null) {
                        throw new IllegalArgumentException("Only one input may be given, got " + input + " and " + a);
                    }
                    input = a;
                }
            }
        }
        if (!help && input == null) {
            throw new IllegalArgumentException("Missing input file (use - for stdin)");
        }
        return new CliConfig(input, output, parallelism, validate, descending, strategy, threshold, verbose, help);
    }

    /** Merge options matching the flags. Invalid numbers fail here. */
    public MergeOptions toMergeOptions() {
        return new MergeOptions(parallelism, validate, strategy, threshold);
    }

    public boolean readsStdin() {
        return "-".equals(input);
    }

    // ---------- helpers ----------

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
    }

    private static int parseInt(String name, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + raw);
        }
    }

    static String usage() {
        return """
            Usage: kwaymerge-cli [options] <input.json|->

            Reads a JSON array of sorted number arrays and prints them merged
            into one sorted array.

            Options:
              --parallelism, -p   Worker threads: 0 = common pool, 1 = none (default: 0)
              --validate          Reject input arrays that are not sorted
              --descending        Input arrays are sorted largest first
              --strategy          In-place merge: buffered or rotation (default: buffered)
              --threshold         Elements below which a step runs on one thread (default: 8192)
              --output,      -o   Write the result to a file instead of stdout
              --verbose,     -v   Log merge statistics to stderr
              --help,        -h   Show this help message
            """;
    }
}
