// file: client/src/main/java/io/kwaymerge/client/Cli.java
package io.kwaymerge.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kwaymerge.core.KWayMerge;
import io.kwaymerge.core.UnsortedSequenceException;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Merges sorted number arrays from a JSON file.
 *
 * Usage:
 *   kwaymerge-cli [options] <input.json|->
 *
 * Examples:
 *   echo '[[1,4],[2,3],[0]]' | kwaymerge-cli -
 *   kwaymerge-cli --validate -p 4 -o merged.json lists.json
 *
 * Numbers are read as {@link BigDecimal}, so values are compared exactly and
 * written back as they were read.
 */
public final class Cli {

    private static final TypeReference<List<List<BigDecimal>>> INPUT_TYPE = new TypeReference<>() {};

    // Held strongly so the level set by --verbose sticks.
    private static final Logger ROOT_LOG = Logger.getLogger("io.kwaymerge");
    private static ConsoleHandler verboseHandler;

    private final ObjectMapper json = new ObjectMapper();
    private final CliConfig config;

    private Cli(CliConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /**
     * Entry point without {@code System.exit}.
     *
     * @return 0 on success, 1 on user error, 2 on unexpected failure
     */
    static int run(String[] args, InputStream stdin, PrintStream stdout, PrintStream stderr) {
        try {
            CliConfig config;
            try {
                config = CliConfig.fromArgs(args);
            } catch (IllegalArgumentException e) {
                stderr.println("error: " + e.getMessage());
                stderr.println(CliConfig.usage());
                return 1;
            }
            if (config.help()) {
                stdout.println(CliConfig.usage());
                return 0;
            }
            if (config.verbose()) {
                enableVerboseLogging();
            }
            new Cli(config).execute(stdin, stdout);
            return 0;
        } catch (CliException e) {
            stderr.println("error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            e.printStackTrace(stderr);
            return 2;
        }
    }

    private void execute(InputStream stdin, PrintStream stdout) throws IOException {
        List<List<BigDecimal>> input = read(stdin);

        Comparator<BigDecimal> order = config.descending()
                ? Comparator.<BigDecimal>reverseOrder()
                : Comparator.<BigDecimal>naturalOrder();

        List<BigDecimal> merged;
        try {
            merged = KWayMerge.merge(input, order, config.toMergeOptions());
        } catch (UnsortedSequenceException e) {
            throw new CliException(e.getMessage());
        } catch (IllegalArgumentException e) {
            throw new CliException("invalid options: " + e.getMessage());
        }

        String out = json.writeValueAsString(merged);
        if (config.output() == null) {
            stdout.println(out);
        } else {
            Files.writeString(Path.of(config.output()), out + System.lineSeparator(), StandardCharsets.UTF_8);
        }
    }

    private List<List<BigDecimal>> read(InputStream stdin) throws IOException {
        List<List<BigDecimal>> input;
        try {
            if (config.readsStdin()) {
                input = json.readValue(stdin, INPUT_TYPE);
            } else {
                Path path = Path.of(config.input());
                if (!Files.isReadable(path)) {
                    throw new CliException("cannot read input file: " + path);
                }
                input = json.readValue(path.toFile(), INPUT_TYPE);
            }
        } catch (JsonProcessingException e) {
            throw new CliException("malformed JSON input: " + e.getOriginalMessage());
        }

        if (input == null) {
            throw new CliException("input must be a JSON array of arrays, got null");
        }
        for (int i = 0; i < input.size(); i++) {
            List<BigDecimal> seq = input.get(i);
            if (seq == null) {
                throw new CliException("array " + i + " is null");
            }
            if (seq.contains(null)) {
                throw new CliException("array " + i + " contains null");
            }
        }
        return input;
    }

    private static synchronized void enableVerboseLogging() {
        if (verboseHandler == null) {
            verboseHandler = new ConsoleHandler();
            verboseHandler.setLevel(Level.FINE);
            ROOT_LOG.addHandler(verboseHandler);
        }
        ROOT_LOG.setLevel(Level.FINE);
    }

    private static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
