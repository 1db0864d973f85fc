package org.graphsearch.app;

import lombok.Getter;
import org.graphsearch.search.SearchAlgorithm;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Parses command-line arguments for the pathfinder.
 *
 * <pre>
 *   &lt;graph&gt; &lt;start&gt; &lt;goal&gt; &lt;algorithm&gt;
 *       [--list] [--animate] [--speed-ms N] [--help | -h]
 * </pre>
 *
 * <p>Positional values are kept as raw text; graph membership and node literals are
 * resolved by {@link Main} against the catalog.</p>
 */
@Getter
public final class CommandLineArguments {
    static final String USAGE_MESSAGE =
            "Usage: <graph> <start> <goal> <algorithm> [OPTIONS]\n" +
            "  graph       one of the catalog graph names\n" +
            "  start/goal  node literal, e.g. Gate, 7 or \"(0, 0)\"\n" +
            "  algorithm   " + algorithmKeys() + "\n" +
            "Options:\n" +
            "  --list              List graphs and the nodes of the selected graph\n" +
            "  --animate           Replay visitation order and path after the search\n" +
            "  --speed-ms <ms>     Playback delay per path segment (" + PlaybackConfig.MIN_SPEED_MILLIS
            + "-" + PlaybackConfig.MAX_SPEED_MILLIS + ", default " + PlaybackConfig.DEFAULT_SPEED_MILLIS + ")\n" +
            "  --help, -h          Show this help message and exit";

    private static final int POSITIONAL_COUNT = 4;

    private String graphName;
    private String startLiteral;
    private String goalLiteral;
    private SearchAlgorithm algorithm;
    private boolean listRequested;
    private boolean animate;
    private boolean helpRequested;
    private long speedMillis = PlaybackConfig.DEFAULT_SPEED_MILLIS;

    private CommandLineArguments() {
    }

    /**
     * Parses command-line arguments.
     *
     * @param args raw arguments from {@code main()}.
     * @return parsed arguments.
     * @throws IllegalArgumentException when arguments are missing or malformed.
     */
    public static CommandLineArguments parse(String[] args) {
        CommandLineArguments parsed = new CommandLineArguments();
        List<String> positional = new ArrayList<>(POSITIONAL_COUNT);

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--help", "-h" -> parsed.helpRequested = true;
                case "--list" -> parsed.listRequested = true;
                case "--animate" -> parsed.animate = true;
                case "--speed-ms" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--speed-ms requires a value");
                    }
                    parsed.speedMillis = parseSpeed(args[++i]);
                }
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException(
                                "Unknown argument: " + arg + ". Use --help for usage information.");
                    }
                    positional.add(arg);
                }
            }
        }

        if (parsed.helpRequested) {
            return parsed;
        }
        if (positional.size() != POSITIONAL_COUNT) {
            throw new IllegalArgumentException(
                    "Expected " + POSITIONAL_COUNT + " positional arguments, got " + positional.size()
                            + ".\n" + USAGE_MESSAGE);
        }
        parsed.graphName = positional.get(0);
        parsed.startLiteral = positional.get(1);
        parsed.goalLiteral = positional.get(2);
        parsed.algorithm = SearchAlgorithm.fromKey(positional.get(3))
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown algorithm: " + positional.get(3) + ". Valid algorithms: " + algorithmKeys()));
        return parsed;
    }

    /**
     * @return playback configuration derived from the parsed flags.
     */
    public PlaybackConfig playbackConfig() {
        return PlaybackConfig.builder()
                .speedMillis(speedMillis)
                .build();
    }

    private static long parseSpeed(String value) {
        long speed;
        try {
            speed = Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid --speed-ms: must be an integer, got " + value, ex);
        }
        if (speed < PlaybackConfig.MIN_SPEED_MILLIS || speed > PlaybackConfig.MAX_SPEED_MILLIS) {
            throw new IllegalArgumentException("Invalid --speed-ms: must be in ["
                    + PlaybackConfig.MIN_SPEED_MILLIS + ", " + PlaybackConfig.MAX_SPEED_MILLIS + "], got " + speed);
        }
        return speed;
    }

    private static String algorithmKeys() {
        return Arrays.stream(SearchAlgorithm.values())
                .map(SearchAlgorithm::key)
                .collect(Collectors.joining(" | "));
    }
}
