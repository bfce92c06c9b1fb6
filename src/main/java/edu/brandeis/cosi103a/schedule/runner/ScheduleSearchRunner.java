package edu.brandeis.cosi103a.schedule.runner;

import ch.qos.logback.classic.Level;
import edu.brandeis.cosi103a.schedule.tree.TreeFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

/**
 * Main entry point for the schedule search CLI.
 *
 * <p>Invocation:
 * <pre>
 * java -jar schedule-search.jar --teams 8 --weeks 3 --workers 6 --breadth 32 --output ./results
 * </pre>
 *
 * <p>Ctrl-C checkpoints the result file as partial; running the same command again resumes it.
 * Exit codes: 0 on success or checkpoint (also after Ctrl-C), 1 when the search failed, 2 on configuration errors.
 */
public class ScheduleSearchRunner {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleSearchRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_CONFIG = 2;

    private static final Set<String> VALUE_FLAGS =
        Set.of("--teams", "--weeks", "--workers", "--breadth", "--output", "--cache");

    public static void main(String[] args) {
        if (args.length == 0) {
            printUsage();
            System.exit(EXIT_CONFIG);
        }
        if (Arrays.asList(args).contains("--help")) {
            printUsage();
            System.exit(EXIT_OK);
        }

        SearchConfig config;
        try {
            config = parseArgs(args);
            config.requireValid();
        } catch (IllegalArgumentException | ScheduleConfigurationException e) {
            System.err.println("Error: " + e.getMessage());
            printUsage();
            System.exit(EXIT_CONFIG);
            return;
        }
        if (config.verbose()) {
            enableDebugLogging();
        }
        System.exit(run(config));
    }

    /**
     * Runs one search with a shutdown hook that checkpoints on Ctrl-C.
     *
     * @return the process exit code
     */
    static int run(SearchConfig config) {
        SearchCoordinator coordinator = new SearchCoordinator(config, new ConsoleProgress(System.out, 2000));
        CheckpointOnExit hook = new CheckpointOnExit(coordinator, Runtime.getRuntime()::halt);
        Runtime.getRuntime().addShutdownHook(hook);

        int exitCode = EXIT_FAILED;
        try {
            exitCode = search(coordinator, config);
            return exitCode;
        } finally {
            hook.finished(exitCode);
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                logger.debug("JVM already shutting down, hook stays registered");
            }
        }
    }

    private static int search(SearchCoordinator coordinator, SearchConfig config) {
        try {
            RunSummary summary = coordinator.run();
            printSummary(summary);
            if (summary.interrupted()) {
                System.out.printf("Interrupted: %,d paths saved to %s%n", summary.count(), summary.resultFile());
                System.out.println("Resume with:");
                System.out.println("  " + resumeCommand(config));
            }
            return EXIT_OK;
        } catch (ScheduleConfigurationException | TreeFormatException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_CONFIG;
        } catch (SearchFailedException e) {
            System.err.println("Search failed: " + e.getMessage());
            e.printStackTrace(System.err);
            System.err.println("The result file was checkpointed; resume with:");
            System.err.println("  " + resumeCommand(config));
            return EXIT_FAILED;
        } catch (IOException e) {
            System.err.println("I/O error: " + e.getMessage());
            e.printStackTrace(System.err);
            return EXIT_FAILED;
        }
    }

    /**
     * Shutdown hook for Ctrl-C: asks the search to checkpoint, waits for it to report, then
     * ends the JVM with the search's exit code instead of the signal's. {@code System.exit}
     * on the main thread blocks once shutdown has begun, so the hook halts.
     */
    static final class CheckpointOnExit extends Thread {

        private static final long REPORT_TIMEOUT_SECONDS = 60;

        private final SearchCoordinator coordinator;
        private final IntConsumer halt;
        private final CountDownLatch reported = new CountDownLatch(1);
        private final AtomicInteger exitCode = new AtomicInteger(EXIT_FAILED);

        CheckpointOnExit(SearchCoordinator coordinator, IntConsumer halt) {
            super("checkpoint-on-exit");
            this.coordinator = coordinator;
            this.halt = halt;
        }

        /** Records the search's exit code and releases a waiting hook. */
        void finished(int code) {
            exitCode.set(code);
            reported.countDown();
        }

        @Override
        public void run() {
            coordinator.requestStop();
            try {
                if (!reported.await(REPORT_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    System.err.println("Search did not checkpoint within " + REPORT_TIMEOUT_SECONDS + " seconds");
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            System.out.flush();
            System.err.flush();
            halt.accept(exitCode.get());
        }
    }

    /**
     * Parses CLI arguments into a SearchConfig. Both {@code --flag value} and
     * {@code --flag=value} are accepted.
     *
     * @throws IllegalArgumentException if an argument is unknown, malformed or missing
     */
    static SearchConfig parseArgs(String[] args) {
        Integer teams = null;
        Integer weeks = null;
        int workers = SearchConfig.defaultWorkers();
        int breadth = SearchConfig.DEFAULT_BREADTH;
        String output = SearchConfig.DEFAULT_OUTPUT_DIR;
        long cache = SearchConfig.DEFAULT_CACHE_WEEKS;
        boolean diversify = false;
        boolean validate = false;
        boolean verbose = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String name = arg;
            String value = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                name = arg.substring(0, eq);
                value = arg.substring(eq + 1);
            }
            if (VALUE_FLAGS.contains(name) && value == null) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Missing value for " + name);
                }
                value = args[++i];
            }
            switch (name) {
                case "--teams" -> teams = parseInt(name, value);
                case "--weeks" -> weeks = parseInt(name, value);
                case "--workers" -> workers = parseInt(name, value);
                case "--breadth" -> breadth = parseInt(name, value);
                case "--output" -> output = value;
                case "--cache" -> cache = parseInt(name, value);
                case "--diversify" -> diversify = value == null || Boolean.parseBoolean(value);
                case "--validate" -> validate = value == null || Boolean.parseBoolean(value);
                case "--verbose" -> verbose = value == null || Boolean.parseBoolean(value);
                default -> throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }

        if (teams == null || weeks == null) {
            throw new IllegalArgumentException("Missing required arguments: --teams, --weeks");
        }
        return new SearchConfig(teams, weeks, workers, breadth, output, cache, diversify, validate, verbose);
    }

    static String resumeCommand(SearchConfig config) {
        StringBuilder sb = new StringBuilder("java -jar schedule-search.jar")
            .append(" --teams=").append(config.teams())
            .append(" --weeks=").append(config.weeks())
            .append(" --workers=").append(config.workers())
            .append(" --breadth=").append(config.breadth())
            .append(" --output=").append(config.outputDir());
        if (config.cacheWeeks() != SearchConfig.DEFAULT_CACHE_WEEKS) {
            sb.append(" --cache=").append(config.cacheWeeks());
        }
        if (config.diversify()) {
            sb.append(" --diversify");
        }
        return sb.toString();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + name + ": " + value);
        }
    }

    private static void printSummary(RunSummary summary) {
        System.out.println();
        if (summary.resultFile() != null) {
            System.out.printf("Result file:      %s%s%n", summary.resultFile(), summary.partial() ? " (partial)" : "");
        } else {
            System.out.printf("Validate run:     nothing written%s%n", summary.partial() ? " (partial)" : "");
        }
        System.out.printf("Optimal paths:    %,d (%,d new)%n", summary.count(), summary.newPaths());
        System.out.printf("Fairness rounds:  %d%n", summary.fairnessRounds());
        ContinuationStats stats = summary.continuations();
        if (stats.inputPaths() > 0) {
            System.out.printf("Per input path:   min %,d, max %,d, avg %.1f over %,d paths (%,d completed)%n",
                stats.min(), stats.max(), stats.average(), stats.inputPaths(), summary.completedInputPaths());
        }
        double seconds = summary.elapsedMillis() / 1000.0;
        System.out.printf("Elapsed:          %s (%.0f new paths/s)%n",
            ConsoleProgress.formatDuration(summary.elapsedMillis()),
            seconds == 0 ? 0.0 : summary.newPaths() / seconds);
    }

    private static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger("edu.brandeis.cosi103a.schedule");
        if (root instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(Level.DEBUG);
        }
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar schedule-search.jar --teams <n> --weeks <n> [options]");
        System.err.println();
        System.err.println("Options:");
        System.err.println("  --teams <n>        Number of teams, even, 4 to 16 (required)");
        System.err.println("  --weeks <n>        Number of weeks to schedule (required)");
        System.err.println("  --workers <n>      Search worker threads (default: cores - 2)");
        System.err.println("  --breadth <n>      New results per input path per round, 0 = unlimited (default: 32)");
        System.err.println("  --output <dir>     Result directory (default: results)");
        System.err.println("  --cache <n>        Week schedules cached per worker, 0 disables (default: 200000)");
        System.err.println("  --diversify        Rotate candidate order per input path");
        System.err.println("  --validate         Search without reading or writing files");
        System.err.println("  --verbose          Debug logging");
        System.err.println("  --help             Show this help");
        System.err.println();
        System.err.println("Flags also accept --flag=value.");
        System.err.println();
        System.err.println("Example:");
        System.err.println("  java -jar schedule-search.jar --teams=8 --weeks=3 --breadth=100");
    }
}
