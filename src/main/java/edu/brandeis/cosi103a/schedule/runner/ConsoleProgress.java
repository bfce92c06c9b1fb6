package edu.brandeis.cosi103a.schedule.runner;

import java.io.PrintStream;

/**
 * Prints one progress line to the console at most every {@code intervalMillis} while a search
 * runs, and always on state changes.
 */
public class ConsoleProgress implements ProgressListener {

    private final PrintStream out;
    private final long intervalMillis;
    private long lastPrinted = Long.MIN_VALUE;

    public ConsoleProgress(PrintStream out, long intervalMillis) {
        this.out = out;
        this.intervalMillis = intervalMillis;
    }

    @Override
    public void onProgress(SearchProgress progress) {
        if (progress.state() == SearchProgress.State.RUNNING
                && lastPrinted != Long.MIN_VALUE
                && progress.elapsedMillis() - lastPrinted < intervalMillis) {
            return;
        }
        lastPrinted = progress.elapsedMillis();
        out.printf("[%s] round %d | %d/%d input paths done | %,d paths | %s | %.0f paths/s%n",
            progress.state(), progress.fairnessRound(), progress.completedPaths(), progress.inputPaths(),
            progress.found(), formatDuration(progress.elapsedMillis()), progress.pathsPerSecond());
    }

    static String formatDuration(long millis) {
        long seconds = millis / 1000;
        if (seconds < 60) {
            return seconds + "s";
        }
        if (seconds < 3600) {
            return (seconds / 60) + "m " + (seconds % 60) + "s";
        }
        return (seconds / 3600) + "h " + (seconds % 3600 / 60) + "m";
    }
}
