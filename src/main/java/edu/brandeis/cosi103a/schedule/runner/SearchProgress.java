package edu.brandeis.cosi103a.schedule.runner;

/**
 * Snapshot of a running search, handed to {@link ProgressListener}s.
 */
public record SearchProgress(
    State state,
    int fairnessRound,
    int inputPaths,
    int completedPaths,
    long found,
    long elapsedMillis
) {
    public enum State {
        STARTING,
        RUNNING,
        COMPLETED,
        INTERRUPTED,
        FAILED
    }

    public double pathsPerSecond() {
        return elapsedMillis == 0 ? 0.0 : found * 1000.0 / elapsedMillis;
    }
}
