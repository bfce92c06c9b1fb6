package edu.brandeis.cosi103a.schedule.search;

/**
 * Outcome of one bounded exploration of an input path.
 *
 * @param totalFound optimal continuations seen, the skipped ones included
 * @param newResults continuations handed to the sink
 * @param exhausted  {@code true} when the subtree was searched to the end
 */
public record ExplorationResult(long totalFound, long newResults, boolean exhausted) {
}
