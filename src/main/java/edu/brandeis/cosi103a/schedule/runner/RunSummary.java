package edu.brandeis.cosi103a.schedule.runner;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a search run, also stored as the JSON sidecar of the result file.
 */
public record RunSummary(
    @JsonProperty("config") SearchConfig config,
    @JsonProperty("resultFile") String resultFile,
    @JsonProperty("sourceFile") String sourceFile,
    @JsonProperty("count") long count,
    @JsonProperty("newPaths") long newPaths,
    @JsonProperty("partial") boolean partial,
    @JsonProperty("interrupted") boolean interrupted,
    @JsonProperty("fairnessRounds") int fairnessRounds,
    @JsonProperty("completedInputPaths") int completedInputPaths,
    @JsonProperty("continuations") ContinuationStats continuations,
    @JsonProperty("elapsedMillis") long elapsedMillis
) {
}
