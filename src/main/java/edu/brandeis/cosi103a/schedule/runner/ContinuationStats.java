package edu.brandeis.cosi103a.schedule.runner;

import com.fasterxml.jackson.annotation.JsonProperty;
import it.unimi.dsi.fastutil.longs.LongList;

/**
 * Continuations found per input path over a whole run.
 */
public record ContinuationStats(
    @JsonProperty("inputPaths") int inputPaths,
    @JsonProperty("min") long min,
    @JsonProperty("max") long max,
    @JsonProperty("average") double average
) {

    public static final ContinuationStats EMPTY = new ContinuationStats(0, 0, 0, 0.0);

    public static ContinuationStats of(LongList counts) {
        if (counts.isEmpty()) {
            return EMPTY;
        }
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        long total = 0;
        for (int i = 0; i < counts.size(); i++) {
            long c = counts.getLong(i);
            min = Math.min(min, c);
            max = Math.max(max, c);
            total += c;
        }
        return new ContinuationStats(counts.size(), min, max, (double) total / counts.size());
    }
}
