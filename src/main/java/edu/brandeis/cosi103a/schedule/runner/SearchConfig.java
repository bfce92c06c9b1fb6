package edu.brandeis.cosi103a.schedule.runner;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.schedule.model.League;

import java.nio.file.Path;

/**
 * Settings of one search run, parsed from CLI args.
 */
public record SearchConfig(
    @JsonProperty("teams") int teams,
    @JsonProperty("weeks") int weeks,
    @JsonProperty("workers") int workers,
    @JsonProperty("breadth") int breadth,
    @JsonProperty("outputDir") String outputDir,
    @JsonProperty("cacheWeeks") long cacheWeeks,
    @JsonProperty("diversify") boolean diversify,
    @JsonProperty("validate") boolean validate,
    @JsonProperty("verbose") boolean verbose
) {

    public static final int DEFAULT_BREADTH = 32;
    public static final String DEFAULT_OUTPUT_DIR = "results";
    public static final long DEFAULT_CACHE_WEEKS = 200_000;

    /**
     * Defaults for everything but the league size: all but two cores, breadth 32, output
     * under {@code results}.
     */
    public static SearchConfig defaults(int teams, int weeks) {
        return new SearchConfig(teams, weeks, defaultWorkers(), DEFAULT_BREADTH, DEFAULT_OUTPUT_DIR,
            DEFAULT_CACHE_WEEKS, false, false, false);
    }

    public static int defaultWorkers() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 2);
    }

    public Path outputPath() {
        return Path.of(outputDir);
    }

    public SearchConfig withOutputDir(Path dir) {
        return new SearchConfig(teams, weeks, workers, breadth, dir.toString(), cacheWeeks, diversify, validate, verbose);
    }

    public SearchConfig withWeeks(int newWeeks) {
        return new SearchConfig(teams, newWeeks, workers, breadth, outputDir, cacheWeeks, diversify, validate, verbose);
    }

    /**
     * @throws ScheduleConfigurationException describing the first bad setting
     */
    public void requireValid() {
        if (teams % 2 != 0) {
            throw new ScheduleConfigurationException("Team count must be even, got " + teams);
        }
        if (teams < League.MIN_TEAMS || teams > League.MAX_TEAMS) {
            throw new ScheduleConfigurationException("Team count must be between " + League.MIN_TEAMS
                + " and " + League.MAX_TEAMS + ", got " + teams);
        }
        if (weeks < 1) {
            throw new ScheduleConfigurationException("Week count must be at least 1, got " + weeks);
        }
        if (workers < 1) {
            throw new ScheduleConfigurationException("Worker count must be at least 1, got " + workers);
        }
        if (breadth < 0) {
            throw new ScheduleConfigurationException("Breadth must not be negative, got " + breadth);
        }
        if (cacheWeeks < 0) {
            throw new ScheduleConfigurationException("Cache size must not be negative, got " + cacheWeeks);
        }
    }
}
