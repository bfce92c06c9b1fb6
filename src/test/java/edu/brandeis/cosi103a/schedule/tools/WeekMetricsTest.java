package edu.brandeis.cosi103a.schedule.tools;

import edu.brandeis.cosi103a.schedule.model.League;
import edu.brandeis.cosi103a.schedule.model.WeekSchedule;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WeekMetricsTest {

    // AvB AvC BvC AvD BvE CvF DvE DvF EvF
    private static final WeekSchedule WEEK = WeekSchedule.of(0, 1, 5, 2, 7, 11, 12, 13, 14);

    @Test
    void of_countsGapsPerTeam() {
        WeekMetrics metrics = WeekMetrics.of(League.of(6), WEEK);

        assertArrayEquals(new int[] {1, 0, 1, 1, 0, 1}, metrics.doubleHeaders());
        assertArrayEquals(new int[] {0, 0, 1, 1, 0, 0}, metrics.doubleByes());
        assertArrayEquals(new int[] {4, 5, 5, 5, 5, 4}, metrics.spans());
    }

    @Test
    void of_countsEarlyAndLateGames() {
        WeekMetrics metrics = WeekMetrics.of(League.of(6), WEEK);

        assertArrayEquals(new int[] {2, 1, 1, 0, 0, 0}, metrics.early());
        assertArrayEquals(new int[] {0, 0, 0, 1, 1, 2}, metrics.late());
    }

    @Test
    void of_flagsThirdGameAgainstOpponentsSecond() {
        // D's third game (slot 7, DvF) is F's second game
        WeekMetrics metrics = WeekMetrics.of(League.of(6), WEEK);

        assertArrayEquals(new int[] {0, 0, 0, 1, 0, 0}, metrics.thirdVsSecond());
    }
}
