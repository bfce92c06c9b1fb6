package edu.brandeis.cosi103a.schedule.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WeekScheduleTest {

    private static final League SIX = League.of(6);

    // AvB AvC BvC AvD BvE CvF DvE DvF EvF
    private static final WeekSchedule OPTIMAL_WEEK = WeekSchedule.of(0, 1, 5, 2, 7, 11, 12, 13, 14);

    @Test
    void parse_readsCommaSeparatedIds() {
        WeekSchedule week = WeekSchedule.parse("0,1,5,2,7,11,12,13,14");
        assertEquals(OPTIMAL_WEEK, week);
        assertEquals("0,1,5,2,7,11,12,13,14", week.toLine());
    }

    @Test
    void parse_rejectsNonNumbers() {
        assertThrows(NumberFormatException.class, () -> WeekSchedule.parse("0,1,x"));
    }

    @Test
    void isValid_acceptsLegalWeek() {
        assertTrue(OPTIMAL_WEEK.isValid(SIX), () -> OPTIMAL_WEEK.violations(SIX).toString());
    }

    @Test
    void violations_reportsRepeatedMatchup() {
        WeekSchedule week = WeekSchedule.of(0, 0, 5, 2, 7, 11, 12, 13, 14);
        assertFalse(week.isValid(SIX));
        assertTrue(week.violations(SIX).stream().anyMatch(v -> v.contains("repeated")));
    }

    @Test
    void violations_reportsWrongSlotCount() {
        WeekSchedule week = WeekSchedule.of(0, 1, 5);
        assertEquals(1, week.violations(SIX).size());
    }

    @Test
    void violations_reportsSpanOverFive() {
        // A plays slots 0, 1 and 8
        WeekSchedule week = WeekSchedule.of(0, 2, 5, 9, 7, 11, 12, 14, 4);
        assertTrue(week.violations(SIX).stream().anyMatch(v -> v.contains("spans")));
    }

    @Test
    void slotsByTeam_listsSlotsInOrder() {
        int[][] slots = OPTIMAL_WEEK.slotsByTeam(SIX);
        assertArrayEquals(new int[] {0, 1, 3}, slots[0]);
        assertArrayEquals(new int[] {0, 2, 4}, slots[1]);
        assertArrayEquals(new int[] {5, 7, 8}, slots[5]);
    }

    @Test
    void describe_rendersTeamLetters() {
        assertEquals("AvB AvC BvC AvD BvE CvF DvE DvF EvF", OPTIMAL_WEEK.describe(SIX));
    }
}
