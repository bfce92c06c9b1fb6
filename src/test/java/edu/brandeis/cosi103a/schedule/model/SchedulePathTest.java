package edu.brandeis.cosi103a.schedule.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SchedulePathTest {

    private static final WeekSchedule W0 = WeekSchedule.of(0, 1, 5, 2, 7, 11, 12, 13, 14);
    private static final WeekSchedule W1 = WeekSchedule.of(0, 4, 8, 3, 6, 11, 12, 10, 9);

    @Test
    void append_leavesOriginalUntouched() {
        SchedulePath one = SchedulePath.of(W0);
        SchedulePath two = one.append(W1);
        assertEquals(1, one.size());
        assertEquals(2, two.size());
        assertEquals(W1, two.lastWeek());
    }

    @Test
    void commonPrefixLength_stopsAtFirstDifference() {
        SchedulePath a = SchedulePath.of(W0, W1, W0);
        SchedulePath b = SchedulePath.of(W0, W1, W1);
        assertEquals(2, a.commonPrefixLength(b));
        assertEquals(0, SchedulePath.of(W1).commonPrefixLength(a));
        assertTrue(a.startsWith(a.prefix(2)));
    }

    @Test
    void fingerprint_dependsOnWeekOrder() {
        SchedulePath a = SchedulePath.of(W0, W1);
        SchedulePath b = SchedulePath.of(W1, W0);
        assertEquals(a.fingerprint(), SchedulePath.of(W0, W1).fingerprint());
        assertNotEquals(a.fingerprint(), b.fingerprint());
    }
}
