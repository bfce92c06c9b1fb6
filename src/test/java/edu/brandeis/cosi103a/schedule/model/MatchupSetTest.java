package edu.brandeis.cosi103a.schedule.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatchupSetTest {

    @Test
    void with_handlesIdsInBothWords() {
        MatchupSet set = MatchupSet.EMPTY.with(3).with(64).with(119);
        assertTrue(set.contains(3));
        assertTrue(set.contains(64));
        assertTrue(set.contains(119));
        assertFalse(set.contains(63));
        assertEquals(3, set.size());
    }

    @Test
    void range_coversExactlyTheFirstIds() {
        MatchupSet range = MatchupSet.range(70);
        assertEquals(70, range.size());
        assertTrue(range.contains(69));
        assertFalse(range.contains(70));
    }

    @Test
    void minus_andIntersect_areSetOperations() {
        MatchupSet a = MatchupSet.of(1, 2, 3, 100);
        MatchupSet b = MatchupSet.of(2, 100, 101);
        assertEquals(MatchupSet.of(1, 3), a.minus(b));
        assertEquals(MatchupSet.of(2, 100), a.intersect(b));
        assertEquals(MatchupSet.of(1, 2, 3, 100, 101), a.union(b));
        assertTrue(a.containsAll(MatchupSet.of(1, 100)));
        assertFalse(a.containsAll(b));
    }

    @Test
    void toArray_isAscending() {
        assertArrayEquals(new int[] {0, 5, 64, 90}, MatchupSet.of(90, 5, 64, 0).toArray());
    }
}
