package edu.brandeis.cosi103a.schedule.search;

/**
 * Receives each week found by {@link WeekEnumerator}.
 */
@FunctionalInterface
public interface ScheduleVisitor {

    /**
     * @param slots matchup id per slot; the array is reused by the enumerator and must be
     *              copied if kept
     * @return {@code false} to stop the search
     */
    boolean visit(int[] slots);
}
