package edu.brandeis.cosi103a.schedule.search;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.schedule.model.WeekSchedule;
import edu.brandeis.cosi103a.schedule.model.WeekScore;

/**
 * Week-0 schedules with the lowest score found, and whether that score matched
 * {@link WeekScore#OPTIMAL}.
 */
public record SeedResult(ImmutableList<WeekSchedule> weeks, WeekScore best, long enumerated) {

    public boolean matchesOracle() {
        return WeekScore.OPTIMAL.equals(best);
    }
}
