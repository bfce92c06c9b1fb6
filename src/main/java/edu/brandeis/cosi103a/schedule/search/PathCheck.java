package edu.brandeis.cosi103a.schedule.search;

import edu.brandeis.cosi103a.schedule.model.League;
import edu.brandeis.cosi103a.schedule.model.SchedulePath;
import edu.brandeis.cosi103a.schedule.model.WeekSchedule;
import edu.brandeis.cosi103a.schedule.model.WeekScore;

import java.util.List;

/**
 * Checks a stored path against the rules the search applies while building one: every
 * week legal and optimal, and the round rules replayed from week 0.
 */
public final class PathCheck {

    private PathCheck() {}

    /** First problem with {@code path}, or {@code null} if it is valid. */
    public static String firstProblem(League league, RoundTracker tracker, SchedulePath path) {
        for (int w = 0; w < path.size(); w++) {
            WeekSchedule week = path.week(w);
            List<String> violations = week.violations(league);
            if (!violations.isEmpty()) {
                return "week " + (w + 1) + ": " + String.join(", ", violations);
            }
            WeekScore score = WeekScore.of(league, week);
            if (!WeekScore.OPTIMAL.equals(score)) {
                return "week " + (w + 1) + " scores " + score + ", expected " + WeekScore.OPTIMAL;
            }
        }
        try {
            tracker.replay(path);
        } catch (IllegalArgumentException e) {
            return e.getMessage();
        }
        return null;
    }
}
