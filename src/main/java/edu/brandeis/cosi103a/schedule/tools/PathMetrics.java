package edu.brandeis.cosi103a.schedule.tools;

import edu.brandeis.cosi103a.schedule.model.League;
import edu.brandeis.cosi103a.schedule.model.SchedulePath;
import edu.brandeis.cosi103a.schedule.model.WeekSchedule;

import java.util.List;
import java.util.function.Function;

/**
 * Week metrics of one path, summed per team on demand.
 */
public final class PathMetrics {

    private final League league;
    private final SchedulePath path;
    private final List<WeekMetrics> weeks;

    public PathMetrics(League league, SchedulePath path, List<WeekMetrics> weeks) {
        this.league = league;
        this.path = path;
        this.weeks = weeks;
    }

    public League league() {
        return league;
    }

    public SchedulePath path() {
        return path;
    }

    /** Sums one per-team counter over every week. */
    public int[] perTeam(Function<WeekMetrics, int[]> counter) {
        int[] totals = new int[league.teams()];
        for (WeekMetrics week : weeks) {
            int[] counts = counter.apply(week);
            for (int t = 0; t < totals.length; t++) {
                totals[t] += counts[t];
            }
        }
        return totals;
    }

    /** Games played between each pair of teams over the whole path. */
    public int[][] opponentCounts() {
        int teams = league.teams();
        int[][] counts = new int[teams][teams];
        for (WeekSchedule week : path.weeks()) {
            for (int slot = 0; slot < week.size(); slot++) {
                int m = week.matchup(slot);
                int a = league.firstTeam(m);
                int b = league.secondTeam(m);
                counts[a][b]++;
                counts[b][a]++;
            }
        }
        return counts;
    }

    static int sum(int[] values) {
        int total = 0;
        for (int v : values) {
            total += v;
        }
        return total;
    }

    /** Population standard deviation. */
    static double stddev(int[] values) {
        if (values.length == 0) {
            return 0;
        }
        double mean = (double) sum(values) / values.length;
        double squares = 0;
        for (int v : values) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / values.length);
    }

    static String byTeam(int[] values) {
        StringBuilder sb = new StringBuilder();
        for (int t = 0; t < values.length; t++) {
            if (t > 0) {
                sb.append(' ');
            }
            sb.append(League.teamLetter(t)).append(':').append(values[t]);
        }
        return sb.toString();
    }
}
