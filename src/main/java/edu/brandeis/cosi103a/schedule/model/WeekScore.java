package edu.brandeis.cosi103a.schedule.model;

/**
 * Pain score of a week or a whole path: double-byes (consecutive games of one team three
 * slots apart) and teams whose three games span exactly five slots. Lower is better,
 * compared double-byes first.
 */
public record WeekScore(int doubleByes, int fiveSlotSpanTeams) implements Comparable<WeekScore> {

    /**
     * Best per-week score for every supported team count. Observed by exhaustive
     * enumeration rather than derived; {@code PathSearch.seed} reports a mismatch.
     */
    public static final WeekScore OPTIMAL = new WeekScore(2, 4);

    public static final WeekScore ZERO = new WeekScore(0, 0);

    public static WeekScore of(League league, WeekSchedule week) {
        return of(league, week.toArray());
    }

    /**
     * Scores raw slot ids. Teams that do not play exactly three games are ignored.
     */
    public static WeekScore of(League league, int[] slots) {
        int teams = league.teams();
        int[] first = new int[teams];
        int[] previous = new int[teams];
        int[] games = new int[teams];
        int[] byes = new int[teams];
        for (int s = 0; s < slots.length; s++) {
            int m = slots[s];
            countGame(league.firstTeam(m), s, first, previous, games, byes);
            countGame(league.secondTeam(m), s, first, previous, games, byes);
        }
        int doubleByes = 0;
        int fiveSpan = 0;
        for (int t = 0; t < teams; t++) {
            if (games[t] != League.GAMES_PER_TEAM) {
                continue;
            }
            doubleByes += byes[t];
            if (previous[t] - first[t] + 1 == 5) {
                fiveSpan++;
            }
        }
        return new WeekScore(doubleByes, fiveSpan);
    }

    private static void countGame(int team, int slot, int[] first, int[] previous, int[] games, int[] byes) {
        if (games[team] == 0) {
            first[team] = slot;
        } else if (slot - previous[team] == 3) {
            byes[team]++;
        }
        previous[team] = slot;
        games[team]++;
    }

    /** Sum of the week scores of a path. */
    public static WeekScore of(League league, SchedulePath path) {
        WeekScore total = ZERO;
        for (WeekSchedule week : path.weeks()) {
            total = total.plus(of(league, week));
        }
        return total;
    }

    public WeekScore plus(WeekScore other) {
        return new WeekScore(doubleByes + other.doubleByes, fiveSlotSpanTeams + other.fiveSlotSpanTeams);
    }

    public WeekScore times(int weeks) {
        return new WeekScore(doubleByes * weeks, fiveSlotSpanTeams * weeks);
    }

    @Override
    public int compareTo(WeekScore other) {
        int cmp = Integer.compare(doubleByes, other.doubleByes);
        return cmp != 0 ? cmp : Integer.compare(fiveSlotSpanTeams, other.fiveSlotSpanTeams);
    }

    @Override
    public String toString() {
        return "(" + doubleByes + "," + fiveSlotSpanTeams + ")";
    }
}
