package edu.brandeis.cosi103a.schedule.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One week: the matchup id played in each slot, in slot order.
 *
 * <p>Instances are immutable. Structural checks against a {@link League} are done by
 * {@link #violations(League)}; construction only copies the ids.
 */
public final class WeekSchedule {

    private final int[] matchups;

    private WeekSchedule(int[] matchups) {
        this.matchups = matchups;
    }

    public static WeekSchedule of(int... matchups) {
        return new WeekSchedule(matchups.clone());
    }

    /**
     * Parses the comma-separated form used by result files.
     *
     * @throws NumberFormatException if any token is not an integer
     */
    public static WeekSchedule parse(String line) {
        String[] parts = line.split(",", -1);
        int[] ids = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            ids[i] = Integer.parseInt(parts[i].trim());
        }
        return new WeekSchedule(ids);
    }

    public int size() {
        return matchups.length;
    }

    public int matchup(int slot) {
        return matchups[slot];
    }

    public int[] toArray() {
        return matchups.clone();
    }

    public MatchupSet matchupSet() {
        MatchupSet set = MatchupSet.EMPTY;
        for (int m : matchups) {
            set = set.with(m);
        }
        return set;
    }

    /**
     * Slots each team plays in, ascending. Teams absent from the week get an empty array.
     */
    public int[][] slotsByTeam(League league) {
        int[] counts = new int[league.teams()];
        for (int m : matchups) {
            counts[league.firstTeam(m)]++;
            counts[league.secondTeam(m)]++;
        }
        int[][] slots = new int[league.teams()][];
        for (int t = 0; t < slots.length; t++) {
            slots[t] = new int[counts[t]];
            counts[t] = 0;
        }
        for (int s = 0; s < matchups.length; s++) {
            int a = league.firstTeam(matchups[s]);
            int b = league.secondTeam(matchups[s]);
            slots[a][counts[a]++] = s;
            slots[b][counts[b]++] = s;
        }
        return slots;
    }

    /**
     * Lists every way this week breaks the week invariants: slot count, matchup range,
     * repeated matchups, games per team and span per team. Empty when valid.
     */
    public List<String> violations(League league) {
        List<String> problems = new ArrayList<>();
        if (matchups.length != league.slots()) {
            problems.add("expected " + league.slots() + " slots, got " + matchups.length);
            return problems;
        }
        for (int m : matchups) {
            if (m < 0 || m >= league.matchups()) {
                problems.add("matchup id " + m + " out of range");
                return problems;
            }
        }
        MatchupSet seen = MatchupSet.EMPTY;
        for (int m : matchups) {
            if (seen.contains(m)) {
                problems.add("matchup " + league.describe(m) + " repeated");
            }
            seen = seen.with(m);
        }
        int[][] slots = slotsByTeam(league);
        for (int t = 0; t < slots.length; t++) {
            int[] ts = slots[t];
            if (ts.length != League.GAMES_PER_TEAM) {
                problems.add("team " + League.teamLetter(t) + " plays " + ts.length + " games");
            } else if (ts[2] - ts[0] + 1 > League.MAX_SPAN) {
                problems.add("team " + League.teamLetter(t) + " spans " + (ts[2] - ts[0] + 1) + " slots");
            }
        }
        return problems;
    }

    public boolean isValid(League league) {
        return violations(league).isEmpty();
    }

    /** Comma-separated ids, the body format of result files. */
    public String toLine() {
        StringBuilder sb = new StringBuilder(matchups.length * 3);
        for (int i = 0; i < matchups.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(matchups[i]);
        }
        return sb.toString();
    }

    /** Human form, e.g. {@code AvB CvD ...}. */
    public String describe(League league) {
        StringBuilder sb = new StringBuilder();
        for (int m : matchups) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(league.describe(m));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof WeekSchedule other && Arrays.equals(matchups, other.matchups);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(matchups);
    }

    @Override
    public String toString() {
        return "[" + toLine() + "]";
    }
}
