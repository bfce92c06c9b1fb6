package edu.brandeis.cosi103a.schedule.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed per-league tables: matchup encoding, slot count and the slot patterns a team's
 * three weekly games may occupy.
 *
 * <p>Built once from the team count and shared read-only by every component. Matchup ids
 * follow lexicographic pair order (0v1, 0v2, ..., 1v2, ...). Patterns are numbered
 * shape-major: every start offset of the first shape, then the next shape, and so on.
 * Pattern masks are 128 bits wide, split into a low and a high {@code long}.
 */
public final class League {

    public static final int MIN_TEAMS = 4;
    public static final int MAX_TEAMS = 16;
    public static final int GAMES_PER_TEAM = 3;
    public static final int MAX_SPAN = 5;

    private static final String TEAM_LETTERS = "ABCDEFGHIJKLMNOP";

    // Offsets relative to a team's first game; the last offset is span - 1.
    private static final int[][] SHAPES = {
        {0, 1, 3}, {0, 2, 3},
        {0, 1, 4}, {0, 2, 4}, {0, 3, 4}
    };

    private final int teams;
    private final int slots;
    private final int matchups;
    private final int[] firstTeam;
    private final int[] secondTeam;
    private final int[] pairToMatchup;
    private final int[][] patterns;
    private final long[] slotMaskLow;
    private final long[] slotMaskHigh;
    private final long allPatternsLow;
    private final long allPatternsHigh;

    private League(int teams) {
        this.teams = teams;
        this.slots = teams * GAMES_PER_TEAM / 2;
        this.matchups = teams * (teams - 1) / 2;

        this.firstTeam = new int[matchups];
        this.secondTeam = new int[matchups];
        this.pairToMatchup = new int[teams * teams];
        int id = 0;
        for (int a = 0; a < teams - 1; a++) {
            for (int b = a + 1; b < teams; b++) {
                firstTeam[id] = a;
                secondTeam[id] = b;
                pairToMatchup[a * teams + b] = id;
                pairToMatchup[b * teams + a] = id;
                id++;
            }
        }

        List<int[]> built = new ArrayList<>();
        for (int[] shape : SHAPES) {
            int span = shape[2] + 1;
            for (int start = 0; start <= slots - span; start++) {
                built.add(new int[] {shape[0] + start, shape[1] + start, shape[2] + start});
            }
        }
        if (built.size() > 128) {
            throw new IllegalStateException("Pattern count " + built.size() + " exceeds 128-bit masks");
        }
        this.patterns = built.toArray(new int[0][]);

        this.slotMaskLow = new long[slots];
        this.slotMaskHigh = new long[slots];
        for (int p = 0; p < patterns.length; p++) {
            for (int slot : patterns[p]) {
                if (p < 64) {
                    slotMaskLow[slot] |= 1L << p;
                } else {
                    slotMaskHigh[slot] |= 1L << (p - 64);
                }
            }
        }
        int count = patterns.length;
        this.allPatternsLow = count >= 64 ? -1L : (1L << count) - 1;
        this.allPatternsHigh = count <= 64 ? 0L : (count == 128 ? -1L : (1L << (count - 64)) - 1);
    }

    /**
     * Builds the tables for a league of {@code teams} teams.
     *
     * @throws IllegalArgumentException if the team count is odd or outside [4, 16]
     */
    public static League of(int teams) {
        if (teams % 2 != 0) {
            throw new IllegalArgumentException("Team count must be even, got " + teams);
        }
        if (teams < MIN_TEAMS || teams > MAX_TEAMS) {
            throw new IllegalArgumentException(
                "Team count must be between " + MIN_TEAMS + " and " + MAX_TEAMS + ", got " + teams);
        }
        return new League(teams);
    }

    public int teams() {
        return teams;
    }

    /** Matchups played per week (3N/2). */
    public int slots() {
        return slots;
    }

    /** Matchups in one round (N(N-1)/2). */
    public int matchups() {
        return matchups;
    }

    public int patternCount() {
        return patterns.length;
    }

    public int encode(int teamA, int teamB) {
        if (teamA == teamB || teamA < 0 || teamB < 0 || teamA >= teams || teamB >= teams) {
            throw new IllegalArgumentException("Invalid team pair " + teamA + "," + teamB);
        }
        return pairToMatchup[teamA * teams + teamB];
    }

    /** Encode without argument checks, for the enumerator's inner loop. */
    public int matchupOf(int teamA, int teamB) {
        return pairToMatchup[teamA * teams + teamB];
    }

    /** Lower-numbered team of a matchup. */
    public int firstTeam(int matchup) {
        return firstTeam[matchup];
    }

    /** Higher-numbered team of a matchup. */
    public int secondTeam(int matchup) {
        return secondTeam[matchup];
    }

    public int[] decode(int matchup) {
        checkMatchup(matchup);
        return new int[] {firstTeam[matchup], secondTeam[matchup]};
    }

    public void checkMatchup(int matchup) {
        if (matchup < 0 || matchup >= matchups) {
            throw new IllegalArgumentException("Matchup id " + matchup + " outside [0, " + matchups + ")");
        }
    }

    public int[] pattern(int index) {
        return patterns[index].clone();
    }

    public long slotMaskLow(int slot) {
        return slotMaskLow[slot];
    }

    public long slotMaskHigh(int slot) {
        return slotMaskHigh[slot];
    }

    public long allPatternsLow() {
        return allPatternsLow;
    }

    public long allPatternsHigh() {
        return allPatternsHigh;
    }

    public MatchupSet allMatchups() {
        return MatchupSet.range(matchups);
    }

    public static char teamLetter(int team) {
        return TEAM_LETTERS.charAt(team);
    }

    /** Renders a matchup as {@code AvB}. */
    public String describe(int matchup) {
        checkMatchup(matchup);
        return teamLetter(firstTeam[matchup]) + "v" + teamLetter(secondTeam[matchup]);
    }

    @Override
    public String toString() {
        return "League[teams=" + teams + ", slots=" + slots + ", matchups=" + matchups
            + ", patterns=" + patterns.length + "]";
    }
}
