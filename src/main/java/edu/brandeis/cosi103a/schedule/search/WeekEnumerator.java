package edu.brandeis.cosi103a.schedule.search;

import edu.brandeis.cosi103a.schedule.model.League;
import edu.brandeis.cosi103a.schedule.model.MatchupSet;
import edu.brandeis.cosi103a.schedule.model.WeekSchedule;

import java.util.ArrayList;
import java.util.List;

/**
 * Backtracking search over the slots of one week.
 *
 * <p>Each slot takes a pair of teams that still have games left and whose remaining slot
 * patterns include the slot. Placing a game narrows both teams' pattern sets to patterns
 * through that slot; a branch is cut as soon as some team with games left has no pattern,
 * owes more required opponents than it has games, or the remaining games cannot fit the
 * remaining slots. All state is mutated in place and restored on the way back up.
 *
 * <p>Not thread-safe: each worker owns its own instance.
 */
public class WeekEnumerator {

    public static final int NO_FIXED_SLOT = -1;

    private final League league;
    private final int teams;
    private final int slots;

    private final int[] games;
    private final int[] counts;
    private final long[] maskLow;
    private final long[] maskHigh;
    private final int[] requiredOpponents;
    private final int[][] candidates;

    private long usedLow;
    private long usedHigh;
    private long excludeLow;
    private long excludeHigh;
    private ScheduleVisitor visitor;
    private boolean stopped;
    private long found;

    public WeekEnumerator(League league) {
        this.league = league;
        this.teams = league.teams();
        this.slots = league.slots();
        this.games = new int[slots];
        this.counts = new int[teams];
        this.maskLow = new long[teams];
        this.maskHigh = new long[teams];
        this.requiredOpponents = new int[teams];
        this.candidates = new int[slots][teams];
    }

    public League league() {
        return league;
    }

    /**
     * Runs a fresh search and hands every legal week to {@code visitor}.
     *
     * @param constraint       matchups to avoid and matchups that must appear
     * @param fixedFirstMatchup matchup forced into slot 0, or {@link #NO_FIXED_SLOT}
     * @param visitor          receives each week; returning {@code false} ends the search
     * @return number of weeks handed to the visitor
     */
    public long enumerate(Constraint constraint, int fixedFirstMatchup, ScheduleVisitor visitor) {
        reset(constraint, visitor);
        MatchupSet exclude = constraint.exclude();
        if (!constraint.required().intersect(exclude).isEmpty()) {
            return 0;
        }
        if (fixedFirstMatchup == NO_FIXED_SLOT) {
            backtrack(0);
            return found;
        }
        league.checkMatchup(fixedFirstMatchup);
        if (exclude.contains(fixedFirstMatchup)) {
            return 0;
        }
        int a = league.firstTeam(fixedFirstMatchup);
        int b = league.secondTeam(fixedFirstMatchup);
        games[0] = fixedFirstMatchup;
        markUsed(fixedFirstMatchup);
        counts[a] = 1;
        counts[b] = 1;
        maskLow[a] = league.slotMaskLow(0);
        maskHigh[a] = league.slotMaskHigh(0);
        maskLow[b] = league.slotMaskLow(0);
        maskHigh[b] = league.slotMaskHigh(0);
        requiredOpponents[a] &= ~(1 << b);
        requiredOpponents[b] &= ~(1 << a);
        if (feasible(0)) {
            backtrack(1);
        }
        return found;
    }

    public long enumerate(Constraint constraint, ScheduleVisitor visitor) {
        return enumerate(constraint, NO_FIXED_SLOT, visitor);
    }

    /** Collects every legal week for the constraint. */
    public List<WeekSchedule> enumerateAll(Constraint constraint) {
        return enumerateAll(constraint, NO_FIXED_SLOT);
    }

    public List<WeekSchedule> enumerateAll(Constraint constraint, int fixedFirstMatchup) {
        List<WeekSchedule> weeks = new ArrayList<>();
        enumerate(constraint, fixedFirstMatchup, slotIds -> {
            weeks.add(WeekSchedule.of(slotIds));
            return true;
        });
        return weeks;
    }

    private void reset(Constraint constraint, ScheduleVisitor visitor) {
        this.visitor = visitor;
        this.stopped = false;
        this.found = 0;
        this.usedLow = 0;
        this.usedHigh = 0;
        this.excludeLow = constraint.exclude().low();
        this.excludeHigh = constraint.exclude().high();
        for (int t = 0; t < teams; t++) {
            counts[t] = 0;
            maskLow[t] = league.allPatternsLow();
            maskHigh[t] = league.allPatternsHigh();
            requiredOpponents[t] = 0;
        }
        constraint.required().stream().forEach(m -> {
            int a = league.firstTeam(m);
            int b = league.secondTeam(m);
            requiredOpponents[a] |= 1 << b;
            requiredOpponents[b] |= 1 << a;
        });
    }

    private void markUsed(int matchup) {
        if (matchup < 64) {
            usedLow |= 1L << matchup;
        } else {
            usedHigh |= 1L << (matchup - 64);
        }
    }

    private void backtrack(int slot) {
        if (slot == slots) {
            for (int t = 0; t < teams; t++) {
                if (requiredOpponents[t] != 0) {
                    return;
                }
            }
            found++;
            if (!visitor.visit(games)) {
                stopped = true;
            }
            return;
        }

        long slotLow = league.slotMaskLow(slot);
        long slotHigh = league.slotMaskHigh(slot);
        int[] cand = candidates[slot];
        int n = 0;
        for (int t = 0; t < teams; t++) {
            if (counts[t] < League.GAMES_PER_TEAM && ((maskLow[t] & slotLow) | (maskHigh[t] & slotHigh)) != 0) {
                cand[n++] = t;
            }
        }

        for (int i = 0; i < n - 1; i++) {
            int t1 = cand[i];
            for (int j = i + 1; j < n; j++) {
                int t2 = cand[j];
                int m = league.matchupOf(t1, t2);
                long bitLow = m < 64 ? 1L << m : 0L;
                long bitHigh = m < 64 ? 0L : 1L << (m - 64);
                if ((((usedLow | excludeLow) & bitLow) | ((usedHigh | excludeHigh) & bitHigh)) != 0) {
                    continue;
                }

                games[slot] = m;
                usedLow |= bitLow;
                usedHigh |= bitHigh;
                counts[t1]++;
                counts[t2]++;
                long low1 = maskLow[t1];
                long high1 = maskHigh[t1];
                long low2 = maskLow[t2];
                long high2 = maskHigh[t2];
                maskLow[t1] = low1 & slotLow;
                maskHigh[t1] = high1 & slotHigh;
                maskLow[t2] = low2 & slotLow;
                maskHigh[t2] = high2 & slotHigh;
                int required1 = requiredOpponents[t1];
                int required2 = requiredOpponents[t2];
                requiredOpponents[t1] = required1 & ~(1 << t2);
                requiredOpponents[t2] = required2 & ~(1 << t1);

                if (feasible(slot)) {
                    backtrack(slot + 1);
                }

                requiredOpponents[t1] = required1;
                requiredOpponents[t2] = required2;
                maskLow[t1] = low1;
                maskHigh[t1] = high1;
                maskLow[t2] = low2;
                maskHigh[t2] = high2;
                counts[t1]--;
                counts[t2]--;
                usedLow &= ~bitLow;
                usedHigh &= ~bitHigh;

                if (stopped) {
                    return;
                }
            }
        }
    }

    /** Checks the state after filling {@code slot}. */
    private boolean feasible(int slot) {
        int needed = 0;
        for (int t = 0; t < teams; t++) {
            int left = League.GAMES_PER_TEAM - counts[t];
            if (left > 0 && maskLow[t] == 0 && maskHigh[t] == 0) {
                return false;
            }
            if (Integer.bitCount(requiredOpponents[t]) > left) {
                return false;
            }
            needed += left;
        }
        return needed / 2 <= slots - slot - 1;
    }
}
