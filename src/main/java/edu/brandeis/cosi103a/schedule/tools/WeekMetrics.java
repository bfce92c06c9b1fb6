package edu.brandeis.cosi103a.schedule.tools;

import edu.brandeis.cosi103a.schedule.model.League;
import edu.brandeis.cosi103a.schedule.model.WeekSchedule;

/**
 * Per-team counts for one week, indexed by team.
 *
 * @param doubleHeaders  consecutive-slot games
 * @param doubleByes     gaps of exactly three slots between consecutive games
 * @param spans          last slot minus first slot plus one, 0 for teams that do not play
 * @param early          games in the first two slots
 * @param late           games in the last two slots
 * @param thirdVsSecond  1 when the team's third game is the opponent's second game
 */
public record WeekMetrics(
    int[] doubleHeaders,
    int[] doubleByes,
    int[] spans,
    int[] early,
    int[] late,
    int[] thirdVsSecond
) {

    public static WeekMetrics of(League league, WeekSchedule week) {
        int teams = league.teams();
        int slotCount = week.size();
        int[][] slots = week.slotsByTeam(league);
        int[] doubleHeaders = new int[teams];
        int[] doubleByes = new int[teams];
        int[] spans = new int[teams];
        int[] early = new int[teams];
        int[] late = new int[teams];
        int[] thirdVsSecond = new int[teams];

        for (int t = 0; t < teams; t++) {
            int[] ts = slots[t];
            for (int i = 0; i + 1 < ts.length; i++) {
                int gap = ts[i + 1] - ts[i];
                if (gap == 1) {
                    doubleHeaders[t]++;
                } else if (gap == 3) {
                    doubleByes[t]++;
                }
            }
            if (ts.length > 0) {
                spans[t] = ts[ts.length - 1] - ts[0] + 1;
            }
            if (ts.length >= 3) {
                int third = ts[2];
                int m = week.matchup(third);
                int opponent = league.firstTeam(m) == t ? league.secondTeam(m) : league.firstTeam(m);
                if (slots[opponent].length >= 2 && slots[opponent][1] == third) {
                    thirdVsSecond[t] = 1;
                }
            }
        }
        for (int s = 0; s < Math.min(2, slotCount); s++) {
            early[league.firstTeam(week.matchup(s))]++;
            early[league.secondTeam(week.matchup(s))]++;
        }
        for (int s = Math.max(0, slotCount - 2); s < slotCount; s++) {
            late[league.firstTeam(week.matchup(s))]++;
            late[league.secondTeam(week.matchup(s))]++;
        }
        return new WeekMetrics(doubleHeaders, doubleByes, spans, early, late, thirdVsSecond);
    }
}
