package edu.brandeis.cosi103a.schedule.search;

import edu.brandeis.cosi103a.schedule.model.MatchupSet;

/**
 * Round bookkeeping for a partial path. Every round before {@code currentRound} is complete;
 * {@code used} holds the matchups already played in the current round. At most the current
 * round and the one after it are ever open, so nothing else needs storing.
 */
public record RoundState(int currentRound, MatchupSet used) {

    public static final RoundState INITIAL = new RoundState(0, MatchupSet.EMPTY);

    /**
     * Matchups played in {@code round}: everything for a finished round, the used set for the
     * current round, nothing for later rounds.
     */
    public MatchupSet usedIn(int round, MatchupSet allMatchups) {
        if (round < currentRound) {
            return allMatchups;
        }
        return round == currentRound ? used : MatchupSet.EMPTY;
    }
}
