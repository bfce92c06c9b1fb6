package edu.brandeis.cosi103a.schedule.search;

import edu.brandeis.cosi103a.schedule.model.MatchupSet;

/**
 * What the round structure demands of the next week.
 *
 * @param exclude  matchups that may not appear this week
 * @param required matchups that must appear somewhere in this week, in any slot
 */
public record Constraint(MatchupSet exclude, MatchupSet required) {

    public static final Constraint NONE = new Constraint(MatchupSet.EMPTY, MatchupSet.EMPTY);

    public boolean isSatisfiedBy(MatchupSet week) {
        return week.intersect(exclude).isEmpty() && week.containsAll(required);
    }
}
