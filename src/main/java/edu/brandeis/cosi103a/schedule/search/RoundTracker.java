package edu.brandeis.cosi103a.schedule.search;

import edu.brandeis.cosi103a.schedule.model.League;
import edu.brandeis.cosi103a.schedule.model.MatchupSet;
import edu.brandeis.cosi103a.schedule.model.SchedulePath;
import edu.brandeis.cosi103a.schedule.model.WeekSchedule;

/**
 * Derives the per-week {@link Constraint} from a {@link RoundState} and folds chosen weeks
 * back into the state.
 *
 * <p>When the unused part of the current round fits into one week it becomes
 * {@code required}; when the whole week fits into the current round the used part becomes
 * {@code exclude}. A week that straddles a round boundary is split by membership in
 * {@code required}: those matchups finish the current round, the rest open the next one,
 * wherever they sit in the week.
 */
public class RoundTracker {

    private final League league;
    private final MatchupSet allMatchups;

    public RoundTracker(League league) {
        this.league = league;
        this.allMatchups = league.allMatchups();
    }

    public RoundState initial() {
        return RoundState.INITIAL;
    }

    public int remaining(RoundState state) {
        return league.matchups() - state.used().size();
    }

    public Constraint constraintFor(RoundState state) {
        int remaining = remaining(state);
        int slots = league.slots();
        MatchupSet required = remaining > 0 && remaining <= slots
            ? allMatchups.minus(state.used())
            : MatchupSet.EMPTY;
        MatchupSet exclude = remaining >= slots ? state.used() : MatchupSet.EMPTY;
        return new Constraint(exclude, required);
    }

    /**
     * Records {@code week} on top of {@code state}.
     *
     * @throws IllegalArgumentException if the week repeats a matchup, replays a matchup of
     *         the current round while fitting inside it, or leaves out a matchup the round
     *         needed to finish
     */
    public RoundState advance(RoundState state, WeekSchedule week) {
        MatchupSet played = week.matchupSet();
        if (played.size() != week.size()) {
            throw new IllegalArgumentException("Week repeats a matchup: " + week);
        }
        int remaining = remaining(state);
        if (remaining >= week.size()) {
            MatchupSet reused = played.intersect(state.used());
            if (!reused.isEmpty()) {
                throw new IllegalArgumentException(
                    "Week reuses matchups " + reused + " of round " + state.currentRound());
            }
            MatchupSet used = state.used().union(played);
            if (used.size() == league.matchups()) {
                return new RoundState(state.currentRound() + 1, MatchupSet.EMPTY);
            }
            return new RoundState(state.currentRound(), used);
        }

        MatchupSet required = allMatchups.minus(state.used());
        if (!played.containsAll(required)) {
            throw new IllegalArgumentException("Week misses matchups " + required.minus(played)
                + " needed to finish round " + state.currentRound());
        }
        return new RoundState(state.currentRound() + 1, played.minus(required));
    }

    /** Rebuilds the state of a stored path from round 0. */
    public RoundState replay(SchedulePath path) {
        RoundState state = initial();
        for (WeekSchedule week : path.weeks()) {
            state = advance(state, week);
        }
        return state;
    }
}
