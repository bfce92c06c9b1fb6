package edu.brandeis.cosi103a.schedule.search;

import edu.brandeis.cosi103a.schedule.model.League;
import edu.brandeis.cosi103a.schedule.model.MatchupSet;
import edu.brandeis.cosi103a.schedule.model.SchedulePath;
import edu.brandeis.cosi103a.schedule.model.WeekSchedule;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RoundTrackerTest {

    private static final League SIX = League.of(6);

    // Round 0 uses 9 of the 15 matchups.
    private static final WeekSchedule WEEK_0 = WeekSchedule.of(0, 1, 5, 2, 7, 11, 12, 13, 14);
    // Finishes round 0 with 3,4,6,8,9,10 and opens round 1 with 0, 11 and 12.
    private static final WeekSchedule WEEK_1 = WeekSchedule.of(0, 4, 8, 3, 6, 11, 12, 10, 9);

    private final RoundTracker tracker = new RoundTracker(SIX);

    @Test
    void constraintFor_initialState_isUnconstrained() {
        assertEquals(Constraint.NONE, tracker.constraintFor(tracker.initial()));
    }

    @Test
    void constraintFor_fewRemaining_requiresTheRestOfTheRound() {
        RoundState state = tracker.advance(tracker.initial(), WEEK_0);

        Constraint constraint = tracker.constraintFor(state);

        assertEquals(MatchupSet.of(3, 4, 6, 8, 9, 10), constraint.required());
        assertEquals(MatchupSet.EMPTY, constraint.exclude());
    }

    @Test
    void advance_straddlingWeek_splitsByMembershipInRequired() {
        RoundState state = tracker.advance(tracker.advance(tracker.initial(), WEEK_0), WEEK_1);

        assertEquals(1, state.currentRound());
        assertEquals(MatchupSet.of(0, 11, 12), state.used());
        assertEquals(new Constraint(MatchupSet.of(0, 11, 12), MatchupSet.EMPTY), tracker.constraintFor(state));
    }

    @Test
    void usedIn_reportsFinishedCurrentAndFutureRounds() {
        RoundState state = tracker.replay(SchedulePath.of(WEEK_0, WEEK_1));

        assertEquals(SIX.allMatchups(), state.usedIn(0, SIX.allMatchups()));
        assertEquals(MatchupSet.of(0, 11, 12), state.usedIn(1, SIX.allMatchups()));
        assertEquals(MatchupSet.EMPTY, state.usedIn(2, SIX.allMatchups()));
    }

    @Test
    void replay_matchesStepwiseAdvance() {
        RoundState stepwise = tracker.initial();
        for (WeekSchedule week : new WeekSchedule[] {WEEK_0, WEEK_1}) {
            stepwise = tracker.advance(stepwise, week);
        }
        assertEquals(stepwise, tracker.replay(SchedulePath.of(WEEK_0, WEEK_1)));
    }

    @Test
    void replay_everyRoundBeforeCurrentIsComplete() {
        PathSearch search = new PathSearch(SIX, 3, 0, false);
        SchedulePath start = SchedulePath.of(WEEK_0);
        search.explore(start, 0, 20, path -> {
            RoundState state = tracker.replay(path);
            int total = path.size() * SIX.slots();
            assertEquals(total / SIX.matchups(), state.currentRound());
            assertEquals(total % SIX.matchups(), state.used().size());
        }, () -> false);
    }

    @Test
    void advance_rejectsMissingRequiredMatchup() {
        RoundState state = tracker.advance(tracker.initial(), WEEK_0);
        assertThrows(IllegalArgumentException.class, () -> tracker.advance(state, WEEK_0));
    }

    @Test
    void advance_rejectsReuseInsideRound() {
        RoundState state = tracker.replay(SchedulePath.of(WEEK_0, WEEK_1));
        assertThrows(IllegalArgumentException.class, () -> tracker.advance(state, WEEK_0));
    }

    @Test
    void advance_rejectsRepeatedMatchupInWeek() {
        WeekSchedule repeated = WeekSchedule.of(0, 0, 5, 2, 7, 11, 12, 13, 14);
        assertThrows(IllegalArgumentException.class, () -> tracker.advance(tracker.initial(), repeated));
    }
}
