package edu.brandeis.cosi103a.schedule.search;

import com.google.common.base.Preconditions;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hashing;
import edu.brandeis.cosi103a.schedule.model.League;
import edu.brandeis.cosi103a.schedule.model.SchedulePath;
import edu.brandeis.cosi103a.schedule.model.WeekSchedule;
import edu.brandeis.cosi103a.schedule.model.WeekScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Extends input paths week by week up to the target week count, keeping only weeks that
 * score {@link WeekScore#OPTIMAL}. Weeks are scored before recursing, so a branch dies as
 * soon as one of its weeks is not optimal.
 *
 * <p>The optimal weeks of each {@link Constraint} are computed once and kept in an LRU cache
 * weighted by the number of weeks stored. Not thread-safe: one instance per worker.
 */
public class PathSearch {

    private static final Logger logger = LoggerFactory.getLogger(PathSearch.class);

    private final League league;
    private final int targetWeeks;
    private final boolean diversify;
    private final WeekEnumerator enumerator;
    private final RoundTracker tracker;
    private final LoadingCache<Constraint, ImmutableList<WeekSchedule>> optimalWeeks;

    // Per-call state of explore()
    private long found;
    private long skipOffset;
    private int breadthLimit;
    private boolean breadthReached;
    private boolean cancelledSeen;
    private long seed;
    private Consumer<SchedulePath> sink;
    private BooleanSupplier cancelled;

    /**
     * @param cachedWeeks upper bound on week schedules held by the cache; 0 disables it
     * @param diversify   rotate the candidate order at each level
     */
    public PathSearch(League league, int targetWeeks, long cachedWeeks, boolean diversify) {
        Preconditions.checkArgument(targetWeeks >= 1, "targetWeeks must be positive, got %s", targetWeeks);
        Preconditions.checkArgument(cachedWeeks >= 0, "cachedWeeks must not be negative, got %s", cachedWeeks);
        this.league = league;
        this.targetWeeks = targetWeeks;
        this.diversify = diversify;
        this.enumerator = new WeekEnumerator(league);
        this.tracker = new RoundTracker(league);
        this.optimalWeeks = cachedWeeks == 0 ? null : CacheBuilder.newBuilder()
            .maximumWeight(cachedWeeks)
            .weigher((Constraint key, ImmutableList<WeekSchedule> weeks) -> weeks.size() + 1)
            .recordStats()
            .build(CacheLoader.from(this::computeOptimalWeeks));
    }

    public League league() {
        return league;
    }

    public int targetWeeks() {
        return targetWeeks;
    }

    /**
     * Generates week 0: every week with matchup 0 fixed in slot 0 that ties for the lowest
     * score seen.
     */
    public SeedResult seed() {
        List<WeekSchedule> best = new ArrayList<>();
        WeekScore[] bestScore = {null};
        long enumerated = enumerator.enumerate(Constraint.NONE, league.matchupOf(0, 1), slotIds -> {
            WeekScore score = WeekScore.of(league, slotIds);
            int cmp = bestScore[0] == null ? -1 : score.compareTo(bestScore[0]);
            if (cmp < 0) {
                bestScore[0] = score;
                best.clear();
            }
            if (cmp <= 0) {
                best.add(WeekSchedule.of(slotIds));
            }
            return true;
        });
        SeedResult result = new SeedResult(ImmutableList.copyOf(best), bestScore[0], enumerated);
        if (result.best() != null && !result.matchesOracle()) {
            logger.warn("Best week-0 score {} for {} teams differs from the expected optimum {}",
                result.best(), league.teams(), WeekScore.OPTIMAL);
        }
        logger.debug("Seed: {} weeks enumerated, {} with best score {}", enumerated, best.size(), result.best());
        return result;
    }

    /**
     * Explores the continuations of {@code start}.
     *
     * <p>Optimal continuations are counted in a fixed order; the first {@code skipOffset} are
     * dropped as already known and the search stops after {@code breadthLimit} new ones
     * (0 means no limit). The order depends only on {@code start}, so a later call with a
     * larger offset picks up where the previous one stopped.
     *
     * @param sink      receives each new full-length path
     * @param cancelled polled between candidates; once true the call returns unexhausted
     * @throws IllegalArgumentException if {@code start} is empty, already at full length, or
     *         breaks the round rules
     */
    public ExplorationResult explore(SchedulePath start, long skipOffset, int breadthLimit,
                                     Consumer<SchedulePath> sink, BooleanSupplier cancelled) {
        Preconditions.checkArgument(!start.isEmpty(), "start path is empty");
        Preconditions.checkArgument(start.size() < targetWeeks,
            "start path has %s weeks, target is %s", start.size(), targetWeeks);
        RoundState state = tracker.replay(start);

        this.found = 0;
        this.skipOffset = skipOffset;
        this.breadthLimit = breadthLimit;
        this.breadthReached = false;
        this.cancelledSeen = false;
        this.seed = start.fingerprint();
        this.sink = sink;
        this.cancelled = cancelled;
        try {
            extend(start, state);
        } finally {
            this.sink = null;
            this.cancelled = null;
        }
        long newResults = Math.max(0, found - skipOffset);
        return new ExplorationResult(found, newResults, !breadthReached && !cancelledSeen);
    }

    /** Optimal weeks for a constraint, from the cache when enabled. */
    public List<WeekSchedule> optimalWeeks(Constraint constraint) {
        return optimalWeeks == null ? computeOptimalWeeks(constraint) : optimalWeeks.getUnchecked(constraint);
    }

    public String cacheStats() {
        return optimalWeeks == null ? "disabled" : optimalWeeks.stats().toString();
    }

    private ImmutableList<WeekSchedule> computeOptimalWeeks(Constraint constraint) {
        ImmutableList.Builder<WeekSchedule> weeks = ImmutableList.builder();
        enumerator.enumerate(constraint, slotIds -> {
            if (WeekScore.OPTIMAL.equals(WeekScore.of(league, slotIds))) {
                weeks.add(WeekSchedule.of(slotIds));
            }
            return true;
        });
        return weeks.build();
    }

    private void extend(SchedulePath path, RoundState state) {
        if (path.size() == targetWeeks) {
            found++;
            if (found <= skipOffset) {
                return;
            }
            sink.accept(path);
            if (breadthLimit > 0 && found - skipOffset >= breadthLimit) {
                breadthReached = true;
            }
            return;
        }

        List<WeekSchedule> candidates = optimalWeeks(tracker.constraintFor(state));
        int n = candidates.size();
        if (n == 0) {
            return;
        }
        int offset = diversify ? rotation(path.size(), n) : 0;
        for (int i = 0; i < n; i++) {
            if (breadthReached || cancelledSeen) {
                return;
            }
            if (cancelled.getAsBoolean()) {
                cancelledSeen = true;
                return;
            }
            WeekSchedule week = candidates.get((offset + i) % n);
            extend(path.append(week), tracker.advance(state, week));
        }
    }

    private int rotation(int depth, int size) {
        int hash = Hashing.murmur3_32_fixed().newHasher()
            .putLong(seed)
            .putInt(depth)
            .hash()
            .asInt();
        return Math.floorMod(hash, size);
    }
}
