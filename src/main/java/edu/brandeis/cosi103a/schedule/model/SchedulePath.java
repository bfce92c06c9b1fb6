package edu.brandeis.cosi103a.schedule.model;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.util.List;

/**
 * A multi-week schedule: one {@link WeekSchedule} per week, week 0 first.
 */
public final class SchedulePath {

    private static final HashFunction FINGERPRINT = Hashing.murmur3_128();

    private static final SchedulePath EMPTY = new SchedulePath(ImmutableList.of());

    private final ImmutableList<WeekSchedule> weeks;

    private SchedulePath(ImmutableList<WeekSchedule> weeks) {
        this.weeks = weeks;
    }

    public static SchedulePath empty() {
        return EMPTY;
    }

    public static SchedulePath of(WeekSchedule... weeks) {
        return new SchedulePath(ImmutableList.copyOf(weeks));
    }

    public static SchedulePath of(List<WeekSchedule> weeks) {
        return new SchedulePath(ImmutableList.copyOf(weeks));
    }

    public ImmutableList<WeekSchedule> weeks() {
        return weeks;
    }

    public int size() {
        return weeks.size();
    }

    public boolean isEmpty() {
        return weeks.isEmpty();
    }

    public WeekSchedule week(int index) {
        return weeks.get(index);
    }

    public WeekSchedule lastWeek() {
        return weeks.get(weeks.size() - 1);
    }

    public SchedulePath append(WeekSchedule week) {
        return new SchedulePath(ImmutableList.<WeekSchedule>builderWithExpectedSize(weeks.size() + 1)
            .addAll(weeks)
            .add(week)
            .build());
    }

    /** The first {@code length} weeks. */
    public SchedulePath prefix(int length) {
        if (length == weeks.size()) {
            return this;
        }
        return new SchedulePath(weeks.subList(0, length));
    }

    /** Number of leading weeks equal in both paths. */
    public int commonPrefixLength(SchedulePath other) {
        int limit = Math.min(weeks.size(), other.weeks.size());
        int depth = 0;
        while (depth < limit && weeks.get(depth).equals(other.weeks.get(depth))) {
            depth++;
        }
        return depth;
    }

    public boolean startsWith(SchedulePath prefix) {
        return prefix.size() <= size() && commonPrefixLength(prefix) == prefix.size();
    }

    /**
     * 64-bit Murmur3 fingerprint of the matchup ids, stable across runs. Used for dedup and
     * as the diversification seed of an input path.
     */
    public long fingerprint() {
        Hasher hasher = FINGERPRINT.newHasher();
        for (WeekSchedule week : weeks) {
            hasher.putInt(week.size());
            for (int slot = 0; slot < week.size(); slot++) {
                hasher.putInt(week.matchup(slot));
            }
        }
        return hasher.hash().asLong();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SchedulePath other && weeks.equals(other.weeks);
    }

    @Override
    public int hashCode() {
        return weeks.hashCode();
    }

    @Override
    public String toString() {
        return weeks.toString();
    }
}
