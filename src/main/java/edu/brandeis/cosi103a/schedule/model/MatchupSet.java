package edu.brandeis.cosi103a.schedule.model;

import java.util.stream.IntStream;

/**
 * Immutable set of matchup ids in [0, 128), stored as two 64-bit words.
 *
 * <p>Value semantics make it usable as a cache key.
 */
public record MatchupSet(long low, long high) {

    public static final MatchupSet EMPTY = new MatchupSet(0L, 0L);

    /** Set of every id in [0, size). */
    public static MatchupSet range(int size) {
        if (size < 0 || size > 128) {
            throw new IllegalArgumentException("Range size must be in [0, 128], got " + size);
        }
        long low = size >= 64 ? -1L : (1L << size) - 1;
        long high = size <= 64 ? 0L : (size == 128 ? -1L : (1L << (size - 64)) - 1);
        return new MatchupSet(low, high);
    }

    public static MatchupSet of(int... ids) {
        MatchupSet set = EMPTY;
        for (int id : ids) {
            set = set.with(id);
        }
        return set;
    }

    public boolean contains(int id) {
        return id < 64 ? (low & (1L << id)) != 0 : (high & (1L << (id - 64))) != 0;
    }

    public MatchupSet with(int id) {
        checkId(id);
        return id < 64 ? new MatchupSet(low | (1L << id), high) : new MatchupSet(low, high | (1L << (id - 64)));
    }

    public MatchupSet union(MatchupSet other) {
        return new MatchupSet(low | other.low, high | other.high);
    }

    public MatchupSet intersect(MatchupSet other) {
        return new MatchupSet(low & other.low, high & other.high);
    }

    public MatchupSet minus(MatchupSet other) {
        return new MatchupSet(low & ~other.low, high & ~other.high);
    }

    public boolean containsAll(MatchupSet other) {
        return (other.low & ~low) == 0 && (other.high & ~high) == 0;
    }

    public int size() {
        return Long.bitCount(low) + Long.bitCount(high);
    }

    public boolean isEmpty() {
        return low == 0 && high == 0;
    }

    /** Ids in ascending order. */
    public IntStream stream() {
        return IntStream.range(0, 128).filter(this::contains);
    }

    public int[] toArray() {
        return stream().toArray();
    }

    private static void checkId(int id) {
        if (id < 0 || id >= 128) {
            throw new IllegalArgumentException("Matchup id out of range: " + id);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        stream().forEach(id -> {
            if (sb.length() > 1) {
                sb.append(',');
            }
            sb.append(id);
        });
        return sb.append('}').toString();
    }
}
