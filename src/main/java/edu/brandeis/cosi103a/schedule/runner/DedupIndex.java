package edu.brandeis.cosi103a.schedule.runner;

import edu.brandeis.cosi103a.schedule.model.SchedulePath;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;

/**
 * Set of 64-bit path fingerprints seen during a run. Coordinator-owned, not thread-safe.
 */
public class DedupIndex {

    private final LongOpenHashSet seen = new LongOpenHashSet();

    /** Returns {@code true} if the path was not seen before. */
    public boolean add(SchedulePath path) {
        return seen.add(path.fingerprint());
    }

    public boolean contains(SchedulePath path) {
        return seen.contains(path.fingerprint());
    }

    public int size() {
        return seen.size();
    }
}
