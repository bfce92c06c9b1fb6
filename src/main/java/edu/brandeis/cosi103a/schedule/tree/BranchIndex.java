package edu.brandeis.cosi103a.schedule.tree;

import edu.brandeis.cosi103a.schedule.model.SchedulePath;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

import java.util.Collection;
import java.util.Collections;

/**
 * Branch statuses of a result file keyed by the fingerprint of the branch prefix.
 */
public class BranchIndex {

    private final Long2ObjectOpenHashMap<BranchStatus> statuses = new Long2ObjectOpenHashMap<>();
    private final int parentDepth;

    BranchIndex(int parentDepth) {
        this.parentDepth = parentDepth;
    }

    /** Depth of the last week of the indexed prefixes. */
    public int parentDepth() {
        return parentDepth;
    }

    /** Status of {@code prefix}, or {@code null} if the file never mentions it. */
    public BranchStatus get(SchedulePath prefix) {
        return statuses.get(prefix.fingerprint());
    }

    public int size() {
        return statuses.size();
    }

    public long completeCount() {
        return statuses.values().stream().filter(BranchStatus::isComplete).count();
    }

    public long incompleteCount() {
        return statuses.values().stream().filter(BranchStatus::isIncomplete).count();
    }

    public Collection<BranchStatus> statuses() {
        return Collections.unmodifiableCollection(statuses.values());
    }

    void update(long key, BranchStatus status) {
        statuses.put(key, status);
    }

    BranchStatus getOrEmpty(long key) {
        return statuses.getOrDefault(key, BranchStatus.EMPTY);
    }
}
