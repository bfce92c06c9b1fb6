package edu.brandeis.cosi103a.schedule.runner;

import edu.brandeis.cosi103a.schedule.model.SchedulePath;
import edu.brandeis.cosi103a.schedule.tree.BranchIndex;
import edu.brandeis.cosi103a.schedule.tree.BranchMarker;
import edu.brandeis.cosi103a.schedule.tree.BranchStatus;
import edu.brandeis.cosi103a.schedule.tree.TreeFormatException;
import edu.brandeis.cosi103a.schedule.tree.TreeReader;
import it.unimi.dsi.fastutil.longs.Long2LongOpenHashMap;

import java.io.IOException;
import java.nio.file.Path;

/**
 * What a partial result file already knows about each input path. Input paths the file
 * never mentions are explored from scratch. Stored paths dropped while copying the file
 * forward are taken off their branch, which is then treated as unfinished.
 */
public class ResumePlan {

    private final BranchIndex index;
    private final long storedPaths;
    private final int inputWeeks;
    private final Long2LongOpenHashMap discarded = new Long2LongOpenHashMap();

    private ResumePlan(BranchIndex index, long storedPaths, int inputWeeks) {
        this.index = index;
        this.storedPaths = storedPaths;
        this.inputWeeks = inputWeeks;
    }

    public static ResumePlan fresh() {
        return new ResumePlan(null, 0, 0);
    }

    /**
     * Indexes the partial file {@code target} whose input paths have {@code inputWeeks} weeks.
     *
     * @throws TreeFormatException if the file belongs to a different league or week count
     */
    public static ResumePlan load(Path target, int teams, int weeks, int inputWeeks) throws IOException {
        try (TreeReader reader = TreeReader.open(target)) {
            if (reader.header().teams() != teams || reader.header().weeks() != weeks) {
                throw new TreeFormatException(target + " holds " + reader.header().teams() + " teams, "
                    + reader.header().weeks() + " weeks; expected " + teams + " teams, " + weeks + " weeks");
            }
            BranchIndex index = reader.branchIndex(inputWeeks - 1);
            return new ResumePlan(index, reader.header().count(), inputWeeks);
        }
    }

    public boolean isResume() {
        return index != null;
    }

    /** Count recorded in the partial file's header. */
    public long storedPaths() {
        return storedPaths;
    }

    /** Status of {@code input} in the partial file, or {@code null} if never attempted. */
    public BranchStatus statusOf(SchedulePath input) {
        if (index == null) {
            return null;
        }
        BranchStatus status = index.get(input);
        long dropped = discarded.get(input.fingerprint());
        if (status == null || dropped == 0) {
            return status;
        }
        return new BranchStatus(Math.max(0, status.leaves() - dropped), BranchMarker.INCOMPLETE, false);
    }

    /** Takes one stored path off the branch of its input path. */
    public void discard(SchedulePath stored) {
        discarded.addTo(stored.prefix(inputWeeks).fingerprint(), 1);
    }

    /** Whether a stored path below {@code branch} has been discarded. */
    public boolean hasDiscarded(SchedulePath branch) {
        return discarded.containsKey(branch.fingerprint());
    }

    public int knownBranches() {
        return index == null ? 0 : index.size();
    }

    public long completeBranches() {
        return index == null ? 0 : index.completeCount();
    }
}
