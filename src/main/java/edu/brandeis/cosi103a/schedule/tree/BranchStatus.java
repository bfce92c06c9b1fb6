package edu.brandeis.cosi103a.schedule.tree;

/**
 * What a partial result file records about one input path, summed over every place the
 * path appears in the file.
 *
 * @param leaves       full-length paths stored below the branch
 * @param lastMarker   the last marker seen for the branch, or {@code null}
 * @param completeSeen whether any occurrence carried a complete marker
 */
public record BranchStatus(long leaves, BranchMarker lastMarker, boolean completeSeen) {

    public static final BranchStatus EMPTY = new BranchStatus(0, null, false);

    public boolean isComplete() {
        return completeSeen;
    }

    /** Cut off and never finished afterwards. */
    public boolean isIncomplete() {
        return !completeSeen && lastMarker == BranchMarker.INCOMPLETE;
    }

    BranchStatus withLeaf() {
        return new BranchStatus(leaves + 1, lastMarker, completeSeen);
    }

    BranchStatus withMarker(BranchMarker marker) {
        return new BranchStatus(leaves, marker, completeSeen || marker == BranchMarker.COMPLETE);
    }
}
