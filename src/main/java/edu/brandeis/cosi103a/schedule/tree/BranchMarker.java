package edu.brandeis.cosi103a.schedule.tree;

/**
 * Marker lines written one level below an input path.
 */
public enum BranchMarker {
    /** Exploration below the branch stopped early and must be resumed. */
    INCOMPLETE("…"),
    /** Exploration below the branch ran to the end. */
    COMPLETE("✅");

    private final String symbol;

    BranchMarker(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /** Returns the marker for a trimmed line body, or {@code null} if it is not a marker. */
    public static BranchMarker fromSymbol(String content) {
        for (BranchMarker marker : values()) {
            if (marker.symbol.equals(content)) {
                return marker;
            }
        }
        return null;
    }
}
