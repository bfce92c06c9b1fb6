package edu.brandeis.cosi103a.schedule.tree;

import java.io.IOException;

/**
 * A result file that cannot be used at all, such as one without a valid header.
 * Damaged body lines are skipped instead.
 */
public class TreeFormatException extends IOException {

    public TreeFormatException(String message) {
        super(message);
    }
}
