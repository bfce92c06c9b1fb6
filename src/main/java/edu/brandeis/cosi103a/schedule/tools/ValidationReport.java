package edu.brandeis.cosi103a.schedule.tools;

import com.google.common.collect.ImmutableList;

/**
 * Outcome of re-checking a result file.
 *
 * @param checked      full-length paths read
 * @param invalid      paths that break a week, score or round rule
 * @param duplicates   paths already seen earlier in the file
 * @param skippedLines damaged lines the reader dropped
 * @param problems     descriptions of the first problems found
 */
public record ValidationReport(long checked, long invalid, long duplicates, long skippedLines,
                               ImmutableList<String> problems) {

    public boolean isClean() {
        return invalid == 0 && duplicates == 0 && skippedLines == 0;
    }
}
