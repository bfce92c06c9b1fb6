package edu.brandeis.cosi103a.schedule.tree;

import com.google.common.base.Strings;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * First line of a result file: {@code # teams=<N> weeks=<W> count=<C>[ (partial)]}.
 *
 * <p>The count and the partial flag share a space-padded field of fixed width so the
 * header can be rewritten in place once the body is done.
 */
public record TreeHeader(int teams, int weeks, long count, boolean partial) {

    public static final int COUNT_WIDTH = 13;
    public static final String PARTIAL_FLAG = " (partial)";
    public static final int FIELD_WIDTH = COUNT_WIDTH + PARTIAL_FLAG.length();

    private static final Pattern HEADER =
        Pattern.compile("^#\\s*teams=(\\d+)\\s+weeks=(\\d+)\\s+count=(\\d+)\\s*(\\(partial\\))?\\s*$");

    public static TreeHeader parse(String line) throws TreeFormatException {
        if (line == null) {
            throw new TreeFormatException("Missing header line");
        }
        Matcher m = HEADER.matcher(line);
        if (!m.matches()) {
            throw new TreeFormatException("Invalid header line: " + line);
        }
        try {
            return new TreeHeader(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                Long.parseLong(m.group(3)), m.group(4) != null);
        } catch (NumberFormatException e) {
            throw new TreeFormatException("Invalid number in header line: " + line);
        }
    }

    public TreeHeader withCount(long newCount, boolean newPartial) {
        return new TreeHeader(teams, weeks, newCount, newPartial);
    }

    /** Everything before the count field. */
    public String prefix() {
        return "# teams=" + teams + " weeks=" + weeks + " count=";
    }

    /** The padded count field, always {@link #FIELD_WIDTH} characters. */
    public String countField() {
        return Strings.padEnd(count + (partial ? PARTIAL_FLAG : ""), FIELD_WIDTH, ' ');
    }

    public String format() {
        return prefix() + countField();
    }
}
