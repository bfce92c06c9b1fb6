package edu.brandeis.cosi103a.schedule.tree;

import com.google.common.base.Preconditions;
import edu.brandeis.cosi103a.schedule.model.League;
import edu.brandeis.cosi103a.schedule.model.SchedulePath;
import edu.brandeis.cosi103a.schedule.model.WeekSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Streaming reader for result files. Keeps a stack of the weeks above the current line and
 * never holds more than one path in memory.
 *
 * <p>Damaged lines (bad numbers, wrong slot count, ids out of range, impossible depth) are
 * skipped together with anything nested under them. The first {@value #MAX_WARNINGS} are
 * logged one by one, the rest as a total when the reader is closed.
 */
public class TreeReader implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(TreeReader.class);

    static final int MAX_WARNINGS = 10;

    private final Path file;
    private final TreeHeader header;
    private final League league;
    private final BufferedReader in;
    private final List<WeekSchedule> stack = new ArrayList<>();
    private long lineNumber = 1;
    private long skipped;

    private TreeReader(Path file, TreeHeader header, League league, BufferedReader in) {
        this.file = file;
        this.header = header;
        this.league = league;
        this.in = in;
    }

    /**
     * Opens {@code file} and parses its header.
     *
     * @throws TreeFormatException if the header is missing or describes an unsupported league
     */
    public static TreeReader open(Path file) throws IOException {
        BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        try {
            TreeHeader header = TreeHeader.parse(in.readLine());
            if (header.weeks() < 1) {
                throw new TreeFormatException("Header of " + file + " declares " + header.weeks() + " weeks");
            }
            League league;
            try {
                league = League.of(header.teams());
            } catch (IllegalArgumentException e) {
                throw new TreeFormatException("Header of " + file + ": " + e.getMessage());
            }
            return new TreeReader(file, header, league, in);
        } catch (IOException | RuntimeException e) {
            in.close();
            throw e;
        }
    }

    /** Reads only the header line. */
    public static TreeHeader readHeader(Path file) throws IOException {
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return TreeHeader.parse(in.readLine());
        }
    }

    /** Reads every path of a small file into memory. */
    public static List<SchedulePath> readAll(Path file) throws IOException {
        List<SchedulePath> paths = new ArrayList<>();
        try (TreeReader reader = open(file)) {
            SchedulePath path;
            while ((path = reader.nextPath()) != null) {
                paths.add(path);
            }
        }
        return paths;
    }

    public Path file() {
        return file;
    }

    public TreeHeader header() {
        return header;
    }

    public League league() {
        return league;
    }

    /** Lines skipped as damaged so far. */
    public long skippedLines() {
        return skipped;
    }

    /** Next week or marker line, or {@code null} at end of file. */
    public TreeLine nextLine() throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            int depth = 0;
            while (depth < line.length() && line.charAt(depth) == '\t') {
                depth++;
            }
            String content = line.substring(depth).trim();
            if (content.isEmpty() || content.startsWith("#")) {
                continue;
            }

            BranchMarker marker = BranchMarker.fromSymbol(content);
            if (marker != null) {
                if (depth == 0 || depth > stack.size() || depth >= header.weeks()) {
                    skip(line, "marker at impossible depth " + depth);
                    continue;
                }
                truncate(depth);
                return new TreeLine(depth, null, marker, SchedulePath.of(stack));
            }

            if (depth > stack.size() || depth >= header.weeks()) {
                skip(line, "week at impossible depth " + depth);
                continue;
            }
            truncate(depth);
            WeekSchedule week = parseWeek(content);
            if (week == null) {
                skip(line, "expected " + league.slots() + " matchup ids below " + league.matchups());
                continue;
            }
            stack.add(week);
            return new TreeLine(depth, week, null, SchedulePath.of(stack));
        }
        return null;
    }

    /** Next full-length path, or {@code null} at end of file. */
    public SchedulePath nextPath() throws IOException {
        TreeLine line;
        while ((line = nextLine()) != null) {
            if (!line.isMarker() && line.depth() == header.weeks() - 1) {
                return line.path();
            }
        }
        return null;
    }

    /**
     * Reads the rest of the file into per-branch statuses for the prefixes whose last week
     * sits at {@code parentDepth}.
     */
    public BranchIndex branchIndex(int parentDepth) throws IOException {
        Preconditions.checkArgument(parentDepth >= 0 && parentDepth < header.weeks() - 1,
            "parentDepth %s outside [0, %s)", parentDepth, header.weeks() - 1);
        BranchIndex index = new BranchIndex(parentDepth);
        int leafDepth = header.weeks() - 1;
        boolean inBranch = false;
        long key = 0;
        TreeLine line;
        while ((line = nextLine()) != null) {
            if (line.isMarker()) {
                if (inBranch && line.depth() == parentDepth + 1) {
                    index.update(key, index.getOrEmpty(key).withMarker(line.marker()));
                }
                continue;
            }
            if (line.depth() <= parentDepth) {
                inBranch = line.depth() == parentDepth;
                if (inBranch) {
                    key = line.path().fingerprint();
                    index.update(key, index.getOrEmpty(key));
                }
            }
            if (inBranch && line.depth() == leafDepth) {
                index.update(key, index.getOrEmpty(key).withLeaf());
            }
        }
        return index;
    }

    @Override
    public void close() throws IOException {
        if (skipped > MAX_WARNINGS) {
            logger.warn("{} more damaged lines skipped in {}", skipped - MAX_WARNINGS, file);
        }
        in.close();
    }

    private WeekSchedule parseWeek(String content) {
        WeekSchedule week;
        try {
            week = WeekSchedule.parse(content);
        } catch (NumberFormatException e) {
            return null;
        }
        if (week.size() != league.slots()) {
            return null;
        }
        for (int slot = 0; slot < week.size(); slot++) {
            int m = week.matchup(slot);
            if (m < 0 || m >= league.matchups()) {
                return null;
            }
        }
        return week;
    }

    private void truncate(int depth) {
        while (stack.size() > depth) {
            stack.remove(stack.size() - 1);
        }
    }

    private void skip(String line, String reason) {
        skipped++;
        if (skipped <= MAX_WARNINGS) {
            logger.warn("Skipping line {} of {} ({}): {}", lineNumber, file, reason, line.strip());
        }
    }
}
