package edu.brandeis.cosi103a.schedule.runner;

import edu.brandeis.cosi103a.schedule.tree.TreeFormatException;
import edu.brandeis.cosi103a.schedule.tree.TreeHeader;
import edu.brandeis.cosi103a.schedule.tree.TreeReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Naming of result files in the output directory:
 * {@code <N>teams-1week.txt} for week-0 seeds, {@code <N>teams-<W>weeks.txt} otherwise.
 */
public class ResultFiles {

    private static final Logger logger = LoggerFactory.getLogger(ResultFiles.class);

    private final Path dir;
    private final int teams;

    /** A complete result file usable as input. */
    public record Prior(Path file, int weeks) {
    }

    public ResultFiles(Path dir, int teams) {
        this.dir = dir;
        this.teams = teams;
    }

    public Path dir() {
        return dir;
    }

    public Path resultFile(int weeks) {
        String name = weeks == 1
            ? teams + "teams-1week.txt"
            : teams + "teams-" + weeks + "weeks.txt";
        return dir.resolve(name);
    }

    /** Sibling file a resumed run writes before replacing {@code target}. */
    public static Path temporaryFile(Path target) {
        return target.resolveSibling(target.getFileName() + ".tmp");
    }

    /** JSON run summary stored next to {@code target}. */
    public static Path summaryFile(Path target) {
        String name = target.getFileName().toString();
        String base = name.endsWith(".txt") ? name.substring(0, name.length() - 4) : name;
        return target.resolveSibling(base + ".json");
    }

    /**
     * The complete result file with the most weeks below {@code targetWeeks}. Partial or
     * unreadable files are skipped with a warning.
     */
    public Optional<Prior> bestPrior(int targetWeeks) throws IOException {
        for (int weeks = targetWeeks - 1; weeks >= 1; weeks--) {
            Path file = resultFile(weeks);
            if (!Files.exists(file)) {
                continue;
            }
            TreeHeader header;
            try {
                header = TreeReader.readHeader(file);
            } catch (TreeFormatException e) {
                logger.warn("Ignoring {}: {}", file, e.getMessage());
                continue;
            }
            if (header.teams() != teams || header.weeks() != weeks) {
                logger.warn("Ignoring {}: header says {} teams, {} weeks", file, header.teams(), header.weeks());
                continue;
            }
            if (header.partial()) {
                logger.warn("Ignoring partial file {}; finish it first to use it as input", file);
                continue;
            }
            return Optional.of(new Prior(file, weeks));
        }
        return Optional.empty();
    }
}
