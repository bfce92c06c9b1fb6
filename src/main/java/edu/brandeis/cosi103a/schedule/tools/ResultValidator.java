package edu.brandeis.cosi103a.schedule.tools;

import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.schedule.model.League;
import edu.brandeis.cosi103a.schedule.model.SchedulePath;
import edu.brandeis.cosi103a.schedule.runner.DedupIndex;
import edu.brandeis.cosi103a.schedule.search.PathCheck;
import edu.brandeis.cosi103a.schedule.search.RoundTracker;
import edu.brandeis.cosi103a.schedule.tree.TreeReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Re-checks every stored path: week legality, the optimal per-week score, the round rules
 * replayed from week 0, and repeats of earlier paths.
 *
 * <pre>
 * java ... ResultValidator --file results/8teams-3weeks.txt
 * </pre>
 */
public class ResultValidator {

    private static final Logger logger = LoggerFactory.getLogger(ResultValidator.class);

    static final int MAX_REPORTED = 20;

    public static void main(String[] args) {
        int exitCode;
        try {
            ToolArgs parsed = ToolArgs.parse(args, Set.of("--file"), Set.of());
            Path file = Paths.get(parsed.require("--file"));
            ValidationReport report = new ResultValidator().validate(file);
            report.problems().forEach(System.out::println);
            System.out.printf("Checked %,d paths: %,d invalid, %,d duplicates, %,d damaged lines%n",
                report.checked(), report.invalid(), report.duplicates(), report.skippedLines());
            exitCode = report.isClean() ? 0 : 1;
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println("Usage: ResultValidator --file FILE");
            exitCode = 2;
        } catch (IOException e) {
            logger.error("Validation failed", e);
            exitCode = 2;
        }
        System.exit(exitCode);
    }

    public ValidationReport validate(Path file) throws IOException {
        List<String> problems = new ArrayList<>();
        DedupIndex seen = new DedupIndex();
        long checked = 0;
        long invalid = 0;
        long duplicates = 0;
        long skipped;
        try (TreeReader reader = TreeReader.open(file)) {
            League league = reader.league();
            RoundTracker tracker = new RoundTracker(league);
            SchedulePath path;
            while ((path = reader.nextPath()) != null) {
                checked++;
                String problem = PathCheck.firstProblem(league, tracker, path);
                if (problem != null) {
                    invalid++;
                    report(problems, "Path " + checked + ": " + problem);
                } else if (!seen.add(path)) {
                    duplicates++;
                    report(problems, "Path " + checked + ": duplicate of an earlier path");
                }
            }
            skipped = reader.skippedLines();
            if (!reader.header().partial() && reader.header().count() != checked) {
                report(problems, "Header count " + reader.header().count() + " but " + checked + " paths read");
            }
        }
        logger.info("Validated {}: {} paths, {} invalid, {} duplicates", file, checked, invalid, duplicates);
        return new ValidationReport(checked, invalid, duplicates, skipped, ImmutableList.copyOf(problems));
    }

    private static void report(List<String> problems, String problem) {
        if (problems.size() < MAX_REPORTED) {
            problems.add(problem);
        }
    }
}
