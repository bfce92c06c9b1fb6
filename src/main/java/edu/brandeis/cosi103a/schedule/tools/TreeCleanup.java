package edu.brandeis.cosi103a.schedule.tools;

import edu.brandeis.cosi103a.schedule.model.SchedulePath;
import edu.brandeis.cosi103a.schedule.runner.DedupIndex;
import edu.brandeis.cosi103a.schedule.runner.ResultFiles;
import edu.brandeis.cosi103a.schedule.tree.BranchIndex;
import edu.brandeis.cosi103a.schedule.tree.BranchMarker;
import edu.brandeis.cosi103a.schedule.tree.BranchStatus;
import edu.brandeis.cosi103a.schedule.tree.TreeHeader;
import edu.brandeis.cosi103a.schedule.tree.TreeLine;
import edu.brandeis.cosi103a.schedule.tree.TreeReader;
import edu.brandeis.cosi103a.schedule.tree.TreeWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Set;

/**
 * Rewrites a result file without repeated paths or damaged lines. Each branch one week
 * short of full length gets a single marker for its merged status after each run of its
 * paths, and the header is recounted.
 *
 * <pre>
 * java ... TreeCleanup --input results/8teams-3weeks.txt [--output cleaned.txt]
 * </pre>
 */
public class TreeCleanup {

    private static final Logger logger = LoggerFactory.getLogger(TreeCleanup.class);

    /**
     * @param read        full-length paths read
     * @param written     distinct paths written
     * @param complete    complete markers written
     * @param incomplete  incomplete markers written
     * @param partial     whether the cleaned file is flagged partial
     */
    public record Result(long read, long written, long complete, long incomplete, boolean partial) {

        public long duplicates() {
            return read - written;
        }
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            ToolArgs parsed = ToolArgs.parse(args, Set.of("--input", "--output"), Set.of());
            Path input = Paths.get(parsed.require("--input"));
            Path output = Paths.get(parsed.get("--output", input.toString()));
            Result result = new TreeCleanup().clean(input, output);
            System.out.printf("Read %,d paths, wrote %,d (%,d duplicates removed) to %s%s%n",
                result.read(), result.written(), result.duplicates(), output, result.partial() ? " (partial)" : "");
            exitCode = 0;
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println("Usage: TreeCleanup --input FILE [--output FILE]");
            exitCode = 2;
        } catch (IOException e) {
            logger.error("Cleanup failed", e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    /**
     * Cleans {@code input} into {@code output}; both may name the same file.
     */
    public Result clean(Path input, Path output) throws IOException {
        TreeHeader header = TreeReader.readHeader(input);
        int parentDepth = header.weeks() - 2;
        BranchIndex index = null;
        if (parentDepth >= 0) {
            try (TreeReader reader = TreeReader.open(input)) {
                index = reader.branchIndex(parentDepth);
            }
        }

        Path temp = ResultFiles.temporaryFile(output);
        DedupIndex seen = new DedupIndex();
        long read = 0;
        long complete = 0;
        long incomplete = 0;
        boolean partial;
        try (TreeReader reader = TreeReader.open(input);
             TreeWriter writer = TreeWriter.create(temp, header.teams(), header.weeks())) {
            SchedulePath branch = null;
            TreeLine line;
            while ((line = reader.nextLine()) != null) {
                if (line.isMarker()) {
                    continue;
                }
                if (line.depth() <= parentDepth) {
                    if (branch != null) {
                        BranchMarker marker = closeBranch(writer, index, branch);
                        complete += marker == BranchMarker.COMPLETE ? 1 : 0;
                        incomplete += marker == BranchMarker.INCOMPLETE ? 1 : 0;
                    }
                    branch = line.depth() == parentDepth ? line.path() : null;
                }
                if (line.depth() == header.weeks() - 1) {
                    read++;
                    if (seen.add(line.path())) {
                        writer.writePath(line.path());
                    }
                }
            }
            if (branch != null) {
                BranchMarker marker = closeBranch(writer, index, branch);
                complete += marker == BranchMarker.COMPLETE ? 1 : 0;
                incomplete += marker == BranchMarker.INCOMPLETE ? 1 : 0;
            }
            partial = header.partial() || (index != null && index.incompleteCount() > 0);
            writer.finish(partial);
        }
        Files.move(temp, output, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        logger.info("Cleaned {} into {}: {} paths read, {} written", input, output, read, seen.size());
        return new Result(read, seen.size(), complete, incomplete, partial);
    }

    private static BranchMarker closeBranch(TreeWriter writer, BranchIndex index, SchedulePath branch)
            throws IOException {
        BranchStatus status = index.get(branch);
        if (status == null) {
            return null;
        }
        BranchMarker marker = status.isComplete() ? BranchMarker.COMPLETE
            : status.isIncomplete() ? BranchMarker.INCOMPLETE
            : null;
        if (marker != null) {
            writer.writeMarker(branch, marker);
        }
        return marker;
    }
}
