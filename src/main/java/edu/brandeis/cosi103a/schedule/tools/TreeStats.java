package edu.brandeis.cosi103a.schedule.tools;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.brandeis.cosi103a.schedule.runner.ContinuationStats;
import edu.brandeis.cosi103a.schedule.tree.BranchIndex;
import edu.brandeis.cosi103a.schedule.tree.BranchStatus;
import edu.brandeis.cosi103a.schedule.tree.TreeReader;
import it.unimi.dsi.fastutil.longs.LongArrayList;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;

/**
 * Full-length paths stored per branch at a given depth of a result file.
 *
 * <pre>
 * java ... TreeStats --file results/8teams-3weeks.txt [--depth 1] [--include-partials]
 * </pre>
 */
public class TreeStats {

    /**
     * @param depth          depth of the last week of each counted branch
     * @param partialParents branches cut off before finishing
     * @param leaves         min/max/average over the counted branches
     */
    public record Report(
        @JsonProperty("depth") int depth,
        @JsonProperty("partialParents") long partialParents,
        @JsonProperty("partialsIncluded") boolean partialsIncluded,
        @JsonProperty("leaves") ContinuationStats leaves
    ) {
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            ToolArgs parsed = ToolArgs.parse(args, Set.of("--file", "--depth"), Set.of("--include-partials"));
            Path file = Paths.get(parsed.require("--file"));
            int depth = parsed.getInt("--depth", -1);
            Report report = compute(file, depth, parsed.isSet("--include-partials"));
            ContinuationStats leaves = report.leaves();
            System.out.printf("Branches at depth %d: %,d counted, %,d partial%s%n", report.depth(),
                leaves.inputPaths(), report.partialParents(), report.partialsIncluded() ? " (included)" : " (excluded)");
            System.out.printf("Paths per branch: min %,d, max %,d, avg %.2f%n",
                leaves.min(), leaves.max(), leaves.average());
            exitCode = 0;
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println("Usage: TreeStats --file FILE [--depth D] [--include-partials]");
            exitCode = 2;
        } catch (IOException e) {
            System.err.println("I/O error: " + e.getMessage());
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    /**
     * @param depth negative for one week short of full length
     * @throws IllegalArgumentException if the depth is not below the last week
     */
    public static Report compute(Path file, int depth, boolean includePartials) throws IOException {
        BranchIndex index;
        try (TreeReader reader = TreeReader.open(file)) {
            int parentDepth = depth < 0 ? reader.header().weeks() - 2 : depth;
            index = reader.branchIndex(parentDepth);
        }
        LongArrayList counts = new LongArrayList();
        long partial = 0;
        for (BranchStatus status : index.statuses()) {
            if (status.isIncomplete()) {
                partial++;
                if (!includePartials) {
                    continue;
                }
            }
            counts.add(status.leaves());
        }
        return new Report(index.parentDepth(), partial, includePartials, ContinuationStats.of(counts));
    }
}
