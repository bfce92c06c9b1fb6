package edu.brandeis.cosi103a.schedule.tools;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableList;
import edu.brandeis.cosi103a.schedule.model.League;
import edu.brandeis.cosi103a.schedule.model.SchedulePath;
import edu.brandeis.cosi103a.schedule.model.WeekSchedule;
import edu.brandeis.cosi103a.schedule.runner.ResultFiles;
import edu.brandeis.cosi103a.schedule.tree.TreeReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Ranks the schedules of a result file by weighted pain and keeps every schedule tied for
 * the lowest score.
 *
 * <pre>
 * java ... ScheduleEvaluator --teams 10 --weeks 12 [--output results] [--weights pain.json]
 * </pre>
 */
public class ScheduleEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleEvaluator.class);

    private static final long CACHED_WEEKS = 100_000;

    private final League league;
    private final PainWeights weights;
    private final LoadingCache<WeekSchedule, WeekMetrics> weekMetrics;

    /** A schedule and its position in the file, counting from 1. */
    public record RankedSchedule(long number, SchedulePath path, ScoreBreakdown score) {
    }

    /** Outcome of scanning a whole file. */
    public record Evaluation(long evaluated, double bestScore, List<RankedSchedule> best) {
    }

    public ScheduleEvaluator(League league, PainWeights weights) {
        this.league = league;
        this.weights = weights;
        this.weekMetrics = CacheBuilder.newBuilder()
            .maximumSize(CACHED_WEEKS)
            .build(CacheLoader.from(week -> WeekMetrics.of(league, week)));
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = run(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println("Usage: ScheduleEvaluator --teams N --weeks W [--output DIR] [--weights FILE]");
            exitCode = 2;
        } catch (IOException e) {
            logger.error("Evaluation failed", e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    static int run(String[] args) throws IOException {
        ToolArgs parsed = ToolArgs.parse(args, Set.of("--teams", "--weeks", "--output", "--weights"), Set.of());
        int teams = parsed.requireInt("--teams");
        int weeks = parsed.requireInt("--weeks");
        Path dir = Paths.get(parsed.get("--output", "results"));
        PainWeights weights = parsed.has("--weights")
            ? PainWeights.load(Paths.get(parsed.require("--weights")))
            : PainWeights.defaults();

        Path input = new ResultFiles(dir, teams).resultFile(weeks);
        Path output = bestFile(input);
        System.out.printf("Evaluating schedules from: %s%n", input);
        System.out.printf("Pain multipliers: %s%n", weights.toJson());

        ScheduleEvaluator evaluator = new ScheduleEvaluator(League.of(teams), weights);
        Evaluation evaluation = evaluator.evaluate(input);
        evaluator.writeBest(evaluation, output);

        System.out.printf("Total schedules evaluated: %d%n", evaluation.evaluated());
        System.out.printf("Best score: %s%n", PainMetric.format(evaluation.bestScore()));
        System.out.printf("Schedules with best score: %d%n", evaluation.best().size());
        System.out.printf("Results written to: %s%n", output);
        return 0;
    }

    /** {@code 10teams-12weeks.txt} becomes {@code 10teams-12weeks-best.txt}. */
    public static Path bestFile(Path resultFile) {
        String name = resultFile.getFileName().toString();
        String base = name.endsWith(".txt") ? name.substring(0, name.length() - 4) : name;
        return resultFile.resolveSibling(base + "-best.txt");
    }

    public PainWeights weights() {
        return weights;
    }

    /** Sum of the active weighted metrics. */
    public double score(SchedulePath path) {
        PathMetrics metrics = metricsOf(path);
        double total = 0;
        for (PainMetric metric : PainMetric.values()) {
            if (weights.isActive(metric)) {
                total += weights.weight(metric) * metric.raw(metrics);
            }
        }
        return total;
    }

    public ScoreBreakdown explain(SchedulePath path) {
        PathMetrics metrics = metricsOf(path);
        ImmutableList.Builder<ScoreBreakdown.Line> lines = ImmutableList.builder();
        double total = 0;
        for (PainMetric metric : PainMetric.values()) {
            if (!weights.isActive(metric)) {
                continue;
            }
            ScoreBreakdown.Line line = new ScoreBreakdown.Line(
                metric, weights.weight(metric), metric.raw(metrics), metric.details(metrics));
            total += line.weighted();
            lines.add(line);
        }
        return new ScoreBreakdown(total, lines.build());
    }

    /**
     * Scores every path of {@code file}.
     *
     * @throws IllegalArgumentException if the file belongs to another league
     */
    public Evaluation evaluate(Path file) throws IOException {
        double bestScore = Double.POSITIVE_INFINITY;
        List<RankedSchedule> best = new ArrayList<>();
        long evaluated = 0;
        try (TreeReader reader = TreeReader.open(file)) {
            if (reader.header().teams() != league.teams()) {
                throw new IllegalArgumentException(
                    file + " holds " + reader.header().teams() + " teams, expected " + league.teams());
            }
            SchedulePath path;
            while ((path = reader.nextPath()) != null) {
                evaluated++;
                double score = score(path);
                if (score < bestScore) {
                    bestScore = score;
                    best.clear();
                }
                if (score == bestScore) {
                    best.add(new RankedSchedule(evaluated, path, explain(path)));
                    logger.debug("Schedule {} :: Score: {}", evaluated, PainMetric.format(score));
                }
            }
        }
        logger.info("Evaluated {} schedules from {}, {} tied at the best score", evaluated, file, best.size());
        return new Evaluation(evaluated, best.isEmpty() ? 0 : bestScore, best);
    }

    /** Writes the tied schedules in the human-readable report format. */
    public void writeBest(Evaluation evaluation, Path output) throws IOException {
        int weeks = evaluation.best().isEmpty() ? 0 : evaluation.best().get(0).path().size();
        try (BufferedWriter buffered = Files.newBufferedWriter(output, StandardCharsets.UTF_8);
             PrintWriter out = new PrintWriter(buffered)) {
            out.printf("# teams=%d weeks=%d count=%d%n", league.teams(), weeks, evaluation.best().size());
            out.printf("# Pain multipliers: %s%n", weights.toJson());
            out.println();
            for (RankedSchedule ranked : evaluation.best()) {
                out.printf(Locale.ROOT, "Schedule %d/%d :: Score: %s%n",
                    ranked.number(), evaluation.evaluated(), PainMetric.format(ranked.score().total()));
                SchedulePath path = ranked.path();
                for (int w = 0; w < path.size(); w++) {
                    out.printf("Week %d: %s%n", w + 1, path.week(w).describe(league));
                }
                out.println(ranked.score().format());
                out.println("Team Matchups:");
                out.println(matchupGrid(path));
                out.println();
            }
            if (out.checkError()) {
                throw new IOException("Failed writing " + output);
            }
        }
    }

    /** Games between each pair of teams, one row per team. */
    public String matchupGrid(SchedulePath path) {
        int[][] counts = metricsOf(path).opponentCounts();
        StringBuilder sb = new StringBuilder("  ");
        for (int t = 0; t < league.teams(); t++) {
            sb.append(t > 0 ? " " : "").append(League.teamLetter(t));
        }
        for (int t = 0; t < league.teams(); t++) {
            sb.append(System.lineSeparator()).append(League.teamLetter(t));
            for (int o = 0; o < league.teams(); o++) {
                sb.append(' ');
                if (o == t) {
                    sb.append('·');
                } else {
                    sb.append(counts[t][o]);
                }
            }
        }
        return sb.toString();
    }

    private PathMetrics metricsOf(SchedulePath path) {
        List<WeekMetrics> weeks = new ArrayList<>(path.size());
        for (WeekSchedule week : path.weeks()) {
            weeks.add(weekMetrics.getUnchecked(week));
        }
        return new PathMetrics(league, path, weeks);
    }
}
