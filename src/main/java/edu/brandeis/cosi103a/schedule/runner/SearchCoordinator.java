package edu.brandeis.cosi103a.schedule.runner;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import edu.brandeis.cosi103a.schedule.model.League;
import edu.brandeis.cosi103a.schedule.model.SchedulePath;
import edu.brandeis.cosi103a.schedule.model.WeekSchedule;
import edu.brandeis.cosi103a.schedule.search.ExplorationResult;
import edu.brandeis.cosi103a.schedule.search.PathCheck;
import edu.brandeis.cosi103a.schedule.search.PathSearch;
import edu.brandeis.cosi103a.schedule.search.RoundTracker;
import edu.brandeis.cosi103a.schedule.search.SeedResult;
import edu.brandeis.cosi103a.schedule.tree.BranchMarker;
import edu.brandeis.cosi103a.schedule.tree.BranchStatus;
import edu.brandeis.cosi103a.schedule.tree.TreeFormatException;
import edu.brandeis.cosi103a.schedule.tree.TreeHeader;
import edu.brandeis.cosi103a.schedule.tree.TreeLine;
import edu.brandeis.cosi103a.schedule.tree.TreeReader;
import edu.brandeis.cosi103a.schedule.tree.TreeWriter;
import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Drives {@link PathSearch} over every input path with a fixed pool of workers and writes
 * the optimal continuations to the result file.
 *
 * <p>Work is handed out in fairness rounds: each input path that is not yet exhausted gets
 * one unit of at most {@code breadth} new results per round, in file order, and a round ends
 * only when all of its units have reported back. Only the coordinator thread touches the
 * result file and the dedup index.
 *
 * <p>A partial result file is resumed: its paths and markers are copied into a new file,
 * input paths marked complete are skipped and incomplete ones continue after the results
 * already stored. The new file replaces the old one when the run ends.
 *
 * <p>{@link #requestStop()} may be called from any thread, typically a shutdown hook. The
 * run then stops dispatching, marks every input path in flight as incomplete and finishes
 * the file as partial. An instance runs once.
 */
public class SearchCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(SearchCoordinator.class);

    private static final long POLL_MILLIS = 200;

    private final SearchConfig config;
    private final ProgressListener listener;
    private final League league;
    private final ResultFiles files;
    private final RunSummaryStore summaries = new RunSummaryStore();
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean stopRequested;
    private boolean started;

    // Coordinator-thread state
    private final DedupIndex dedup = new DedupIndex();
    private final LongArrayList foundCounts = new LongArrayList();
    private final BooleanArrayList retired = new BooleanArrayList();
    private final Int2ObjectOpenHashMap<SchedulePath> inFlight = new Int2ObjectOpenHashMap<>();
    private final BlockingQueue<WorkerMessage> messages = new LinkedBlockingQueue<>();
    private TreeWriter writer;
    private long startNanos;
    private long newPaths;
    private int fairnessRound;
    private int completedPaths;
    private Throwable failure;
    private int failedUnit = -1;

    /**
     * @throws ScheduleConfigurationException if the configuration is invalid
     */
    public SearchCoordinator(SearchConfig config, ProgressListener listener) {
        config.requireValid();
        this.config = config;
        this.listener = listener;
        this.league = League.of(config.teams());
        this.files = new ResultFiles(config.outputPath(), config.teams());
    }

    public SearchConfig config() {
        return config;
    }

    public Path resultFile() {
        return files.resultFile(config.weeks());
    }

    /** Asks a running search to checkpoint and return. Safe from any thread. */
    public void requestStop() {
        stopRequested = true;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    /** Waits until {@link #run()} has returned or thrown. */
    public boolean awaitFinished(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    /**
     * Runs the search to completion or until stopped.
     *
     * @throws ScheduleConfigurationException if a resume has no source file
     * @throws SearchFailedException          if a worker failed; the file is checkpointed first
     * @throws TreeFormatException            if an existing result file is unusable
     */
    public RunSummary run() throws IOException {
        Preconditions.checkState(!started, "SearchCoordinator runs only once");
        started = true;
        startNanos = System.nanoTime();
        try {
            return config.validate() ? runWithoutFiles() : runToFile();
        } finally {
            finished.countDown();
        }
    }

    private RunSummary runWithoutFiles() {
        SeedResult seed = newSearch().seed();
        List<SchedulePath> seeds = new ArrayList<>(seed.weeks().size());
        for (WeekSchedule week : seed.weeks()) {
            seeds.add(SchedulePath.of(week));
        }
        if (config.weeks() == 1) {
            seeds.forEach(dedup::add);
            newPaths = dedup.size();
            report(SearchProgress.State.COMPLETED, seeds.size());
            return summary(null, null, dedup.size(), false);
        }
        InputPaths inputs = InputPaths.of(seeds);
        boolean partial = search(inputs, ResumePlan.fresh());
        RunSummary summary = summary(null, inputs, dedup.size(), partial);
        throwIfFailed();
        return summary;
    }

    private RunSummary runToFile() throws IOException {
        Path target = resultFile();
        boolean resume = false;
        if (Files.exists(target)) {
            TreeHeader header = TreeReader.readHeader(target);
            if (header.teams() != config.teams() || header.weeks() != config.weeks()) {
                throw new TreeFormatException(target + " has header for " + header.teams() + " teams, "
                    + header.weeks() + " weeks");
            }
            if (!header.partial()) {
                logger.info("{} is already complete with {} paths", target, header.count());
                return summary(target, null, header.count(), false);
            }
            resume = true;
            logger.info("Resuming partial file {} ({} paths so far)", target, header.count());
            requireSameTraversal(target);
        }

        if (config.weeks() == 1) {
            long count = writeSeedFile(target);
            RunSummary summary = summary(target, null, count, false);
            summaries.write(target, summary);
            return summary;
        }

        Optional<ResultFiles.Prior> prior = files.bestPrior(config.weeks());
        ResultFiles.Prior source;
        if (prior.isPresent()) {
            source = prior.get();
        } else if (resume) {
            throw new ScheduleConfigurationException("Cannot resume " + target
                + ": no complete result file with fewer weeks in " + files.dir());
        } else {
            Path seedFile = files.resultFile(1);
            writeSeedFile(seedFile);
            source = new ResultFiles.Prior(seedFile, 1);
        }
        logger.info("Extending {} ({} weeks) to {} weeks", source.file(), source.weeks(), config.weeks());

        ResumePlan plan = resume
            ? ResumePlan.load(target, config.teams(), config.weeks(), source.weeks())
            : ResumePlan.fresh();
        Path output = resume ? ResultFiles.temporaryFile(target) : target;
        InputPaths inputs = InputPaths.of(source.file());
        boolean partial;
        writer = TreeWriter.create(output, config.teams(), config.weeks());
        try {
            if (resume) {
                copyForward(target, plan);
            }
            summaries.write(target, summary(target, inputs, writer.count(), true));
            partial = search(inputs, plan);
            writer.finish(partial);
        } catch (IOException | RuntimeException e) {
            writer.close();
            throw e;
        }
        if (resume) {
            Files.move(output, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        }

        RunSummary summary = summary(target, inputs, writer.count(), partial);
        summaries.write(target, summary);
        throwIfFailed();
        return summary;
    }

    /** Generates week 0 and stores it as a flat 1-week file. */
    private long writeSeedFile(Path file) throws IOException {
        SeedResult seed = newSearch().seed();
        try (TreeWriter seedWriter = TreeWriter.create(file, config.teams(), 1)) {
            for (WeekSchedule week : seed.weeks()) {
                seedWriter.writePath(SchedulePath.of(week));
            }
            seedWriter.finish(false);
            logger.info("Wrote {} week-0 schedules with score {} to {}", seedWriter.count(), seed.best(), file);
            newPaths += seedWriter.count();
            return seedWriter.count();
        }
    }

    /**
     * Stored counts are positions in the continuation order of one diversify setting; a
     * partial file resumes only with the setting recorded in its run summary.
     *
     * @throws ScheduleConfigurationException if the settings differ
     */
    private void requireSameTraversal(Path target) throws IOException {
        Optional<RunSummary> stored = summaries.read(target);
        if (stored.isEmpty() || stored.get().config() == null) {
            logger.warn("No run summary next to {}; assuming it was searched with diversify={}",
                target, config.diversify());
            return;
        }
        boolean diversified = stored.get().config().diversify();
        if (diversified != config.diversify()) {
            throw new ScheduleConfigurationException("Cannot resume " + target + ": it was searched "
                + (diversified ? "with" : "without") + " --diversify; resume with the same setting");
        }
    }

    /** Copies the stored paths that still pass every check, and the markers, into the new file. */
    private void copyForward(Path target, ResumePlan plan) throws IOException {
        RoundTracker tracker = new RoundTracker(league);
        long dropped = 0;
        try (TreeReader reader = TreeReader.open(target)) {
            int leafDepth = config.weeks() - 1;
            TreeLine line;
            while ((line = reader.nextLine()) != null) {
                if (line.isMarker()) {
                    BranchMarker marker = plan.hasDiscarded(line.path()) ? BranchMarker.INCOMPLETE : line.marker();
                    writer.writeMarker(line.path(), marker);
                } else if (line.depth() == leafDepth) {
                    String problem = PathCheck.firstProblem(league, tracker, line.path());
                    if (problem != null) {
                        dropped++;
                        plan.discard(line.path());
                        logger.warn("Dropping stored path {}: {}", line.path(), problem);
                    } else if (dedup.add(line.path())) {
                        writer.writePath(line.path());
                    }
                }
            }
        }
        logger.info("Copied {} stored paths forward from {}, {} dropped", writer.count(), target, dropped);
    }

    /**
     * Runs fairness rounds until every input path is exhausted, a stop is requested or a
     * worker fails.
     *
     * @return whether the result is partial
     */
    private boolean search(InputPaths inputs, ResumePlan plan) {
        ExecutorService pool = Executors.newFixedThreadPool(config.workers(),
            new ThreadFactoryBuilder().setNameFormat("search-worker-%d").setDaemon(true).build());
        ThreadLocal<PathSearch> searches = ThreadLocal.withInitial(this::newSearch);
        try {
            classify(inputs, plan);
            report(SearchProgress.State.STARTING, foundCounts.size());
            while (hasActivePaths() && !stopRequested && failure == null) {
                fairnessRound++;
                logger.debug("Fairness round {}: {} input paths left", fairnessRound,
                    foundCounts.size() - completedPaths);
                dispatchRound(inputs, pool, searches);
                flush();
            }
            if (!inFlight.isEmpty()) {
                checkpointInFlight();
            }
        } catch (IOException e) {
            throw new SearchFailedException("I/O error while searching " + inputs.describe(), e);
        } finally {
            shutdown(pool);
        }

        boolean partial = stopRequested || failure != null || hasActivePaths();
        SearchProgress.State state = failure != null ? SearchProgress.State.FAILED
            : stopRequested ? SearchProgress.State.INTERRUPTED
            : SearchProgress.State.COMPLETED;
        report(state, foundCounts.size());
        return partial;
    }

    /** First pass over the inputs: numbers them and applies what the resume plan knows. */
    private void classify(InputPaths inputs, ResumePlan plan) throws IOException {
        RoundTracker tracker = new RoundTracker(league);
        try (InputPaths.Cursor cursor = inputs.open()) {
            SchedulePath path;
            while ((path = cursor.next()) != null) {
                int unit = foundCounts.size();
                if (!isUsableInput(tracker, path, unit)) {
                    foundCounts.add(0);
                    retired.add(true);
                    completedPaths++;
                    continue;
                }
                BranchStatus status = plan.statusOf(path);
                foundCounts.add(status == null ? 0 : status.leaves());
                boolean complete = status != null && status.isComplete();
                retired.add(complete);
                if (complete) {
                    completedPaths++;
                }
            }
        }
        if (plan.isResume()) {
            logger.info("Resume: {} of {} input paths complete, {} known branches", completedPaths,
                foundCounts.size(), plan.knownBranches());
        }
    }

    private boolean isUsableInput(RoundTracker tracker, SchedulePath path, int unit) {
        for (WeekSchedule week : path.weeks()) {
            if (!week.isValid(league)) {
                logger.warn("Skipping input path #{}: {}", unit, week.violations(league));
                return false;
            }
        }
        try {
            tracker.replay(path);
            return true;
        } catch (IllegalArgumentException e) {
            logger.warn("Skipping input path #{}: {}", unit, e.getMessage());
            return false;
        }
    }

    private void dispatchRound(InputPaths inputs, ExecutorService pool, ThreadLocal<PathSearch> searches)
            throws IOException {
        try (InputPaths.Cursor cursor = inputs.open()) {
            int unit = -1;
            SchedulePath path;
            while ((path = cursor.next()) != null && unit + 1 < retired.size()) {
                unit++;
                if (retired.getBoolean(unit)) {
                    continue;
                }
                while (inFlight.size() >= config.workers()) {
                    if (!awaitMessage()) {
                        return;
                    }
                }
                if (stopRequested || failure != null) {
                    return;
                }
                inFlight.put(unit, path);
                pool.execute(new SearchTask(unit, path, foundCounts.getLong(unit), config.breadth(),
                    searches, messages, this::isStopRequested));
            }
        }
        while (!inFlight.isEmpty()) {
            if (!awaitMessage()) {
                return;
            }
        }
    }

    /**
     * Handles at most one message.
     *
     * @return {@code false} once the run must stop
     */
    private boolean awaitMessage() throws IOException {
        WorkerMessage message;
        try {
            message = messages.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            // The interrupt is turned into a stop so the checkpoint can still be written.
            logger.info("Coordinator interrupted, stopping");
            stopRequested = true;
            return false;
        }
        if (message != null) {
            handle(message);
        }
        return !stopRequested && failure == null;
    }

    private void handle(WorkerMessage message) throws IOException {
        int unit = message.unit();
        if (!inFlight.containsKey(unit)) {
            logger.debug("Dropping late {} for input path #{}", message.getClass().getSimpleName(), unit);
            return;
        }
        if (message instanceof WorkerMessage.Found found) {
            for (SchedulePath path : found.paths()) {
                if (dedup.add(path)) {
                    newPaths++;
                    if (writer != null) {
                        writer.writePath(path);
                    }
                }
            }
            foundCounts.set(unit, foundCounts.getLong(unit) + found.paths().size());
        } else if (message instanceof WorkerMessage.Finished done) {
            SchedulePath path = inFlight.remove(unit);
            ExplorationResult result = done.result();
            foundCounts.set(unit, result.totalFound());
            if (result.exhausted()) {
                retired.set(unit, true);
                completedPaths++;
                mark(path, BranchMarker.COMPLETE);
            } else {
                mark(path, BranchMarker.INCOMPLETE);
            }
            logger.debug("Input path #{}: {} new, {} total, exhausted={}", unit, result.newResults(),
                result.totalFound(), result.exhausted());
            report(SearchProgress.State.RUNNING, foundCounts.size());
        } else if (message instanceof WorkerMessage.Failed failed) {
            failure = failed.error();
            failedUnit = unit;
            logger.error("Worker failed on input path #{}", unit, failed.error());
        }
    }

    private void checkpointInFlight() throws IOException {
        logger.info("Marking {} input paths in flight as incomplete", inFlight.size());
        int[] units = inFlight.keySet().toIntArray();
        Arrays.sort(units);
        for (int unit : units) {
            mark(inFlight.get(unit), BranchMarker.INCOMPLETE);
        }
        inFlight.clear();
        flush();
    }

    private void mark(SchedulePath path, BranchMarker marker) throws IOException {
        if (writer != null) {
            writer.writeMarker(path, marker);
        }
    }

    private void flush() throws IOException {
        if (writer != null) {
            writer.flush();
        }
    }

    private boolean hasActivePaths() {
        return completedPaths < retired.size();
    }

    private PathSearch newSearch() {
        return new PathSearch(league, config.weeks(), config.cacheWeeks(), config.diversify());
    }

    private void shutdown(ExecutorService pool) {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Search workers did not stop within 10 seconds");
            }
        } catch (InterruptedException e) {
            // Not re-asserted: the result file still has to be finished.
            logger.warn("Interrupted while waiting for search workers, treating as a stop");
            stopRequested = true;
        }
    }

    private void throwIfFailed() {
        if (failure != null) {
            throw new SearchFailedException("Worker failed on input path #" + failedUnit, failure);
        }
    }

    private void report(SearchProgress.State state, int inputPaths) {
        if (listener != null) {
            listener.onProgress(new SearchProgress(state, fairnessRound, inputPaths, completedPaths,
                dedup.size(), elapsedMillis()));
        }
    }

    private long elapsedMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private RunSummary summary(Path target, InputPaths inputs, long count, boolean partial) {
        return new RunSummary(
            config,
            target == null ? null : target.toString(),
            inputs == null ? null : inputs.describe(),
            count,
            newPaths,
            partial,
            stopRequested,
            fairnessRound,
            completedPaths,
            ContinuationStats.of(foundCounts),
            elapsedMillis());
    }
}
