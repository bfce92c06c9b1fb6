package edu.brandeis.cosi103a.schedule.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.schedule.model.League;
import edu.brandeis.cosi103a.schedule.model.SchedulePath;
import edu.brandeis.cosi103a.schedule.model.WeekScore;
import edu.brandeis.cosi103a.schedule.search.RoundTracker;
import edu.brandeis.cosi103a.schedule.tree.TreeFormatException;
import edu.brandeis.cosi103a.schedule.tree.TreeHeader;
import edu.brandeis.cosi103a.schedule.tree.TreeReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SearchCoordinatorTest {

    // Six teams: 48 week-0 schedules, 36 optimal second weeks for each.
    private static final int TWO_WEEK_PATHS = 48 * 36;

    private static SearchConfig config(Path dir, int weeks, int breadth) {
        return config(dir, weeks, breadth, false);
    }

    private static SearchConfig config(Path dir, int weeks, int breadth, boolean diversify) {
        return new SearchConfig(6, weeks, 2, breadth, dir.toString(), 10_000, diversify, false, false);
    }

    /** Runs a 2-week search that stops as soon as the first unit reports. */
    private static RunSummary runUntilFirstResult(SearchConfig config) throws Exception {
        AtomicReference<SearchCoordinator> running = new AtomicReference<>();
        ProgressListener stopOnFirstResult = progress -> {
            if (progress.state() == SearchProgress.State.RUNNING) {
                running.get().requestStop();
            }
        };
        SearchCoordinator coordinator = new SearchCoordinator(config, stopOnFirstResult);
        running.set(coordinator);
        return coordinator.run();
    }

    @Test
    void run_oneWeek_writesSeedFileAndSummary(@TempDir Path dir) throws Exception {
        RunSummary summary = new SearchCoordinator(config(dir, 1, 0), null).run();

        Path file = dir.resolve("6teams-1week.txt");
        assertEquals(48, summary.count());
        assertEquals(new TreeHeader(6, 1, 48, false), TreeReader.readHeader(file));
        assertTrue(Files.exists(dir.resolve("6teams-1week.json")));
    }

    @Test
    void run_twoWeeks_storesEveryOptimalPath(@TempDir Path dir) throws Exception {
        RunSummary summary = new SearchCoordinator(config(dir, 2, 0), null).run();

        Path file = dir.resolve("6teams-2weeks.txt");
        List<SchedulePath> paths = TreeReader.readAll(file);
        assertEquals(TWO_WEEK_PATHS, summary.count());
        assertFalse(summary.partial());
        assertEquals(TWO_WEEK_PATHS, paths.size());
        assertEquals(TWO_WEEK_PATHS, new HashSet<>(paths).size());
        assertEquals(new TreeHeader(6, 2, TWO_WEEK_PATHS, false), TreeReader.readHeader(file));

        League league = League.of(6);
        RoundTracker tracker = new RoundTracker(league);
        for (SchedulePath path : paths) {
            assertEquals(WeekScore.OPTIMAL.times(2), WeekScore.of(league, path));
            tracker.replay(path);
        }
    }

    @Test
    void run_smallBreadth_needsSeveralRoundsButFindsTheSameSet(@TempDir Path dir) throws Exception {
        Path unlimited = dir.resolve("unlimited");
        Path narrow = dir.resolve("narrow");
        new SearchCoordinator(config(unlimited, 2, 0), null).run();

        RunSummary summary = new SearchCoordinator(config(narrow, 2, 5), null).run();

        assertEquals(8, summary.fairnessRounds());
        assertEquals(48, summary.continuations().inputPaths());
        assertEquals(36, summary.continuations().min());
        assertEquals(36, summary.continuations().max());
        assertEquals(pathsIn(unlimited), pathsIn(narrow));
    }

    @Test
    void run_completeFile_isLeftAlone(@TempDir Path dir) throws Exception {
        new SearchCoordinator(config(dir, 2, 0), null).run();
        Path file = dir.resolve("6teams-2weeks.txt");
        byte[] before = Files.readAllBytes(file);

        RunSummary again = new SearchCoordinator(config(dir, 2, 0), null).run();

        assertEquals(TWO_WEEK_PATHS, again.count());
        assertEquals(0, again.newPaths());
        assertArrayEquals(before, Files.readAllBytes(file));
    }

    @Test
    void run_interruptedThenResumed_matchesUninterruptedRun(@TempDir Path dir) throws Exception {
        Path baseline = dir.resolve("baseline");
        Path resumed = dir.resolve("resumed");
        new SearchCoordinator(config(baseline, 2, 0), null).run();

        AtomicReference<SearchCoordinator> running = new AtomicReference<>();
        ProgressListener stopOnFirstResult = progress -> {
            if (progress.state() == SearchProgress.State.RUNNING) {
                running.get().requestStop();
            }
        };
        SearchCoordinator first = new SearchCoordinator(config(resumed, 2, 5), stopOnFirstResult);
        running.set(first);
        RunSummary interrupted = first.run();

        Path file = resumed.resolve("6teams-2weeks.txt");
        assertTrue(interrupted.interrupted());
        assertTrue(interrupted.partial());
        assertTrue(TreeReader.readHeader(file).partial());
        assertTrue(interrupted.count() < TWO_WEEK_PATHS);

        RunSummary finished = new SearchCoordinator(config(resumed, 2, 5), null).run();

        assertFalse(finished.partial());
        assertFalse(finished.interrupted());
        assertEquals(TWO_WEEK_PATHS, finished.count());
        assertEquals(TWO_WEEK_PATHS - interrupted.count(), finished.newPaths());
        assertEquals(TWO_WEEK_PATHS, TreeReader.readAll(file).size());
        assertEquals(pathsIn(baseline), pathsIn(resumed));
        assertFalse(Files.exists(ResultFiles.temporaryFile(file)));
    }

    @Test
    void run_resumeWithOtherDiversifySetting_isRejected(@TempDir Path dir) throws Exception {
        RunSummary interrupted = runUntilFirstResult(config(dir, 2, 5, true));
        Path file = dir.resolve("6teams-2weeks.txt");
        byte[] before = Files.readAllBytes(file);
        assertTrue(interrupted.partial());

        SearchCoordinator plain = new SearchCoordinator(config(dir, 2, 5, false), null);

        assertThrows(ScheduleConfigurationException.class, plain::run);
        assertArrayEquals(before, Files.readAllBytes(file));
    }

    @Test
    void run_diversifiedRunResumedDiversified_matchesUninterruptedRun(@TempDir Path dir) throws Exception {
        Path baseline = dir.resolve("baseline");
        Path resumed = dir.resolve("resumed");
        new SearchCoordinator(config(baseline, 2, 0), null).run();
        runUntilFirstResult(config(resumed, 2, 5, true));

        RunSummary finished = new SearchCoordinator(config(resumed, 2, 5, true), null).run();

        assertFalse(finished.partial());
        assertEquals(TWO_WEEK_PATHS, finished.count());
        assertEquals(pathsIn(baseline), pathsIn(resumed));
    }

    @Test
    void run_stoppedRun_recordsDiversifySettingInSummary(@TempDir Path dir) throws Exception {
        SearchCoordinator stopped = new SearchCoordinator(config(dir, 2, 0, true), null);
        stopped.requestStop();
        stopped.run();

        JsonNode json = new ObjectMapper().readTree(dir.resolve("6teams-2weeks.json").toFile());
        assertTrue(json.get("partial").asBoolean());
        assertTrue(json.get("config").get("diversify").asBoolean());
    }

    @Test
    void run_resumeDropsDamagedStoredPathAndFindsItsReplacement(@TempDir Path dir) throws Exception {
        Path baseline = dir.resolve("baseline");
        Path resumed = dir.resolve("resumed");
        new SearchCoordinator(config(baseline, 2, 0), null).run();
        runUntilFirstResult(config(resumed, 2, 5));
        Path file = resumed.resolve("6teams-2weeks.txt");
        // Parses as a second week of the last branch, but plays matchup 1 twice.
        Files.writeString(file, "\t0,1,5,2,7,11,12,13,1\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        RunSummary finished = new SearchCoordinator(config(resumed, 2, 5), null).run();

        assertFalse(finished.partial());
        assertEquals(TWO_WEEK_PATHS, finished.count());
        assertEquals(pathsIn(baseline), pathsIn(resumed));
        League league = League.of(6);
        for (SchedulePath path : TreeReader.readAll(file)) {
            assertTrue(path.week(1).isValid(league));
        }
    }

    @Test
    void run_stoppedBeforeStart_leavesResumablePartialFile(@TempDir Path dir) throws Exception {
        SearchCoordinator stopped = new SearchCoordinator(config(dir, 2, 0), null);
        stopped.requestStop();

        RunSummary first = stopped.run();
        RunSummary second = new SearchCoordinator(config(dir, 2, 0), null).run();

        assertTrue(first.partial());
        assertEquals(0, first.count());
        assertFalse(second.partial());
        assertEquals(TWO_WEEK_PATHS, second.count());
    }

    @Test
    void run_invalidInputPath_isSkipped(@TempDir Path dir) throws Exception {
        new SearchCoordinator(config(dir, 1, 0), null).run();
        Files.writeString(dir.resolve("6teams-1week.txt"), "0,0,5,2,7,11,12,13,14\n",
            StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        RunSummary summary = new SearchCoordinator(config(dir, 2, 0), null).run();

        assertEquals(TWO_WEEK_PATHS, summary.count());
        assertEquals(49, summary.continuations().inputPaths());
        assertEquals(49, summary.completedInputPaths());
    }

    @Test
    void run_writesJsonSummaryNextToResult(@TempDir Path dir) throws Exception {
        new SearchCoordinator(config(dir, 2, 0), null).run();

        JsonNode json = new ObjectMapper().readTree(dir.resolve("6teams-2weeks.json").toFile());
        assertEquals(TWO_WEEK_PATHS, json.get("count").asLong());
        assertEquals(6, json.get("config").get("teams").asInt());
        assertFalse(json.get("partial").asBoolean());
    }

    @Test
    void run_validateMode_searchesWithoutFiles(@TempDir Path dir) throws Exception {
        SearchConfig config = new SearchConfig(6, 2, 2, 0, dir.resolve("out").toString(), 10_000, false, true, false);

        RunSummary summary = new SearchCoordinator(config, null).run();

        assertEquals(TWO_WEEK_PATHS, summary.count());
        assertNull(summary.resultFile());
        assertFalse(Files.exists(dir.resolve("out")));
    }

    @Test
    void run_reportsProgressToListener(@TempDir Path dir) throws Exception {
        ProgressListener listener = mock(ProgressListener.class);

        new SearchCoordinator(config(dir, 2, 10), listener).run();

        verify(listener).onProgress(argThat(p -> p.state() == SearchProgress.State.STARTING && p.inputPaths() == 48));
        verify(listener, atLeastOnce()).onProgress(argThat(p -> p.state() == SearchProgress.State.RUNNING));
        verify(listener).onProgress(argThat(p -> p.state() == SearchProgress.State.COMPLETED
            && p.found() == TWO_WEEK_PATHS && p.completedPaths() == 48));
    }

    @Test
    void run_partialTargetWithoutSource_isConfigurationError(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("6teams-3weeks.txt"), "# teams=6 weeks=3 count=0 (partial)\n");

        SearchCoordinator coordinator = new SearchCoordinator(config(dir, 3, 0), null);

        assertThrows(ScheduleConfigurationException.class, coordinator::run);
    }

    @Test
    void run_targetForAnotherLeague_isRejected(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("6teams-2weeks.txt"), "# teams=8 weeks=2 count=0\n");

        assertThrows(TreeFormatException.class, () -> new SearchCoordinator(config(dir, 2, 0), null).run());
    }

    @Test
    void run_onlyOnce(@TempDir Path dir) throws Exception {
        SearchCoordinator coordinator = new SearchCoordinator(config(dir, 1, 0), null);
        coordinator.run();

        assertThrows(IllegalStateException.class, coordinator::run);
    }

    @Test
    void constructor_rejectsInvalidConfig() {
        assertThrows(ScheduleConfigurationException.class,
            () -> new SearchCoordinator(new SearchConfig(7, 2, 1, 0, "out", 0, false, false, false), null));
    }

    private static Set<SchedulePath> pathsIn(Path dir) throws Exception {
        return new HashSet<>(TreeReader.readAll(dir.resolve("6teams-2weeks.txt")));
    }
}
