package edu.brandeis.cosi103a.schedule.runner;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class ScheduleSearchRunnerTest {

    @Test
    void parseArgs_acceptsBothFlagForms() {
        SearchConfig config = ScheduleSearchRunner.parseArgs(new String[] {
            "--teams", "8", "--weeks=3", "--workers", "4", "--breadth=100", "--output", "out",
            "--cache=0", "--diversify", "--verbose"});

        assertEquals(8, config.teams());
        assertEquals(3, config.weeks());
        assertEquals(4, config.workers());
        assertEquals(100, config.breadth());
        assertEquals("out", config.outputDir());
        assertEquals(0, config.cacheWeeks());
        assertTrue(config.diversify());
        assertTrue(config.verbose());
        assertFalse(config.validate());
    }

    @Test
    void parseArgs_fillsDefaults() {
        SearchConfig config = ScheduleSearchRunner.parseArgs(new String[] {"--teams=10", "--weeks=2"});

        assertEquals(SearchConfig.defaults(10, 2), config);
    }

    @Test
    void parseArgs_rejectsUnknownMissingAndMalformed() {
        assertThrows(IllegalArgumentException.class,
            () -> ScheduleSearchRunner.parseArgs(new String[] {"--teams=8", "--weeks=2", "--fast"}));
        assertThrows(IllegalArgumentException.class,
            () -> ScheduleSearchRunner.parseArgs(new String[] {"--teams=8"}));
        assertThrows(IllegalArgumentException.class,
            () -> ScheduleSearchRunner.parseArgs(new String[] {"--teams=8", "--weeks"}));
        assertThrows(IllegalArgumentException.class,
            () -> ScheduleSearchRunner.parseArgs(new String[] {"--teams=eight", "--weeks=2"}));
    }

    @Test
    void resumeCommand_repeatsTheSettingsThatShapeTheFile() {
        SearchConfig config = new SearchConfig(8, 3, 4, 50, "out", 10, true, false, false);

        String command = ScheduleSearchRunner.resumeCommand(config);

        for (String part : List.of("--teams=8", "--weeks=3", "--workers=4", "--breadth=50", "--output=out",
                "--cache=10", "--diversify")) {
            assertTrue(command.contains(part), command);
        }
    }

    @Test
    void requireValid_rejectsBadSettings() {
        assertThrows(ScheduleConfigurationException.class, () -> SearchConfig.defaults(5, 2).requireValid());
        assertThrows(ScheduleConfigurationException.class, () -> SearchConfig.defaults(8, 0).requireValid());
        assertThrows(ScheduleConfigurationException.class,
            () -> new SearchConfig(8, 2, 0, 0, "out", 0, false, false, false).requireValid());
    }

    @Test
    void formatDuration_picksReadableUnits() {
        assertEquals("42s", ConsoleProgress.formatDuration(42_000));
        assertEquals("2m 5s", ConsoleProgress.formatDuration(125_000));
        assertEquals("3h 1m", ConsoleProgress.formatDuration(10_860_000));
    }

    @Test
    void checkpointOnExit_haltsWithTheSearchExitCodeAfterCheckpoint() throws Exception {
        SearchCoordinator coordinator = mock(SearchCoordinator.class);
        AtomicInteger halted = new AtomicInteger(-1);
        ScheduleSearchRunner.CheckpointOnExit hook = new ScheduleSearchRunner.CheckpointOnExit(coordinator, halted::set);

        hook.start();
        verify(coordinator, timeout(5000)).requestStop();
        assertEquals(-1, halted.get());
        hook.finished(ScheduleSearchRunner.EXIT_OK);
        hook.join(5000);

        assertFalse(hook.isAlive());
        assertEquals(ScheduleSearchRunner.EXIT_OK, halted.get());
    }

    @Test
    void checkpointOnExit_failedSearch_haltsWithFailureCode() {
        SearchCoordinator coordinator = mock(SearchCoordinator.class);
        AtomicInteger halted = new AtomicInteger(-1);
        ScheduleSearchRunner.CheckpointOnExit hook = new ScheduleSearchRunner.CheckpointOnExit(coordinator, halted::set);
        hook.finished(ScheduleSearchRunner.EXIT_FAILED);

        hook.run();

        verify(coordinator).requestStop();
        assertEquals(ScheduleSearchRunner.EXIT_FAILED, halted.get());
    }
}
