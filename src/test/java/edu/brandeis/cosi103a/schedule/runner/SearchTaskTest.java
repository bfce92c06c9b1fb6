package edu.brandeis.cosi103a.schedule.runner;

import edu.brandeis.cosi103a.schedule.model.SchedulePath;
import edu.brandeis.cosi103a.schedule.model.WeekSchedule;
import edu.brandeis.cosi103a.schedule.search.ExplorationResult;
import edu.brandeis.cosi103a.schedule.search.PathSearch;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SearchTaskTest {

    private static final SchedulePath INPUT = SchedulePath.of(WeekSchedule.of(0, 1, 5, 2, 7, 11, 12, 13, 14));

    @Test
    void run_sendsResultsInBatchesThenFinished() {
        PathSearch search = mock(PathSearch.class);
        doAnswer(invocation -> {
            Consumer<SchedulePath> sink = invocation.getArgument(3);
            for (int i = 0; i < 150; i++) {
                sink.accept(INPUT);
            }
            return new ExplorationResult(160, 150, true);
        }).when(search).explore(eq(INPUT), eq(10L), eq(0), any(), any());
        Queue<WorkerMessage> messages = new ArrayDeque<>();

        new SearchTask(7, INPUT, 10, 0, ThreadLocal.withInitial(() -> search), messages, () -> false).run();

        assertEquals(3, messages.size());
        WorkerMessage.Found first = (WorkerMessage.Found) messages.poll();
        WorkerMessage.Found second = (WorkerMessage.Found) messages.poll();
        WorkerMessage.Finished done = (WorkerMessage.Finished) messages.poll();
        assertEquals(SearchTask.BATCH_SIZE, first.paths().size());
        assertEquals(50, second.paths().size());
        assertEquals(7, done.unit());
        assertTrue(done.result().exhausted());
    }

    @Test
    void run_reportsFailureInsteadOfThrowing() {
        PathSearch search = mock(PathSearch.class);
        when(search.explore(any(), anyLong(), anyInt(), any(), any())).thenThrow(new IllegalStateException("boom"));
        Queue<WorkerMessage> messages = new ArrayDeque<>();

        new SearchTask(3, INPUT, 0, 5, ThreadLocal.withInitial(() -> search), messages, () -> false).run();

        WorkerMessage.Failed failed = (WorkerMessage.Failed) messages.poll();
        assertNotNull(failed);
        assertEquals(3, failed.unit());
        assertEquals("boom", failed.error().getMessage());
        assertTrue(messages.isEmpty());
    }

    @Test
    void run_passesStopRequestToSearch() {
        PathSearch search = mock(PathSearch.class);
        doAnswer(invocation -> {
            BooleanSupplier cancelled = invocation.getArgument(4);
            return new ExplorationResult(0, 0, !cancelled.getAsBoolean());
        }).when(search).explore(any(), anyLong(), anyInt(), any(), any());
        Queue<WorkerMessage> messages = new ArrayDeque<>();

        new SearchTask(0, INPUT, 0, 5, ThreadLocal.withInitial(() -> search), messages, () -> true).run();

        WorkerMessage.Finished done = (WorkerMessage.Finished) messages.poll();
        assertFalse(done.result().exhausted());
    }
}
