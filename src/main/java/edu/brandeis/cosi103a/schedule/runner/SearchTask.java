package edu.brandeis.cosi103a.schedule.runner;

import edu.brandeis.cosi103a.schedule.model.SchedulePath;
import edu.brandeis.cosi103a.schedule.search.ExplorationResult;
import edu.brandeis.cosi103a.schedule.search.PathSearch;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.function.BooleanSupplier;

/**
 * One bounded unit of work: explores the continuations of a single input path on a worker
 * thread and reports back through the message queue. Never touches the result file.
 */
class SearchTask implements Runnable {

    static final int BATCH_SIZE = 100;

    private final int unit;
    private final SchedulePath input;
    private final long skipOffset;
    private final int breadthLimit;
    private final ThreadLocal<PathSearch> searches;
    private final Queue<WorkerMessage> messages;
    private final BooleanSupplier stopRequested;

    SearchTask(int unit, SchedulePath input, long skipOffset, int breadthLimit,
               ThreadLocal<PathSearch> searches, Queue<WorkerMessage> messages, BooleanSupplier stopRequested) {
        this.unit = unit;
        this.input = input;
        this.skipOffset = skipOffset;
        this.breadthLimit = breadthLimit;
        this.searches = searches;
        this.messages = messages;
        this.stopRequested = stopRequested;
    }

    @Override
    public void run() {
        List<SchedulePath> batch = new ArrayList<>(BATCH_SIZE);
        try {
            ExplorationResult result = searches.get().explore(input, skipOffset, breadthLimit, path -> {
                batch.add(path);
                if (batch.size() >= BATCH_SIZE) {
                    messages.add(new WorkerMessage.Found(unit, List.copyOf(batch)));
                    batch.clear();
                }
            }, () -> stopRequested.getAsBoolean() || Thread.currentThread().isInterrupted());
            if (!batch.isEmpty()) {
                messages.add(new WorkerMessage.Found(unit, List.copyOf(batch)));
            }
            messages.add(new WorkerMessage.Finished(unit, result));
        } catch (RuntimeException | Error e) {
            messages.add(new WorkerMessage.Failed(unit, e));
        }
    }
}
