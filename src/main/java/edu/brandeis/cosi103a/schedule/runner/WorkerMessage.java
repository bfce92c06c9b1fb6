package edu.brandeis.cosi103a.schedule.runner;

import edu.brandeis.cosi103a.schedule.model.SchedulePath;
import edu.brandeis.cosi103a.schedule.search.ExplorationResult;

import java.util.List;

/**
 * Messages from search workers to the coordinator. {@code unit} is the position of the
 * input path in the source file.
 */
interface WorkerMessage {

    int unit();

    /** A batch of new full-length paths, in discovery order. */
    record Found(int unit, List<SchedulePath> paths) implements WorkerMessage {
    }

    /** The unit ended normally; sent after its last batch. */
    record Finished(int unit, ExplorationResult result) implements WorkerMessage {
    }

    record Failed(int unit, Throwable error) implements WorkerMessage {
    }
}
