package edu.brandeis.cosi103a.schedule.runner;

/**
 * Progress callback for search runs. Called on the coordinator thread.
 */
@FunctionalInterface
public interface ProgressListener {
    void onProgress(SearchProgress progress);
}
