package io.github.byzatic.workerpool.handle;

import io.github.byzatic.workerpool.job.Job;
import org.jetbrains.annotations.NotNull;

/**
 * Completion callbacks invoked by the pool on its result handler thread, never on the submitting
 * thread or on an event loop thread.
 */
public interface JobCompletionListener<T> {

    /**
     * @param job the evaluated copy returned by the worker process
     */
    void onSuccess(@NotNull Job<T> job);

    /**
     * @param error expected to be a {@link io.github.byzatic.workerpool.job.JobFailedError}
     * @throws IllegalArgumentException for any other error type
     */
    void onFailure(@NotNull Throwable error);
}
