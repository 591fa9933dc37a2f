package io.github.byzatic.workerpool.handle;

import io.github.byzatic.workerpool.base_exceptions.OperationTimedOutException;
import io.github.byzatic.workerpool.job.Job;
import io.github.byzatic.workerpool.job.JobFailedError;
import io.github.byzatic.workerpool.job.JobStats;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;

/**
 * Submitter-side view of a job.
 */
public interface JobHandle<T> {

    long getJobId();

    /**
     * @throws IllegalStateException if the job was never submitted to a pool
     */
    @NotNull JobStats getStats();

    /**
     * The job as currently known to the submitter: the submitted instance until a completion
     * callback replaces it with the copy evaluated by the worker.
     */
    @NotNull Job<T> getJob();

    /**
     * Blocks until the pool delivers an outcome for this job.
     *
     * @return the job result
     * @throws JobFailedError        if the pool reported a failure
     * @throws IllegalStateException if the job was never submitted to a pool
     */
    T join() throws JobFailedError, InterruptedException;

    /**
     * Same as {@link #join()} with an upper bound on the wait.
     *
     * @throws OperationTimedOutException if no outcome arrived in time
     */
    T join(@NotNull Duration timeout) throws JobFailedError, InterruptedException, OperationTimedOutException;
}
