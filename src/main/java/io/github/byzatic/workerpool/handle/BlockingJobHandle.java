package io.github.byzatic.workerpool.handle;

import io.github.byzatic.workerpool.base_exceptions.OperationTimedOutException;
import io.github.byzatic.workerpool.job.Job;
import io.github.byzatic.workerpool.job.JobFailedError;
import io.github.byzatic.workerpool.job.JobStats;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;

/**
 * Handle whose callbacks only update local state; callers wait with {@link #join()}.
 */
public final class BlockingJobHandle<T> implements PooledJobHandle<T> {
    private final JobTracker<T> tracker;

    public BlockingJobHandle(@NotNull Job<T> job) {
        this.tracker = new JobTracker<>(job);
    }

    @Override
    public long getJobId() {
        return tracker.getJobId();
    }

    @Override
    public @NotNull JobStats getStats() {
        return tracker.getStats();
    }

    @Override
    public @NotNull Job<T> getJob() {
        return tracker.getJob();
    }

    @Override
    public T join() throws JobFailedError, InterruptedException {
        return tracker.join();
    }

    @Override
    public T join(@NotNull Duration timeout) throws JobFailedError, InterruptedException, OperationTimedOutException {
        return tracker.join(timeout);
    }

    @Override
    public void attachPoolTask(@NotNull PoolTask<T> poolTask) {
        tracker.attachPoolTask(poolTask);
    }

    @Override
    public void onSuccess(@NotNull Job<T> job) {
        tracker.recordSuccess(job, this);
    }

    @Override
    public void onFailure(@NotNull Throwable error) {
        tracker.recordFailure(JobTracker.requireJobFailedError(error), this);
    }

    @Override
    public String toString() {
        return tracker.toString();
    }
}
