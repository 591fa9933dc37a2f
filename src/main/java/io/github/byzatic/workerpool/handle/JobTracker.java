package io.github.byzatic.workerpool.handle;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.workerpool.ObjectsUtils;
import io.github.byzatic.workerpool.base_exceptions.OperationTimedOutException;
import io.github.byzatic.workerpool.job.Job;
import io.github.byzatic.workerpool.job.JobFailedError;
import io.github.byzatic.workerpool.job.JobStats;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * State shared by both handle flavors: the current job reference, the pool task and timing logs.
 */
@ThreadSafe
final class JobTracker<T> {
    private final static Logger logger = LoggerFactory.getLogger(JobTracker.class);
    private static final String NOT_SUBMITTED = "job was not properly submitted to worker pool";

    private final long jobId;

    @GuardedBy("this")
    private Job<T> job;

    @GuardedBy("this")
    private PoolTask<T> poolTask = null;

    JobTracker(@NotNull Job<T> job) {
        this.job = Objects.requireNonNull(job, "job");
        this.jobId = job.getId();
    }

    long getJobId() {
        return jobId;
    }

    synchronized @NotNull Job<T> getJob() {
        return job;
    }

    synchronized @NotNull JobStats getStats() {
        return ObjectsUtils.requireNonNull(job.getStats(), new IllegalStateException(NOT_SUBMITTED));
    }

    synchronized void attachPoolTask(@NotNull PoolTask<T> task) {
        Objects.requireNonNull(task, "task");
        ObjectsUtils.requireTrue(poolTask == null, new IllegalStateException("pool task is already attached to job " + jobId));
        this.poolTask = task;
    }

    private synchronized PoolTask<T> requirePoolTask() {
        return ObjectsUtils.requireNonNull(poolTask, new IllegalStateException(NOT_SUBMITTED));
    }

    T join() throws JobFailedError, InterruptedException {
        return requirePoolTask().get();
    }

    T join(@NotNull Duration timeout) throws JobFailedError, InterruptedException, OperationTimedOutException {
        return requirePoolTask().get(timeout);
    }

    void recordSuccess(@NotNull Job<T> completed, @NotNull Object owner) {
        synchronized (this) {
            this.job = Objects.requireNonNull(completed, "completed");
        }
        if (logger.isDebugEnabled()) logger.debug("{} finished in {}s", owner, seconds(completed));
    }

    /**
     * @throws IllegalArgumentException if {@code error} is not a {@link JobFailedError}
     */
    static @NotNull JobFailedError requireJobFailedError(@NotNull Throwable error) {
        if (!(error instanceof JobFailedError)) {
            throw new IllegalArgumentException("unexpected error type: " + error, error);
        }
        return (JobFailedError) error;
    }

    @SuppressWarnings("unchecked")
    void recordFailure(@NotNull JobFailedError error, @NotNull Object owner) {
        Job<T> failed = (Job<T>) error.getJob();
        synchronized (this) {
            this.job = failed;
        }
        if (logger.isDebugEnabled()) logger.debug("{} failed in {}s", owner, seconds(failed));
    }

    private static String seconds(Job<?> job) {
        JobStats stats = job.getStats();
        double elapsed = stats == null ? 0.0 : stats.elapsedSeconds();
        return String.format(Locale.ROOT, "%.2f", elapsed);
    }

    @Override
    public synchronized String toString() {
        return "(Handle) " + job;
    }
}
