package io.github.byzatic.workerpool.worker;

import io.github.byzatic.workerpool.job.Job;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.Serializable;

/**
 * What a worker process sends back for one job: either the evaluated job, or a pool-level
 * failure that prevented evaluation or transfer.
 */
public final class WorkerReply implements Serializable {
    private static final long serialVersionUID = 1L;

    private final Job<?> job;
    private final Throwable failure;

    private WorkerReply(Job<?> job, Throwable failure) {
        this.job = job;
        this.failure = failure;
    }

    public static @NotNull WorkerReply evaluated(@NotNull Job<?> job) {
        return new WorkerReply(job, null);
    }

    public static @NotNull WorkerReply failed(@NotNull Throwable failure) {
        return new WorkerReply(null, failure);
    }

    public @Nullable Job<?> getJob() {
        return job;
    }

    public @Nullable Throwable getFailure() {
        return failure;
    }

    public boolean isFailure() {
        return failure != null;
    }
}
