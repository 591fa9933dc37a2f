package io.github.byzatic.workerpool.handle;

import io.github.byzatic.workerpool.base_exceptions.OperationTimedOutException;
import io.github.byzatic.workerpool.event_loop.EventLoop;
import io.github.byzatic.workerpool.event_loop.LoopFuture;
import io.github.byzatic.workerpool.job.Job;
import io.github.byzatic.workerpool.job.JobFailedError;
import io.github.byzatic.workerpool.job.JobStats;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.BiConsumer;

/**
 * Awaitable handle. Completion callbacks arrive on the pool's result handler thread and are
 * handed over to the event loop that owns the future; the future is only settled there.
 * On success the future resolves with the job result, on failure it is rejected with the inner error.
 */
public final class AsyncJobHandle<T> implements PooledJobHandle<T>, Awaitable<T> {
    private final JobTracker<T> tracker;
    private final LoopFuture<T> future;

    public AsyncJobHandle(@NotNull Job<T> job, @NotNull LoopFuture<T> future) {
        this.tracker = new JobTracker<>(job);
        this.future = Objects.requireNonNull(future, "future");
    }

    public @NotNull EventLoop getLoop() {
        return future.getLoop();
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

    /**
     * Blocks the calling thread. Never call it from the loop thread of this handle.
     */
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
        Objects.requireNonNull(job, "job");
        future.getLoop().callSoonThreadsafe(() -> {
            tracker.recordSuccess(job, this);
            future.setResult(job.getResult());
        });
    }

    @Override
    public void onFailure(@NotNull Throwable error) {
        JobFailedError failed = JobTracker.requireJobFailedError(error);
        future.getLoop().callSoonThreadsafe(() -> {
            tracker.recordFailure(failed, this);
            future.setException(failed.getInnerError());
        });
    }

    @Override
    public void whenDone(@NotNull BiConsumer<? super T, ? super Throwable> continuation) {
        future.whenDone(continuation);
    }

    @Override
    public @NotNull CompletionStage<T> asStage() {
        return future.asStage();
    }

    @Override
    public boolean isDone() {
        return future.isDone();
    }

    @Override
    public String toString() {
        return tracker.toString();
    }
}
