package io.github.byzatic.workerpool.handle;

import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.workerpool.ObjectsUtils;
import io.github.byzatic.workerpool.base_exceptions.OperationTimedOutException;
import io.github.byzatic.workerpool.job.Job;
import io.github.byzatic.workerpool.job.JobFailedError;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The pool's record of one dispatched job. Settled once by the pool after the handle callback ran.
 */
@ThreadSafe
public final class PoolTask<T> {
    private final CompletableFuture<Job<T>> outcome = new CompletableFuture<>();

    public void complete(@NotNull Job<T> job) {
        Objects.requireNonNull(job, "job");
        ObjectsUtils.requireTrue(outcome.complete(job), new IllegalStateException("pool task is already settled"));
    }

    public void fail(@NotNull JobFailedError error) {
        Objects.requireNonNull(error, "error");
        ObjectsUtils.requireTrue(outcome.completeExceptionally(error), new IllegalStateException("pool task is already settled"));
    }

    public boolean isDone() {
        return outcome.isDone();
    }

    public T get() throws JobFailedError, InterruptedException {
        try {
            return outcome.get().getResult();
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    public T get(@NotNull Duration timeout) throws JobFailedError, InterruptedException, OperationTimedOutException {
        try {
            return outcome.get(timeout.toNanos(), TimeUnit.NANOSECONDS).getResult();
        } catch (ExecutionException e) {
            throw unwrap(e);
        } catch (TimeoutException e) {
            throw new OperationTimedOutException(timeout, "pool task");
        }
    }

    private static JobFailedError unwrap(ExecutionException e) {
        if (e.getCause() instanceof JobFailedError) return (JobFailedError) e.getCause();
        throw new IllegalStateException("pool task settled with an unexpected error", e.getCause());
    }
}
