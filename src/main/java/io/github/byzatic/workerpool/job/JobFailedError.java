package io.github.byzatic.workerpool.job;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A job together with the error that made it fail. The inner error is also the exception cause.
 */
public class JobFailedError extends Exception {
    private static final long serialVersionUID = 1L;

    private final Job<?> job;

    public JobFailedError(@NotNull Job<?> job, @NotNull Throwable innerError) {
        super(job + " failed: " + innerError, Objects.requireNonNull(innerError, "innerError"));
        this.job = Objects.requireNonNull(job, "job");
    }

    public @NotNull Job<?> getJob() {
        return job;
    }

    public @NotNull Throwable getInnerError() {
        return getCause();
    }
}
