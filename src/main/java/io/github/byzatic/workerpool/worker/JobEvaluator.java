package io.github.byzatic.workerpool.worker;

import io.github.byzatic.workerpool.ObjectsUtils;
import io.github.byzatic.workerpool.job.Job;
import io.github.byzatic.workerpool.job.JobFailedError;
import io.github.byzatic.workerpool.job.JobStats;
import org.jetbrains.annotations.NotNull;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Runs a job body inside a worker process.
 * <p>
 * A failure of the job function is stored on the job as a {@link JobFailedError} and is not
 * rethrown; the job is always returned with {@code finishedAt} recorded.
 */
public final class JobEvaluator {
    private final Clock clock;

    public JobEvaluator() {
        this(Clock.systemUTC());
    }

    public JobEvaluator(@NotNull Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws IllegalStateException if the job was not submitted through a pool (no stats)
     */
    public <T> @NotNull Job<T> evaluate(@NotNull Job<T> job) {
        JobStats stats = ObjectsUtils.requireNonNull(job.getStats(),
                new IllegalStateException("job was not properly submitted to worker pool"));
        Instant startedAt = clock.instant();
        stats.markStarted(startedAt);
        try {
            job.setResult(job.getFunc().call(job.getArgs().toArray()));
        } catch (Exception e) {
            job.setError(new JobFailedError(job, e));
        } finally {
            // wall clock may step back
            Instant finishedAt = clock.instant();
            stats.markFinished(finishedAt.isBefore(startedAt) ? startedAt : finishedAt);
        }
        return job;
    }
}
