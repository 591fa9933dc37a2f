package io.github.byzatic.workerpool.job;

import io.github.byzatic.workerpool.ObjectsUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Timestamps of one job. {@code submittedAt} is fixed at construction, {@code startedAt} and
 * {@code finishedAt} are each set at most once, start before finish.
 */
public final class JobStats implements Serializable {
    private static final long serialVersionUID = 1L;

    private final Instant submittedAt;
    private Instant startedAt = null;
    private Instant finishedAt = null;

    public JobStats(@NotNull Instant submittedAt) {
        this.submittedAt = Objects.requireNonNull(submittedAt, "submittedAt");
    }

    public @NotNull Instant getSubmittedAt() {
        return submittedAt;
    }

    public @Nullable Instant getStartedAt() {
        return startedAt;
    }

    public @Nullable Instant getFinishedAt() {
        return finishedAt;
    }

    public void markStarted(@NotNull Instant at) {
        Objects.requireNonNull(at, "at");
        ObjectsUtils.requireTrue(startedAt == null, new IllegalStateException("startedAt is already set"));
        this.startedAt = at;
    }

    public void markFinished(@NotNull Instant at) {
        Objects.requireNonNull(at, "at");
        ObjectsUtils.requireTrue(finishedAt == null, new IllegalStateException("finishedAt is already set"));
        ObjectsUtils.requireNonNull(startedAt, new IllegalStateException("job has not been started"));
        ObjectsUtils.requireTrue(!at.isBefore(startedAt),
                new IllegalArgumentException("finishedAt " + at + " precedes startedAt " + startedAt));
        this.finishedAt = at;
    }

    /**
     * @return time between start and finish, or {@link Duration#ZERO} while either is unset
     */
    public @NotNull Duration elapsed() {
        if (startedAt == null || finishedAt == null) return Duration.ZERO;
        return Duration.between(startedAt, finishedAt);
    }

    /**
     * Elapsed time in seconds, the unit used in log lines.
     */
    public double elapsedSeconds() {
        return elapsed().toNanos() / 1_000_000_000.0;
    }

    @Override
    public String toString() {
        return "JobStats{submittedAt=" + submittedAt + ", startedAt=" + startedAt + ", finishedAt=" + finishedAt + '}';
    }
}
