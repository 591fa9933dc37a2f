package io.github.byzatic.workerpool.job;

import io.github.byzatic.workerpool.ObjectsUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.Serializable;
import java.lang.invoke.SerializedLambda;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A unit of dispatched work.
 * <p>
 * A job crosses into a worker process by value. The worker mutates its own copy and a fresh copy
 * comes back through the completion callback; the submitter's instance never observes worker-side
 * mutations.
 *
 * @param <T> result type
 */
public final class Job<T> implements Serializable {
    private static final long serialVersionUID = 1L;

    private final long id;
    private final JobFunction<T> func;
    private final List<Object> args;
    private JobStats stats = null;
    private T result = null;
    private JobFailedError error = null;

    public Job(long id, @NotNull JobFunction<T> func, Object... args) {
        this.id = id;
        this.func = Objects.requireNonNull(func, "func");
        this.args = Collections.unmodifiableList(Arrays.asList(args == null ? new Object[0] : args.clone()));
    }

    public long getId() {
        return id;
    }

    public @NotNull JobFunction<T> getFunc() {
        return func;
    }

    public @NotNull List<Object> getArgs() {
        return args;
    }

    public @Nullable JobStats getStats() {
        return stats;
    }

    /**
     * Attaches the timing record. Done once by the pool at submission time.
     */
    public void attachStats(@NotNull JobStats stats) {
        Objects.requireNonNull(stats, "stats");
        ObjectsUtils.requireTrue(this.stats == null, new IllegalStateException(this + " already has stats"));
        this.stats = stats;
    }

    public @Nullable T getResult() {
        return result;
    }

    public void setResult(@Nullable T result) {
        this.result = result;
    }

    public @Nullable JobFailedError getError() {
        return error;
    }

    public void setError(@Nullable JobFailedError error) {
        this.error = error;
    }

    public boolean isFailed() {
        return error != null;
    }

    /**
     * Logging name derived from the function: the implementing method for lambdas and method
     * references, the simple class name otherwise.
     */
    public @NotNull String getName() {
        return nameOf(func);
    }

    static String nameOf(JobFunction<?> func) {
        Class<?> type = func.getClass();
        if (type.isSynthetic() || type.getName().contains("$$Lambda")) {
            try {
                Method writeReplace = type.getDeclaredMethod("writeReplace");
                writeReplace.setAccessible(true);
                Object replacement = writeReplace.invoke(func);
                if (replacement instanceof SerializedLambda) {
                    return ((SerializedLambda) replacement).getImplMethodName();
                }
            } catch (ReflectiveOperationException | RuntimeException ignored) {
                // not a serializable lambda, fall through to the class name
            }
        }
        String simple = type.getSimpleName();
        return simple.isEmpty() ? type.getName() : simple;
    }

    @Override
    public String toString() {
        return "Job " + id + " - " + getName();
    }
}
