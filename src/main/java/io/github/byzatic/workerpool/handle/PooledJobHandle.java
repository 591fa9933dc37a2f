package io.github.byzatic.workerpool.handle;

import org.jetbrains.annotations.NotNull;

/**
 * A handle the pool can wire: it receives completion callbacks and is bound to the pool task
 * that {@link JobHandle#join()} waits on.
 */
public interface PooledJobHandle<T> extends JobHandle<T>, JobCompletionListener<T> {

    /**
     * Called once by the pool during submission.
     */
    void attachPoolTask(@NotNull PoolTask<T> poolTask);
}
