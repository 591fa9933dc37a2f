package io.github.byzatic.workerpool.handle;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletionStage;
import java.util.function.BiConsumer;

/**
 * Something a task running on an event loop can suspend on without blocking the loop thread.
 */
public interface Awaitable<T> {

    /**
     * Resumes {@code continuation} on the loop thread once a value or an error is available.
     */
    void whenDone(@NotNull BiConsumer<? super T, ? super Throwable> continuation);

    @NotNull CompletionStage<T> asStage();

    boolean isDone();
}
