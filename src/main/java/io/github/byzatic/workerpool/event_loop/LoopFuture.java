package io.github.byzatic.workerpool.event_loop;

import io.github.byzatic.workerpool.ObjectsUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.BiConsumer;

/**
 * Single-assignment completion cell owned by an {@link EventLoop}.
 * It may only be settled from its loop thread, and {@link #whenDone} continuations always run there.
 */
public final class LoopFuture<T> {
    private final EventLoop loop;
    private final CompletableFuture<T> delegate = new CompletableFuture<>();

    LoopFuture(@NotNull EventLoop loop) {
        this.loop = Objects.requireNonNull(loop, "loop");
    }

    public @NotNull EventLoop getLoop() {
        return loop;
    }

    public void setResult(@Nullable T value) {
        checkLoopThread();
        ObjectsUtils.requireTrue(delegate.complete(value), new IllegalStateException("future is already done"));
    }

    public void setException(@NotNull Throwable error) {
        Objects.requireNonNull(error, "error");
        checkLoopThread();
        ObjectsUtils.requireTrue(delegate.completeExceptionally(error), new IllegalStateException("future is already done"));
    }

    public boolean isDone() {
        return delegate.isDone();
    }

    public boolean isCompletedExceptionally() {
        return delegate.isCompletedExceptionally();
    }

    /**
     * Registers a continuation that runs on the loop thread once the future settles.
     * The throwable passed on rejection is the exact error given to {@link #setException}.
     */
    public void whenDone(@NotNull BiConsumer<? super T, ? super Throwable> action) {
        Objects.requireNonNull(action, "action");
        delegate.whenCompleteAsync(action, loop);
    }

    /**
     * Read-only stage view. Use the {@code *Async(..., loop)} variants to keep continuations on the loop thread.
     */
    public @NotNull CompletionStage<T> asStage() {
        return delegate.minimalCompletionStage();
    }

    private void checkLoopThread() {
        ObjectsUtils.requireTrue(loop.inEventLoop(),
                new IllegalStateException("loop future settled outside of its event loop thread: " + Thread.currentThread().getName()));
    }
}
