package io.github.byzatic.workerpool.event_loop;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.Executor;

/**
 * A single-threaded cooperative loop. State owned by the loop, such as the futures it creates,
 * is only touched from the loop thread; other threads hand work over with
 * {@link #callSoonThreadsafe(Runnable)}.
 */
public interface EventLoop extends Executor, AutoCloseable {

    /**
     * Queues {@code task} to run on the loop thread. Safe to call from any thread, never blocks.
     *
     * @throws IllegalStateException if the loop is closed
     */
    void callSoonThreadsafe(@NotNull Runnable task);

    <T> @NotNull LoopFuture<T> createFuture();

    /**
     * @return true when called from the loop thread
     */
    boolean inEventLoop();

    boolean isClosed();

    @Override
    default void execute(@NotNull Runnable command) {
        callSoonThreadsafe(command);
    }

    @Override
    void close();
}
