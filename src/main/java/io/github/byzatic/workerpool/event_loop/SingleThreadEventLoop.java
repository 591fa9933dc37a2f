package io.github.byzatic.workerpool.event_loop;

import com.google.errorprone.annotations.ThreadSafe;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link EventLoop} backed by one daemon thread draining a FIFO queue.
 * A task that throws is logged; the loop keeps running.
 */
@ThreadSafe
public final class SingleThreadEventLoop implements EventLoop {
    private final static Logger logger = LoggerFactory.getLogger(SingleThreadEventLoop.class);

    private final BlockingQueue<Runnable> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final Thread thread;

    public SingleThreadEventLoop() {
        this("event-loop");
    }

    public SingleThreadEventLoop(@NotNull String threadName) {
        this.thread = new Thread(this::runLoop, Objects.requireNonNull(threadName, "threadName"));
        this.thread.setDaemon(true);
        this.thread.start();
        logger.debug("event loop {} started", threadName);
    }

    @Override
    public void callSoonThreadsafe(@NotNull Runnable task) {
        Objects.requireNonNull(task, "task");
        if (!running.get()) throw new IllegalStateException("event loop " + thread.getName() + " is closed");
        queue.offer(task);
    }

    @Override
    public <T> @NotNull LoopFuture<T> createFuture() {
        return new LoopFuture<>(this);
    }

    @Override
    public boolean inEventLoop() {
        return Thread.currentThread() == thread;
    }

    @Override
    public boolean isClosed() {
        return !running.get();
    }

    /**
     * Stops the loop. Tasks still queued are dropped.
     */
    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) return;
        thread.interrupt();
        if (!inEventLoop()) {
            try {
                thread.join(TimeUnit.SECONDS.toMillis(1));
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
        int dropped = queue.size();
        queue.clear();
        logger.debug("event loop {} closed, {} queued task(s) dropped", thread.getName(), dropped);
    }

    private void runLoop() {
        while (running.get()) {
            Runnable task;
            try {
                task = queue.take();
            } catch (InterruptedException ie) {
                if (!running.get()) break;
                continue;
            }
            try {
                task.run();
            } catch (Throwable t) {
                logger.error("Exception occurred in event loop task, keep running", t);
            }
        }
    }
}
