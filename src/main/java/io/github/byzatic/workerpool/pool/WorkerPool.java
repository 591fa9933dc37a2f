package io.github.byzatic.workerpool.pool;

import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.workerpool.base_exceptions.ExternalProcessException;
import io.github.byzatic.workerpool.event_loop.EventLoop;
import io.github.byzatic.workerpool.event_loop.SingleThreadEventLoop;
import io.github.byzatic.workerpool.handle.AsyncJobHandle;
import io.github.byzatic.workerpool.handle.BlockingJobHandle;
import io.github.byzatic.workerpool.handle.PoolTask;
import io.github.byzatic.workerpool.handle.PooledJobHandle;
import io.github.byzatic.workerpool.job.Job;
import io.github.byzatic.workerpool.job.JobFailedError;
import io.github.byzatic.workerpool.job.JobFunction;
import io.github.byzatic.workerpool.job.JobStats;
import io.github.byzatic.workerpool.worker.FrameCodec;
import io.github.byzatic.workerpool.worker.WorkerProcess;
import io.github.byzatic.workerpool.worker.WorkerReply;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * WorkerPool - dispatches jobs to a fixed set of worker processes.
 * - {@link #submit} returns an awaitable handle immediately, {@link #submitBlocking} a joinable one.
 * - Each worker process has a dispatch thread; outcomes are delivered to handles on a single
 * result handler thread, never on the event loop thread.
 * - Job ids are unique and increasing in submission order; completion order is unspecified.
 * - {@link #close()} kills the worker processes. Jobs still queued or running are abandoned and
 * their handles never complete: join or await everything before closing.
 */
@ThreadSafe
public final class WorkerPool implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private final List<String> workerCommand;
    private final List<WorkerSlot> slots = new ArrayList<>();
    private final BlockingQueue<PendingJob<?>> pending = new LinkedBlockingQueue<>();
    private final ExecutorService resultHandler;
    private final AtomicLong jobIdCounter = new AtomicLong(0);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final EventLoop loop;
    private final boolean ownsLoop;
    private final UserFailurePolicy failurePolicy;
    private final Clock clock;
    private final List<JobEventListener> listeners;

    private WorkerPool(Builder b) throws ExternalProcessException {
        this.workerCommand = WorkerProcess.command(b.javaExecutable, b.classpath, b.jvmOptions);
        this.failurePolicy = b.failurePolicy;
        this.clock = b.clock;
        this.listeners = new CopyOnWriteArrayList<>(b.listeners);
        this.ownsLoop = b.eventLoop == null;
        this.loop = ownsLoop ? new SingleThreadEventLoop("worker-pool-event-loop") : b.eventLoop;
        this.resultHandler = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "worker-pool-result-handler");
            t.setDaemon(true);
            return t;
        });

        try {
            for (int i = 0; i < b.processes; i++) {
                slots.add(new WorkerSlot(i));
            }
        } catch (ExternalProcessException e) {
            close();
            throw e;
        }
        for (WorkerSlot slot : slots) slot.thread.start();
        logger.debug("worker pool created with {} worker process(es)", slots.size());
    }

    public static final class Builder {
        private int processes = Runtime.getRuntime().availableProcessors();
        private String javaExecutable = Paths.get(System.getProperty("java.home"), "bin", "java").toString();
        private String classpath = System.getProperty("java.class.path");
        private final List<String> jvmOptions = new ArrayList<>();
        private EventLoop eventLoop = null;
        private UserFailurePolicy failurePolicy = UserFailurePolicy.SURFACE;
        private Clock clock = Clock.systemUTC();
        private final List<JobEventListener> listeners = new CopyOnWriteArrayList<>();

        /**
         * Number of worker processes, defaults to the number of available processors.
         */
        public Builder processes(int processes) {
            if (processes < 1) throw new IllegalArgumentException("processes must be positive, got " + processes);
            this.processes = processes;
            return this;
        }

        public Builder javaExecutable(@NotNull String javaExecutable) {
            this.javaExecutable = Objects.requireNonNull(javaExecutable);
            return this;
        }

        /**
         * Classpath of the worker JVMs, defaults to the classpath of this JVM. Job functions,
         * arguments and results must be loadable from it.
         */
        public Builder classpath(@NotNull String classpath) {
            this.classpath = Objects.requireNonNull(classpath);
            return this;
        }

        public Builder jvmOption(@NotNull String option) {
            this.jvmOptions.add(Objects.requireNonNull(option));
            return this;
        }

        /**
         * Loop that owns the futures of awaitable handles. When not set the pool creates its own
         * loop and closes it together with the pool.
         */
        public Builder eventLoop(@NotNull EventLoop eventLoop) {
            this.eventLoop = Objects.requireNonNull(eventLoop);
            return this;
        }

        public Builder failurePolicy(@NotNull UserFailurePolicy failurePolicy) {
            this.failurePolicy = Objects.requireNonNull(failurePolicy);
            return this;
        }

        public Builder clock(@NotNull Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        public Builder addListener(@NotNull JobEventListener l) {
            listeners.add(Objects.requireNonNull(l));
            return this;
        }

        /**
         * Starts the worker processes.
         *
         * @throws ExternalProcessException if a worker process cannot be started
         */
        public WorkerPool build() throws ExternalProcessException {
            return new WorkerPool(this);
        }
    }

    // ======== Public API ========

    /**
     * Submits {@code func(args)} for execution in a worker process and returns without blocking.
     * The handle's future belongs to this pool's event loop.
     *
     * @throws IllegalStateException if the pool is closed
     */
    public <T> @NotNull AsyncJobHandle<T> submit(@NotNull JobFunction<T> func, Object... args) {
        return enqueue(func, args, job -> new AsyncJobHandle<>(job, loop.createFuture()));
    }

    /**
     * Like {@link #submit} but returns a handle that is only joinable.
     */
    public <T> @NotNull BlockingJobHandle<T> submitBlocking(@NotNull JobFunction<T> func, Object... args) {
        return enqueue(func, args, BlockingJobHandle::new);
    }

    public @NotNull EventLoop getEventLoop() {
        return loop;
    }

    public int getProcessCount() {
        return slots.size();
    }

    public @NotNull UserFailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public void addListener(@NotNull JobEventListener l) {
        listeners.add(Objects.requireNonNull(l));
    }

    public void removeListener(JobEventListener l) {
        listeners.remove(l);
    }

    /**
     * Forced termination: kills the worker processes and stops the internal threads.
     * Handles that are not complete at this point never complete.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        for (WorkerSlot slot : slots) slot.terminate();
        resultHandler.shutdownNow();
        int abandoned = pending.size();
        pending.clear();
        if (ownsLoop) loop.close();
        logger.debug("worker pool terminated, {} queued job(s) abandoned", abandoned);
    }

    // ======== Internals ========

    private long nextJobId() {
        return jobIdCounter.incrementAndGet();
    }

    private <T, H extends PooledJobHandle<T>> H enqueue(JobFunction<T> func, Object[] args, Function<Job<T>, H> handleFactory) {
        Objects.requireNonNull(func, "func");
        if (closed.get()) throw new IllegalStateException("worker pool is closed");

        Job<T> job = new Job<>(nextJobId(), func, args);
        job.attachStats(new JobStats(clock.instant()));
        H handle = handleFactory.apply(job);
        PoolTask<T> task = new PoolTask<>();
        handle.attachPoolTask(task);

        logger.debug("submitting {}", handle);
        fire(l -> l.onSubmitted(job.getId()));

        PendingJob<T> pendingJob = new PendingJob<>(job, handle, task);
        try {
            pendingJob.payload = FrameCodec.serialize(job);
        } catch (IOException e) {
            logger.warn("{} cannot be sent to a worker process: {}", job, e.toString());
            handOff(() -> deliverFailure(pendingJob, new JobFailedError(job, e)));
            return handle;
        }
        pending.offer(pendingJob);
        return handle;
    }

    private void handOff(Runnable delivery) {
        try {
            resultHandler.execute(delivery);
        } catch (RejectedExecutionException e) {
            if (!closed.get()) throw e;
            logger.debug("worker pool is closed, outcome dropped");
        }
    }

    @SuppressWarnings("unchecked")
    private <T> void deliverReply(PendingJob<T> p, byte[] replyBytes) {
        WorkerReply reply;
        try {
            reply = (WorkerReply) FrameCodec.deserialize(replyBytes);
        } catch (IOException | ClassNotFoundException | ClassCastException e) {
            deliverFailure(p, new JobFailedError(p.job, e));
            return;
        }
        if (reply.isFailure()) {
            deliverFailure(p, new JobFailedError(p.job, reply.getFailure()));
            return;
        }
        Job<T> done = (Job<T>) reply.getJob();
        if (done.isFailed() && failurePolicy == UserFailurePolicy.SURFACE) {
            deliverFailure(p, done.getError());
            return;
        }
        deliverSuccess(p, done);
    }

    private <T> void deliverSuccess(PendingJob<T> p, Job<T> done) {
        try {
            p.handle.onSuccess(done);
        } catch (RuntimeException e) {
            logger.error("Success callback of {} failed", p.job, e);
        }
        p.task.complete(done);
        fire(l -> l.onCompleted(done.getId()));
    }

    private <T> void deliverFailure(PendingJob<T> p, JobFailedError error) {
        try {
            p.handle.onFailure(error);
        } catch (RuntimeException e) {
            logger.error("Failure callback of {} failed", p.job, e);
        }
        p.task.fail(error);
        fire(l -> l.onFailed(p.job.getId(), error.getInnerError()));
    }

    private void fire(Consumer<JobEventListener> c) {
        for (JobEventListener l : listeners) {
            try {
                c.accept(l);
            } catch (Throwable t) {
                logger.warn("Job event listener {} failed", l, t);
            }
        }
    }

    private static final class PendingJob<T> {
        final Job<T> job;
        final PooledJobHandle<T> handle;
        final PoolTask<T> task;
        byte[] payload;

        PendingJob(Job<T> job, PooledJobHandle<T> handle, PoolTask<T> task) {
            this.job = job;
            this.handle = handle;
            this.task = task;
        }
    }

    /**
     * One worker process and the thread that feeds it. A process that dies is replaced.
     */
    private final class WorkerSlot implements Runnable {
        private final String name;
        private final Thread thread;
        private volatile WorkerProcess process;

        WorkerSlot(int index) throws ExternalProcessException {
            this.name = "worker-" + index;
            this.process = WorkerProcess.start(name, workerCommand);
            this.thread = new Thread(this, "worker-pool-dispatch-" + index);
            this.thread.setDaemon(true);
        }

        @Override
        public void run() {
            while (!closed.get()) {
                PendingJob<?> next;
                try {
                    next = pending.take();
                } catch (InterruptedException ie) {
                    if (closed.get()) break;
                    continue;
                }
                if (!dispatch(next)) break;
            }
            logger.debug("{} dispatch loop stopped", name);
        }

        /**
         * @return false when this slot cannot serve any more jobs
         */
        private <T> boolean dispatch(PendingJob<T> next) {
            final byte[] reply;
            try {
                reply = process.exchange(next.payload);
            } catch (ExternalProcessException e) {
                if (closed.get()) {
                    logger.debug("{} abandoned by pool termination", next.job);
                    return false;
                }
                logger.warn("{} lost while running {}: {}", process, next.job, e.getMessage());
                handOff(() -> deliverFailure(next, new JobFailedError(next.job, e)));
                return respawn();
            }
            handOff(() -> deliverReply(next, reply));
            return true;
        }

        private boolean respawn() {
            process.destroy();
            try {
                process = WorkerProcess.start(name, workerCommand);
                if (closed.get()) process.destroy();
                return !closed.get();
            } catch (ExternalProcessException e) {
                logger.error("Cannot replace {}, pool continues with one worker process less", name, e);
                return false;
            }
        }

        void terminate() {
            process.destroy();
            thread.interrupt();
        }
    }
}
