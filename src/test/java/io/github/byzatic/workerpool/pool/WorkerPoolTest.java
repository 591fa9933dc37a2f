package io.github.byzatic.workerpool.pool;

import io.github.byzatic.workerpool.TestJobs;
import io.github.byzatic.workerpool.base_exceptions.ExternalProcessException;
import io.github.byzatic.workerpool.base_exceptions.OperationTimedOutException;
import io.github.byzatic.workerpool.event_loop.EventLoop;
import io.github.byzatic.workerpool.handle.AsyncJobHandle;
import io.github.byzatic.workerpool.handle.BlockingJobHandle;
import io.github.byzatic.workerpool.job.Job;
import io.github.byzatic.workerpool.job.JobFailedError;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.NotSerializableException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolTest {

    private static final Duration WAIT = Duration.ofSeconds(30);

    WorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) pool.close();
    }

    private static WorkerPool.Builder builder() {
        return new WorkerPool.Builder()
                .processes(2)
                .jvmOption("-XX:TieredStopAtLevel=1")
                .jvmOption("-Xshare:auto");
    }

    @Test
    void joinReturnsTheResult() throws Exception {
        pool = builder().build();

        AsyncJobHandle<Integer> handle = pool.submit(TestJobs::add, 2, 3);

        assertEquals(5, handle.join(WAIT));
        assertEquals(2, pool.getProcessCount());
    }

    @Test
    void blockingFlavorJoins() throws Exception {
        pool = builder().build();

        BlockingJobHandle<Integer> handle = pool.submitBlocking(TestJobs::add, 20, 22);

        assertEquals(42, handle.join(WAIT));
        assertNotNull(handle.getStats().getFinishedAt());
    }

    @Test
    void awaitResolvesOnTheLoopWhileOtherTasksKeepRunning() throws Exception {
        pool = builder().build();
        EventLoop loop = pool.getEventLoop();

        AtomicInteger ticks = new AtomicInteger();
        AtomicInteger ticksAtResume = new AtomicInteger(-1);
        AtomicReference<Integer> value = new AtomicReference<>();
        AtomicBoolean resumedOnLoop = new AtomicBoolean(false);
        AtomicBoolean stop = new AtomicBoolean(false);
        CountDownLatch resumed = new CountDownLatch(1);

        Runnable ticker = new Runnable() {
            @Override
            public void run() {
                ticks.incrementAndGet();
                if (!stop.get()) {
                    try {
                        Thread.sleep(1);
                    } catch (InterruptedException ignored) {
                        return;
                    }
                    loop.callSoonThreadsafe(this);
                }
            }
        };

        loop.callSoonThreadsafe(() -> {
            AsyncJobHandle<Long> handle = pool.submit(TestJobs::sleepMillis, 300L);
            handle.whenDone((v, e) -> {
                ticksAtResume.set(ticks.get());
                value.set(v == null ? null : v.intValue());
                resumedOnLoop.set(loop.inEventLoop());
                stop.set(true);
                resumed.countDown();
            });
        });
        loop.callSoonThreadsafe(ticker);

        assertTrue(resumed.await(WAIT.toSeconds(), TimeUnit.SECONDS), "await did not resume");
        assertEquals(300, value.get());
        assertTrue(resumedOnLoop.get());
        assertTrue(ticksAtResume.get() > 0, "loop was blocked while the job ran");
    }

    @Test
    void idsAreDistinctAndIncreasingInSubmissionOrder() throws Exception {
        pool = builder().build();

        List<AsyncJobHandle<Integer>> handles = new ArrayList<>();
        for (int i = 0; i < 10; i++) handles.add(pool.submit(TestJobs::add, i, i));

        for (int i = 1; i < handles.size(); i++) {
            assertTrue(handles.get(i).getJobId() > handles.get(i - 1).getJobId());
        }
        assertEquals(1, handles.get(0).getJobId());
        for (int i = 0; i < handles.size(); i++) {
            assertEquals(2 * i, handles.get(i).join(WAIT));
        }
    }

    @Test
    void jobsRunInWorkerProcesses() throws Exception {
        pool = builder().build();
        Set<Long> pids = new HashSet<>();
        List<AsyncJobHandle<Long>> handles = new ArrayList<>();
        for (int i = 0; i < 4; i++) handles.add(pool.submit(TestJobs::pid));
        for (AsyncJobHandle<Long> h : handles) pids.add(h.join(WAIT));

        assertFalse(pids.contains(ProcessHandle.current().pid()));
        assertTrue(pids.size() <= 2);
    }

    @Test
    void workerMutationsOnlyReachTheSubmitterThroughTheCallbackCopy() throws Exception {
        pool = builder().build();

        BlockingJobHandle<Integer> handle = pool.submitBlocking(TestJobs::add, 2, 3);
        Job<Integer> submitted = handle.getJob();
        handle.join(WAIT);

        assertNotSame(submitted, handle.getJob());
        assertNull(submitted.getResult());
        assertNull(submitted.getStats().getStartedAt());
        assertEquals(5, handle.getJob().getResult());
        assertNotNull(handle.getJob().getStats().getStartedAt());
        assertEquals(submitted.getStats().getSubmittedAt(), handle.getStats().getSubmittedAt());
    }

    @Test
    void absorbPolicyKeepsLegacyBehaviorForUserFailures() throws Exception {
        pool = builder().failurePolicy(UserFailurePolicy.ABSORB).build();

        BlockingJobHandle<Object> handle = pool.submitBlocking(TestJobs::boom);

        assertNull(handle.join(WAIT));
        JobFailedError recorded = handle.getJob().getError();
        assertNotNull(recorded);
        assertInstanceOf(IllegalArgumentException.class, recorded.getInnerError());
        assertEquals("boom", recorded.getInnerError().getMessage());
    }

    @Test
    void absorbPolicyResolvesAwaitWithNull() throws Exception {
        pool = builder().failurePolicy(UserFailurePolicy.ABSORB).build();

        AsyncJobHandle<Object> handle = pool.submit(TestJobs::boom);
        AtomicReference<Throwable> error = new AtomicReference<>();
        AtomicBoolean resolved = new AtomicBoolean(false);
        CountDownLatch resumed = new CountDownLatch(1);
        handle.whenDone((v, e) -> {
            resolved.set(v == null && e == null);
            error.set(e);
            resumed.countDown();
        });

        assertTrue(resumed.await(WAIT.toSeconds(), TimeUnit.SECONDS));
        assertTrue(resolved.get());
        assertNull(error.get());
    }

    @Test
    void surfacePolicyRaisesUserFailures() throws Exception {
        pool = builder().failurePolicy(UserFailurePolicy.SURFACE).build();

        AsyncJobHandle<Object> handle = pool.submit(TestJobs::boom);

        JobFailedError e = assertThrows(JobFailedError.class, () -> handle.join(WAIT));
        assertInstanceOf(IllegalArgumentException.class, e.getInnerError());
        assertEquals("boom", e.getInnerError().getMessage());
        assertEquals(handle.getJobId(), e.getJob().getId());
    }

    @Test
    void surfacePolicyRejectsAwaitWithInnerError() throws Exception {
        pool = builder().build();
        assertEquals(UserFailurePolicy.SURFACE, pool.getFailurePolicy());

        AsyncJobHandle<Object> handle = pool.submit(TestJobs::boom);
        AtomicReference<Throwable> error = new AtomicReference<>();
        CountDownLatch resumed = new CountDownLatch(1);
        handle.whenDone((v, e) -> {
            error.set(e);
            resumed.countDown();
        });

        assertTrue(resumed.await(WAIT.toSeconds(), TimeUnit.SECONDS));
        assertInstanceOf(IllegalArgumentException.class, error.get());
        assertEquals("boom", error.get().getMessage());
    }

    @Test
    void unserializableArgumentFailsThroughTheFailurePath() throws Exception {
        pool = builder().build();

        AsyncJobHandle<Integer> handle = pool.submit(TestJobs::add, new Object(), 1);

        JobFailedError e = assertThrows(JobFailedError.class, () -> handle.join(WAIT));
        assertInstanceOf(NotSerializableException.class, e.getInnerError());
    }

    @Test
    void unserializableResultFailsThroughTheFailurePath() throws Exception {
        pool = builder().failurePolicy(UserFailurePolicy.ABSORB).build();

        AsyncJobHandle<Object> handle = pool.submit(TestJobs::unserializableResult);

        JobFailedError e = assertThrows(JobFailedError.class, () -> handle.join(WAIT));
        assertInstanceOf(NotSerializableException.class, e.getInnerError());
    }

    @Test
    void stdoutOfJobsDoesNotCorruptTheChannel() throws Exception {
        pool = builder().build();
        assertEquals("quiet", pool.submit(TestJobs::chatty).join(WAIT));
    }

    @Test
    void crashedWorkerFailsItsJobAndIsReplaced() throws Exception {
        pool = builder().processes(1).build();

        AsyncJobHandle<Object> crashed = pool.submit(TestJobs::halt);
        JobFailedError e = assertThrows(JobFailedError.class, () -> crashed.join(WAIT));
        assertInstanceOf(ExternalProcessException.class, e.getInnerError());
        assertEquals(3, ((ExternalProcessException) e.getInnerError()).getExitCode());

        assertEquals(5, pool.submit(TestJobs::add, 2, 3).join(WAIT));
    }

    @Test
    void listenersSeeSubmissionAndOutcome() throws Exception {
        List<String> events = new CopyOnWriteArrayList<>();
        CountDownLatch outcomes = new CountDownLatch(2);
        pool = builder()
                .addListener(new JobEventListener() {
                    @Override public void onSubmitted(long jobId) { events.add("submitted:" + jobId); }
                    @Override public void onCompleted(long jobId) { events.add("completed:" + jobId); outcomes.countDown(); }
                    @Override public void onFailed(long jobId, Throwable error) { events.add("failed:" + jobId); outcomes.countDown(); }
                })
                .build();

        pool.submit(TestJobs::add, 1, 1);
        pool.submit(TestJobs::boom);

        assertTrue(outcomes.await(WAIT.toSeconds(), TimeUnit.SECONDS));
        assertTrue(events.contains("submitted:1"));
        assertTrue(events.contains("submitted:2"));
        assertTrue(events.contains("completed:1"));
        assertTrue(events.contains("failed:2"));
    }

    @Test
    void closingAbandonsUnfinishedJobs() throws Exception {
        pool = builder().processes(1).build();

        AsyncJobHandle<Long> running = pool.submit(TestJobs::sleepMillis, 10_000L);
        AsyncJobHandle<Long> queued = pool.submit(TestJobs::sleepMillis, 10_000L);
        Thread.sleep(200);
        pool.close();

        assertTrue(pool.isClosed());
        assertThrows(OperationTimedOutException.class, () -> running.join(Duration.ofMillis(500)));
        assertThrows(OperationTimedOutException.class, () -> queued.join(Duration.ofMillis(200)));
        assertFalse(running.isDone());
        assertFalse(queued.isDone());
    }

    @Test
    void submitAfterCloseIsRejected() throws Exception {
        pool = builder().processes(1).build();
        pool.close();
        pool.close();

        assertThrows(IllegalStateException.class, () -> pool.submit(TestJobs::add, 1, 2));
        assertTrue(pool.getEventLoop().isClosed());
    }

    @Test
    void scopedUseTerminatesThePool() throws Exception {
        WorkerPool scoped;
        try (WorkerPool p = builder().processes(1).build()) {
            scoped = p;
            assertEquals(3, p.submit(TestJobs::add, 1, 2).join(WAIT));
        }
        assertTrue(scoped.isClosed());
    }

    @Test
    void invalidProcessCountIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new WorkerPool.Builder().processes(0));
    }

    @Test
    void unstartableWorkerFailsBuild() {
        WorkerPool.Builder b = new WorkerPool.Builder().processes(1).javaExecutable("/nonexistent/bin/java");
        assertThrows(ExternalProcessException.class, b::build);
    }
}
