package io.github.byzatic.workerpool.worker;

import io.github.byzatic.workerpool.base_exceptions.ExternalProcessException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Parent-side view of one worker process. Not thread safe: each instance is driven by a single
 * dispatch thread, one request at a time.
 */
public final class WorkerProcess implements Closeable {
    private final static Logger logger = LoggerFactory.getLogger(WorkerProcess.class);

    private final String name;
    private final Process process;
    private final DataOutputStream toWorker;
    private final DataInputStream fromWorker;

    private WorkerProcess(String name, Process process) {
        this.name = name;
        this.process = process;
        this.toWorker = new DataOutputStream(new BufferedOutputStream(process.getOutputStream()));
        this.fromWorker = new DataInputStream(new BufferedInputStream(process.getInputStream()));
    }

    /**
     * Launches a worker process running {@link WorkerProcessMain}.
     *
     * @param command full command line, see {@link #command(String, String, List)}
     */
    public static @NotNull WorkerProcess start(@NotNull String name, @NotNull List<String> command) throws ExternalProcessException {
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.redirectError(ProcessBuilder.Redirect.INHERIT);
        try {
            Process process = builder.start();
            logger.debug("{} started with pid {}", name, process.pid());
            return new WorkerProcess(name, process);
        } catch (IOException e) {
            throw new ExternalProcessException("Cannot start " + name + " with command " + command, e);
        }
    }

    /**
     * Builds the command line of a worker JVM.
     */
    public static @NotNull List<String> command(@NotNull String javaExecutable, @NotNull String classpath, @NotNull List<String> jvmOptions) {
        List<String> command = new ArrayList<>();
        command.add(javaExecutable);
        command.addAll(jvmOptions);
        command.add("-cp");
        command.add(classpath);
        command.add(WorkerProcessMain.class.getName());
        return command;
    }

    /**
     * Sends one job frame and blocks until the reply frame arrives.
     *
     * @throws ExternalProcessException if the process died or the pipe broke
     */
    public byte @NotNull [] exchange(byte @NotNull [] request) throws ExternalProcessException {
        try {
            FrameCodec.writeFrame(toWorker, request);
            return FrameCodec.readFrame(fromWorker);
        } catch (IOException e) {
            int exitCode = awaitExitCode();
            throw new ExternalProcessException(name + " lost (exit code " + exitCode + "): " + e, exitCode);
        }
    }

    private int awaitExitCode() {
        try {
            if (process.waitFor(1, TimeUnit.SECONDS)) return process.exitValue();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        return -1;
    }

    public @NotNull String getName() {
        return name;
    }

    public long pid() {
        return process.pid();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    /**
     * Kills the process without waiting for the job it may be running.
     */
    public void destroy() {
        if (process.isAlive()) {
            process.destroyForcibly();
            logger.debug("{} (pid {}) destroyed", name, process.pid());
        }
    }

    @Override
    public void close() {
        destroy();
    }

    @Override
    public String toString() {
        return name + "[pid=" + process.pid() + "]";
    }
}
