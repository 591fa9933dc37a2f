package io.github.byzatic.workerpool.worker;

import io.github.byzatic.workerpool.job.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;

/**
 * Entry point of a worker process. Serves job frames from stdin until the parent closes the pipe.
 * The real stdout carries reply frames only; {@code System.out} is rerouted to stderr.
 */
public final class WorkerProcessMain {
    private final static Logger logger = LoggerFactory.getLogger(WorkerProcessMain.class);

    private WorkerProcessMain() {
    }

    public static void main(String[] args) throws IOException {
        PrintStream channel = System.out;
        System.setOut(System.err);

        DataInputStream in = new DataInputStream(new BufferedInputStream(System.in));
        DataOutputStream out = new DataOutputStream(new BufferedOutputStream(channel));
        serve(in, out, new JobEvaluator());
    }

    /**
     * Request/reply loop. Returns normally on end of input.
     */
    static void serve(DataInputStream in, DataOutputStream out, JobEvaluator evaluator) throws IOException {
        logger.debug("worker process {} ready", ProcessHandle.current().pid());
        while (true) {
            byte[] request;
            try {
                request = FrameCodec.readFrame(in);
            } catch (EOFException eof) {
                logger.debug("worker process {} input closed, exiting", ProcessHandle.current().pid());
                return;
            }
            FrameCodec.writeFrame(out, handle(request, evaluator));
        }
    }

    static byte[] handle(byte[] request, JobEvaluator evaluator) throws IOException {
        WorkerReply reply;
        try {
            Job<?> job = (Job<?>) FrameCodec.deserialize(request);
            reply = WorkerReply.evaluated(evaluator.evaluate(job));
        } catch (Throwable e) {
            reply = WorkerReply.failed(e);
        }
        try {
            return FrameCodec.serialize(reply);
        } catch (IOException e) {
            // result or error of the job is not serializable
            logger.warn("cannot serialize reply: {}", e.toString());
            return FrameCodec.serialize(WorkerReply.failed(new NotSerializableException(e.getMessage())));
        }
    }
}
