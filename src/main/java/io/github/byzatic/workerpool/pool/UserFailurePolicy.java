package io.github.byzatic.workerpool.pool;

/**
 * What the pool does with a job that came back from a worker with its error slot set.
 */
public enum UserFailurePolicy {
    /**
     * Route the job to the failure callback: {@code join()} throws and awaiting rejects with the inner error.
     */
    SURFACE,
    /**
     * Legacy wiring: the success callback fires and the handle resolves with the unset (null) result.
     * The error stays readable on the completed job.
     */
    ABSORB
}
