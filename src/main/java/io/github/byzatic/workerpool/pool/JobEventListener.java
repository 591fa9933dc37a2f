package io.github.byzatic.workerpool.pool;

/**
 * Pool-wide job events. Called on the submitting thread for {@code onSubmitted} and on the result
 * handler thread otherwise. Exceptions thrown by a listener are logged and ignored.
 */
public interface JobEventListener {
    default void onSubmitted(long jobId) {
    }

    default void onCompleted(long jobId) {
    }

    default void onFailed(long jobId, Throwable error) {
    }
}
