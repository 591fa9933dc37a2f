package io.github.byzatic.workerpool.job;

import java.io.Serializable;

/**
 * Body of a job. Runs inside a worker process, so the function itself, its arguments and its
 * return value must all be serializable.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface JobFunction<T> extends Serializable {
    T call(Object... args) throws Exception;
}
