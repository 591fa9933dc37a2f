package io.github.byzatic.workerpool.resource;

import com.google.common.annotations.Beta;
import io.github.byzatic.workerpool.base_exceptions.ExternalProcessException;
import io.github.byzatic.workerpool.pool.WorkerPool;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Supplies a {@link WorkerPool} to a scope. Release is the pool's forced termination; there is no draining.
 */
@Beta
public final class WorkerPoolResource implements ManagedResource<WorkerPool> {
    private final static Logger logger = LoggerFactory.getLogger(WorkerPoolResource.class);

    private final WorkerPool.Builder builder;

    public WorkerPoolResource(@NotNull WorkerPool.Builder builder) {
        this.builder = Objects.requireNonNull(builder, "builder");
    }

    @Override
    public @NotNull WorkerPool acquire() throws ExternalProcessException {
        return builder.build();
    }

    @Override
    public void release(@NotNull WorkerPool instance, @Nullable Throwable outcome) {
        if (outcome != null) logger.debug("releasing worker pool after failure: {}", outcome.toString());
        instance.close();
    }

    @Override
    public @NotNull String getName() {
        return "worker-pool";
    }
}
