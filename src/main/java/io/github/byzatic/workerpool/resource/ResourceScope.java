package io.github.byzatic.workerpool.resource;

import com.google.common.annotations.Beta;
import io.github.byzatic.workerpool.ObjectsUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Acquires resources in order and releases them in reverse order on {@link #close()}.
 * A release that throws does not stop the remaining ones; the first error is rethrown with the
 * others suppressed. Not thread safe.
 */
@Beta
public final class ResourceScope implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(ResourceScope.class);

    private final Deque<Acquired<?>> acquired = new ArrayDeque<>();
    private final Map<ManagedResource<?>, Object> instances = new IdentityHashMap<>();
    private Throwable outcome = null;
    private boolean closed = false;

    /**
     * Opens a scope with all {@code resources} acquired. If one fails, those already acquired are released.
     */
    public static @NotNull ResourceScope open(@NotNull ManagedResource<?>... resources) throws Exception {
        ResourceScope scope = new ResourceScope();
        try {
            for (ManagedResource<?> resource : resources) scope.acquire(resource);
        } catch (Exception e) {
            scope.markFailed(e);
            try {
                scope.close();
            } catch (Exception releaseError) {
                e.addSuppressed(releaseError);
            }
            throw e;
        }
        return scope;
    }

    public <T> @NotNull T acquire(@NotNull ManagedResource<T> resource) throws Exception {
        Objects.requireNonNull(resource, "resource");
        ObjectsUtils.requireTrue(!closed, new IllegalStateException("scope is closed"));
        ObjectsUtils.requireTrue(!instances.containsKey(resource),
                new IllegalStateException("resource " + resource.getName() + " is already acquired"));
        T instance = resource.acquire();
        acquired.push(new Acquired<>(resource, instance));
        instances.put(resource, instance);
        logger.debug("resource {} acquired", resource.getName());
        return instance;
    }

    /**
     * @throws IllegalStateException if {@code resource} was not acquired in this scope
     */
    @SuppressWarnings("unchecked")
    public <T> @NotNull T get(@NotNull ManagedResource<T> resource) {
        return (T) ObjectsUtils.requireNonNull(instances.get(resource),
                new IllegalStateException("resource " + resource.getName() + " not initialized"));
    }

    /**
     * Records the error that ends the scope; it is passed to every release.
     */
    public void markFailed(@Nullable Throwable outcome) {
        this.outcome = outcome;
    }

    @Override
    public void close() throws Exception {
        if (closed) return;
        closed = true;
        Exception first = null;
        while (!acquired.isEmpty()) {
            Acquired<?> next = acquired.pop();
            try {
                next.release(outcome);
                logger.debug("resource {} released", next.resource.getName());
            } catch (Exception e) {
                logger.error("Release of resource {} failed", next.resource.getName(), e);
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        instances.clear();
        if (first != null) throw first;
    }

    private static final class Acquired<T> {
        final ManagedResource<T> resource;
        final T instance;

        Acquired(ManagedResource<T> resource, T instance) {
            this.resource = resource;
            this.instance = instance;
        }

        void release(Throwable outcome) throws Exception {
            resource.release(instance, outcome);
        }
    }
}
