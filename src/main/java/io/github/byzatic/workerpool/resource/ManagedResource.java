package io.github.byzatic.workerpool.resource;

import com.google.common.annotations.Beta;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A value with setup and teardown, handed out by a {@link ResourceScope}.
 */
@Beta
public interface ManagedResource<T> {

    @NotNull T acquire() throws Exception;

    /**
     * @param outcome the error that ended the scope, or null when it ended normally
     */
    void release(@NotNull T instance, @Nullable Throwable outcome) throws Exception;

    default @NotNull String getName() {
        return getClass().getSimpleName();
    }
}
