package io.github.byzatic.workerpool;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Precondition helpers that throw a caller-chosen exception.
 */
public final class ObjectsUtils {
    private ObjectsUtils() {
    }

    /**
     * Returns {@code value} or throws {@code exception} when it is null.
     */
    public static <T, E extends RuntimeException> @NotNull T requireNonNull(@Nullable T value, @NotNull E exception) {
        if (value == null) throw exception;
        return value;
    }

    public static <E extends RuntimeException> void requireTrue(boolean condition, @NotNull E exception) {
        if (!condition) throw exception;
    }
}
