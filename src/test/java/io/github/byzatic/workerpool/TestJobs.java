package io.github.byzatic.workerpool;

/**
 * Job bodies used by tests. Referenced as {@code TestJobs::add} etc.
 */
public final class TestJobs {
    private TestJobs() {
    }

    public static Integer add(Object... args) {
        return (Integer) args[0] + (Integer) args[1];
    }

    public static Object boom(Object... args) {
        throw new IllegalArgumentException("boom");
    }

    public static Long sleepMillis(Object... args) throws InterruptedException {
        long millis = (Long) args[0];
        Thread.sleep(millis);
        return millis;
    }

    public static Long pid(Object... args) {
        return ProcessHandle.current().pid();
    }

    public static Object unserializableResult(Object... args) {
        return new Object();
    }

    public static Object halt(Object... args) {
        Runtime.getRuntime().halt(3);
        return null;
    }

    public static String chatty(Object... args) {
        System.out.println("noise on stdout must not break the channel");
        return "quiet";
    }
}
