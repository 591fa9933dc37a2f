package io.github.byzatic.workerpool.base_exceptions;

/**
 * Raised when a worker process dies or its channel breaks while a job is in flight.
 */
public class ExternalProcessException extends Exception {
    private final int exitCode;

    public ExternalProcessException(String message) {
        this(message, -1);
    }

    public ExternalProcessException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public ExternalProcessException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    public ExternalProcessException(Throwable cause, String message) {
        this(message, cause);
    }

    /**
     * @return exit code of the worker process, or -1 when the process was still alive or unknown
     */
    public int getExitCode() {
        return exitCode;
    }
}
