package io.github.byzatic.workerpool.base_exceptions;

import java.time.Duration;

public class OperationTimedOutException extends Exception {
    public OperationTimedOutException(String message) {
        super(message);
    }

    public OperationTimedOutException(Duration timeout, String what) {
        super(what + " did not complete within " + timeout.toMillis() + " ms");
    }

    public OperationTimedOutException(String message, Throwable cause) {
        super(message, cause);
    }
}
