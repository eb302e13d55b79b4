package com.kidsactivity.ingest.exception;

/**
 * A pooled browser session crashed or disconnected; its pending work must be requeued.
 */
public class SessionDeadException extends RuntimeException {
    public SessionDeadException() {
        super();
    }

    public SessionDeadException(String message) {
        super(message);
    }

    public SessionDeadException(String message, Throwable e) {
        super(message, e);
    }
}
