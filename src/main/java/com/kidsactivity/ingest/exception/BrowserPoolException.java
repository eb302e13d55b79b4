package com.kidsactivity.ingest.exception;

public class BrowserPoolException extends RuntimeException {
    public BrowserPoolException() {
        super();
    }

    public BrowserPoolException(String message) {
        super(message);
    }

    public BrowserPoolException(String message, Throwable e) {
        super(message, e);
    }
}
