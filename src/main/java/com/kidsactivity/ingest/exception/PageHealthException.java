package com.kidsactivity.ingest.exception;

public class PageHealthException extends RuntimeException {
    public PageHealthException() {
        super();
    }

    public PageHealthException(String message) {
        super(message);
    }

    public PageHealthException(String message, Throwable e) {
        super(message, e);
    }
}
