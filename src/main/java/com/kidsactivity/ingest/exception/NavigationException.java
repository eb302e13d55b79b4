package com.kidsactivity.ingest.exception;

/**
 * The listing site could not be navigated. Fatal when raised while loading the listing tree.
 */
public class NavigationException extends RuntimeException {
    public NavigationException() {
        super();
    }

    public NavigationException(String message) {
        super(message);
    }

    public NavigationException(String message, Throwable e) {
        super(message, e);
    }
}
