package com.tazifor.bidengine.exception;

/**
 * The auction worker pool refused or dropped a request because its queue was full.
 */
public class OverloadedException extends RuntimeException {

    public OverloadedException(String message) {
        super(message);
    }
}
