package com.tazifor.bidengine.exception;

/**
 * An external bid source failed to answer. Only that source's bids are lost.
 */
public class BidSourceException extends RuntimeException {

    public BidSourceException(String message) {
        super(message);
    }

    public BidSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
