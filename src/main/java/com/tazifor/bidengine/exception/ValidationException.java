package com.tazifor.bidengine.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Malformed bid request. Raised before any auction work starts.
 */
@Getter
public class ValidationException extends RuntimeException {

    private final List<String> messages;

    public ValidationException(String message) {
        super(message);
        this.messages = Collections.singletonList(message);
    }

    public ValidationException(List<String> messages) {
        super(String.join("\n", messages));
        this.messages = messages;
    }
}
