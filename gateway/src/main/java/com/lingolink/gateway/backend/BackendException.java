package com.lingolink.gateway.backend;

import lombok.Getter;

/**
 * Unexpected response from the business backend.
 */
@Getter
public class BackendException extends RuntimeException {
    private final int status;

    public BackendException(String message, int status) {
        super(message);
        this.status = status;
    }
}
