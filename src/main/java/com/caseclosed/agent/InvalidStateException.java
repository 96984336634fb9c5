package com.caseclosed.agent;

/**
 * A state sync the agent refuses to apply. Raised before any field is touched.
 */
public class InvalidStateException extends RuntimeException {

    public InvalidStateException(String message) {
        super(message);
    }
}
