package com.siat.siat_backend.exception;

/** Operation not allowed in the current state of a flow or template. */
public class FlowStateException extends RuntimeException {

    public FlowStateException(String message) {
        super(message);
    }
}
