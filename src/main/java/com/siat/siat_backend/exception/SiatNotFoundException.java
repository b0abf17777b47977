package com.siat.siat_backend.exception;

public class SiatNotFoundException extends RuntimeException {

    public SiatNotFoundException(String message) {
        super(message);
    }
}
