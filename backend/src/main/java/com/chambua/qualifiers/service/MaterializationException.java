package com.chambua.qualifiers.service;

/** The probability store rejected a batch; nothing from the batch was kept. */
public class MaterializationException extends RuntimeException {
    public MaterializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
