package com.isospectra.exceptions;

/**
 * Base sealed class for all spectrum computation exceptions.
 * Uses Java's sealed classes feature to provide a closed hierarchy of exceptions.
 */
public sealed class SpectrumException extends Exception permits InvalidFieldException {

    public SpectrumException(String message) {
        super(message);
    }

    public SpectrumException(String message, Throwable cause) {
        super(message, cause);
    }
}
