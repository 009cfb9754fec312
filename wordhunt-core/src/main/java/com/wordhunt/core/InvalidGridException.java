package com.wordhunt.core;

/**
 * Thrown when grid input is not a rectangle of single lowercase ASCII letters.
 */
public class InvalidGridException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidGridException(String message) {
        super(message);
    }
}
