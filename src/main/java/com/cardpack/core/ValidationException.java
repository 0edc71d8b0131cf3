package com.cardpack.core;

/**
 * Signals caller input that cannot be packaged, such as a stream whose length is not a multiple of four.
 * Always thrown before anything is written to disk.
 */
public class ValidationException extends IllegalArgumentException {
    public ValidationException(String message) {
        super(message);
    }
}
