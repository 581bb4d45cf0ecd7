/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.relationtools.exceptions;

/**
 * Thrown when input was present for a record but its prepare hook turned it into nothing usable. This is a bad-input
 * condition of the caller, not a validation error
 */
public class EmptyPreparedInputException extends RuntimeException {
    public EmptyPreparedInputException(Class<?> clazz) {
        super("Empty result was returned from " + clazz.getSimpleName() + ".prepare()");
    }
}
