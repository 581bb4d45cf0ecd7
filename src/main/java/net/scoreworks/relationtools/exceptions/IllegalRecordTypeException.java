/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.relationtools.exceptions;

/**
 * An exception that gets thrown if a record class violates the rules needed to construct it or to reconcile its
 * relations
 */
public class IllegalRecordTypeException extends RuntimeException {
    public IllegalRecordTypeException(Class<?> clazz, String message) {
        super(clazz.getSimpleName() + " " + message);
    }

    public IllegalRecordTypeException(Class<?> clazz, String message, Throwable cause) {
        super(clazz.getSimpleName() + " " + message, cause);
    }
}
