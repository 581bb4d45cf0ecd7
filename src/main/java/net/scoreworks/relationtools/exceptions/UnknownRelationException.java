/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.relationtools.exceptions;

/**
 * Thrown when a relation is resolved on a record that neither registered nor declared it
 */
public class UnknownRelationException extends RuntimeException {
    public UnknownRelationException(Class<?> clazz, String relationName) {
        super(clazz.getSimpleName() + " has no relation \"" + relationName + "\"");
    }
}
