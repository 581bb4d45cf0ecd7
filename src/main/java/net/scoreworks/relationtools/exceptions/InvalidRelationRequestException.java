/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.relationtools.exceptions;

public class InvalidRelationRequestException extends RuntimeException {
    public InvalidRelationRequestException(Class<?> clazz, String relationName) {
        super("Invalid relation name: " + relationName + ". This relation is not kept updated by " + clazz.getSimpleName() + "!");
    }
}
