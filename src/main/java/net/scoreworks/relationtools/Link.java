/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.relationtools;

import org.apache.commons.lang3.Validate;

import java.util.Objects;

/**
 * Ties the foreign key attribute of a child record to the local key attribute of its parent. The local key is always
 * the parent's primary key
 */
public final class Link {
    private final String foreignKey;
    private final String localKey;

    public Link(String foreignKey, String localKey) {
        this.foreignKey = Validate.notBlank(foreignKey, "foreign key attribute must not be blank");
        this.localKey = Validate.notBlank(localKey, "local key attribute must not be blank");
    }

    public static Link of(String foreignKey) {
        return new Link(foreignKey, "id");
    }

    public static Link of(String foreignKey, String localKey) {
        return new Link(foreignKey, localKey);
    }

    public String getForeignKey() {
        return foreignKey;
    }

    public String getLocalKey() {
        return localKey;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Link)) {
            return false;
        }
        Link other = (Link) o;
        return foreignKey.equals(other.foreignKey) && localKey.equals(other.localKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(foreignKey, localKey);
    }

    @Override
    public String toString() {
        return foreignKey + " -> " + localKey;
    }
}
