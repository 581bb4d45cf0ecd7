/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.relationtools;

import net.scoreworks.relationtools.annotations.HasMany;
import org.apache.commons.lang3.Validate;

/**
 * Immutable description of a one-to-many relation: its name, the type of the child records and the {@link Link}
 * between child and parent.
 * @param <C> class-type of the child records
 */
public final class Relation<C extends Record> {
    private final String name;
    private final Class<C> childType;
    private final Link link;
    private final boolean keepUpdated;

    public Relation(String name, Class<C> childType, Link link, boolean keepUpdated) {
        this.name = Validate.notBlank(name, "relation name must not be blank");
        this.childType = Validate.notNull(childType, "child type of relation %s must not be null", name);
        this.link = Validate.notNull(link, "link of relation %s must not be null", name);
        this.keepUpdated = keepUpdated;
    }

    public Relation(String name, Class<C> childType, Link link) {
        this(name, childType, link, true);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static Relation<?> fromDeclaration(HasMany declaration) {
        return new Relation(declaration.name(), declaration.child(),
                Link.of(declaration.foreignKey(), declaration.localKey()), declaration.keepUpdated());
    }

    public String getName() {
        return name;
    }

    public Class<C> getChildType() {
        return childType;
    }

    public Link getLink() {
        return link;
    }

    public boolean isKeptUpdated() {
        return keepUpdated;
    }

    @Override
    public String toString() {
        return name + "[" + childType.getSimpleName() + ", " + link + "]";
    }
}
