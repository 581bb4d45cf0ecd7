/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.relationtools;

import net.scoreworks.relationtools.exceptions.UnknownRelationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Per-instance table of the relations a record has registered so far. A relation is registered at most once per name,
 * registering it again overwrites the entry.
 */
public class RelationRegistry {
    private final Class<? extends Record> owner;
    private final Map<String, Relation<?>> relations = new LinkedHashMap<>();

    RelationRegistry(Class<? extends Record> owner) {
        this.owner = owner;
    }

    public void register(Relation<?> relation) {
        relations.put(relation.getName(), relation);
    }

    /**
     * @throws UnknownRelationException if no relation was registered under that name
     */
    public Relation<?> resolve(String name) {
        Relation<?> relation = relations.get(name);
        if (relation == null)
            throw new UnknownRelationException(owner, name);
        return relation;
    }

    public boolean isRegistered(String name) {
        return relations.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(relations.keySet());
    }
}
