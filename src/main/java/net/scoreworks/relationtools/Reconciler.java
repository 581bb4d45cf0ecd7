/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.relationtools;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Brings the stored children of one relation of a parent in line with the relation's desired collection. All passes
 * are best effort: a failing child does not stop the remaining ones and nothing is rolled back. Failures are reported
 * as an aggregated boolean and through the errors of each child.
 */
class Reconciler {
    private static final Logger LOGGER = LoggerFactory.getLogger(Reconciler.class);

    private final RelationalRecord parent;
    private final Relation<?> relation;

    Reconciler(RelationalRecord parent, Relation<?> relation) {
        this.parent = parent;
        this.relation = relation;
    }

    /**
     * Write the given key into the foreign key attribute of every record
     */
    static void propagateForeignKey(Collection<? extends Record> records, Link link, @Nullable Object key) {
        for (Record record : records) {
            record.setAttribute(link.getForeignKey(), key);
        }
    }

    /**
     * Validate every record of the desired collection. The foreign key is managed by the parent and therefore never
     * validated
     * @param attributeNames attributes to validate, null for all attributes of each record
     */
    boolean validate(@Nullable Collection<String> attributeNames, boolean clearErrors) {
        boolean valid = true;
        for (Record record : parent.desired(relation.getName())) {
            Set<String> names = new LinkedHashSet<>(attributeNames == null ? record.attributes() : attributeNames);
            names.remove(relation.getLink().getForeignKey());
            if (!record.validate(names, clearErrors))
                valid = false;
        }
        return valid;
    }

    /**
     * Save every record of the desired collection and delete every record of the snapshot that is no longer desired
     */
    boolean save(boolean runValidation, @Nullable Collection<String> attributeNames) {
        String name = relation.getName();
        CollectionDiff<Record> diff = CollectionDiff.diff(parent.snapshot(name), parent.desired(name));
        LOGGER.debug("reconciling {}.{}: {}", parent, name, diff);

        boolean success = true;
        //the parent's key may have changed since assignment, e.g. when the parent itself was inserted in between
        Object key = parent.getAttribute(relation.getLink().getLocalKey());
        for (Record record : diff.getUpsert()) {
            record.setAttribute(relation.getLink().getForeignKey(), key);
            if (!record.save(runValidation, attributeNames)) {
                LOGGER.warn("failed to save {} of relation {}.{}", record, parent, name);
                success = false;
            }
        }
        for (Record record : diff.getRemove()) {
            if (!record.delete()) {
                LOGGER.warn("failed to delete {} of relation {}.{}", record, parent, name);
                success = false;
            }
        }
        return success;
    }

    /**
     * Delete every record of the desired collection
     */
    boolean delete() {
        boolean success = true;
        for (Record record : parent.desired(relation.getName())) {
            if (!record.delete()) {
                LOGGER.warn("failed to delete {} of relation {}.{}", record, parent, relation.getName());
                success = false;
            }
        }
        return success;
    }

    /**
     * @return the errors of every record in the desired collection that has errors
     */
    List<Map<String, List<String>>> errors() {
        List<Map<String, List<String>>> errors = new ArrayList<>();
        for (Record record : parent.desired(relation.getName())) {
            if (record.hasErrors())
                errors.add(record.getErrors());
        }
        return errors;
    }
}
