/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.relationtools;

import org.apache.commons.collections4.ListUtils;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of comparing the collection of a relation before and after an assignment, by identity of its records.
 * All records of the new collection have to be upserted, records of the old collection whose identity is no longer
 * present have to be removed. Records without identity are never matched and therefore never removed.
 * @param <C> class-type of the compared records
 */
public final class CollectionDiff<C extends Record> {
    private final List<C> upsert;
    private final List<C> remove;

    private CollectionDiff(List<C> upsert, List<C> remove) {
        this.upsert = ListUtils.unmodifiableList(upsert);
        this.remove = ListUtils.unmodifiableList(remove);
    }

    /**
     * @param oldRecords baseline collection, usually a snapshot
     * @param newRecords desired collection
     */
    public static <C extends Record> CollectionDiff<C> diff(List<? extends C> oldRecords, List<? extends C> newRecords) {
        Map<String, C> oldIndex = index(oldRecords);
        Map<String, C> newIndex = index(newRecords);

        List<C> remove = new ArrayList<>();
        for (Map.Entry<String, C> entry : oldIndex.entrySet()) {
            if (!newIndex.containsKey(entry.getKey()))
                remove.add(entry.getValue());
        }
        return new CollectionDiff<>(new ArrayList<>(newRecords), remove);
    }

    /**
     * Index records by the string form of their primary key, so a key read from raw input matches the same key read
     * from storage. Records without identity are skipped, later records overwrite earlier ones with the same identity
     * while keeping the position of the first
     */
    static <C extends Record> Map<String, C> index(List<? extends C> records) {
        Map<String, C> index = new LinkedHashMap<>();
        for (C record : records) {
            String key = identity(record.getPrimaryKey());
            if (key != null)
                index.put(key, record);
        }
        return index;
    }

    static @Nullable String identity(@Nullable Object key) {
        if (key == null)
            return null;
        String identity = key.toString();
        return identity.isEmpty() ? null : identity;
    }

    public List<C> getUpsert() {
        return upsert;
    }

    public List<C> getRemove() {
        return remove;
    }

    public boolean isEmpty() {
        return upsert.isEmpty() && remove.isEmpty();
    }

    @Override
    public String toString() {
        return "upsert: " + upsert.size() + ", remove: " + remove.size();
    }
}
