/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.relationtools.storage;

import java.util.List;
import java.util.Map;

/**
 * Storage backend of {@link net.scoreworks.relationtools.ActiveRecord}s. Rows are plain attribute maps, keyed by the
 * primary key the store assigns on insert. Implementations report failures through their return values.
 */
public interface RecordStore {

    /**
     * @param table table to insert into
     * @param row attribute values of the new row, without primary key
     * @return the generated primary key or null if the row could not be inserted
     */
    Object insert(String table, Map<String, Object> row);

    /**
     * Overwrite the given attributes of an existing row
     * @return false if no row with that key exists
     */
    boolean update(String table, Object key, Map<String, Object> row);

    /**
     * @return false if no row with that key exists
     */
    boolean delete(String table, Object key);

    /**
     * @param condition attribute values a row must equal to be returned, empty for all rows
     * @return copies of the matching rows in insertion order, each including the primary key
     */
    List<Map<String, Object>> findAll(String table, Map<String, ?> condition);

    /**
     * @return name of the attribute the store writes the primary key into when returning rows
     */
    default String keyAttribute() {
        return "id";
    }
}
