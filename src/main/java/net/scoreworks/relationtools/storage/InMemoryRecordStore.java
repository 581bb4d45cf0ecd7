/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.relationtools.storage;

import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link RecordStore} that keeps tables in memory. Keys are generated per table, starting at 1. Every call is counted
 * per {@link Operation} so callers can observe how often a store was touched.
 */
public class InMemoryRecordStore implements RecordStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryRecordStore.class);

    public enum Operation { INSERT, UPDATE, DELETE, FIND }

    private final Map<String, Map<Long, Map<String, Object>>> tables = new HashMap<>();
    private final Map<String, Long> sequences = new HashMap<>();
    private final Map<Operation, Integer> calls = new EnumMap<>(Operation.class);

    @Override
    public Object insert(String table, Map<String, Object> row) {
        count(Operation.INSERT);
        long key = sequences.merge(table, 1L, Long::sum);
        Map<String, Object> stored = new LinkedHashMap<>(row);
        stored.put(keyAttribute(), key);
        table(table).put(key, stored);
        LOGGER.debug("inserted {}#{}", table, key);
        return key;
    }

    @Override
    public boolean update(String table, Object key, Map<String, Object> row) {
        count(Operation.UPDATE);
        Long id = toKey(key);
        Map<String, Object> stored = id == null ? null : table(table).get(id);
        if (stored == null)
            return false;
        stored.putAll(row);
        stored.put(keyAttribute(), id);
        return true;
    }

    @Override
    public boolean delete(String table, Object key) {
        count(Operation.DELETE);
        return table(table).remove(toKey(key)) != null;
    }

    @Override
    public List<Map<String, Object>> findAll(String table, Map<String, ?> condition) {
        count(Operation.FIND);
        List<Map<String, Object>> result = new ArrayList<>();
        for (Map<String, Object> row : table(table).values()) {
            if (matches(row, condition))
                result.add(new LinkedHashMap<>(row));
        }
        return result;
    }

    /**
     * @return number of rows currently stored in the table
     */
    public int size(String table) {
        return table(table).size();
    }

    public boolean contains(String table, Object key) {
        return table(table).containsKey(toKey(key));
    }

    public int getCalls(Operation operation) {
        return calls.getOrDefault(operation, 0);
    }

    public void resetCalls() {
        calls.clear();
    }

    private void count(Operation operation) {
        calls.merge(operation, 1, Integer::sum);
    }

    private Map<Long, Map<String, Object>> table(String name) {
        return tables.computeIfAbsent(name, n -> new LinkedHashMap<>());
    }

    private static boolean matches(Map<String, Object> row, Map<String, ?> condition) {
        if (MapUtils.isEmpty(condition))
            return true;
        for (Map.Entry<String, ?> entry : condition.entrySet()) {
            Object value = row.get(entry.getKey());
            if (value == null || entry.getValue() == null)
                return false;
            if (!Objects.equals(value.toString(), entry.getValue().toString()))
                return false;
        }
        return true;
    }

    /**
     * @return the numeric key or null if the key can never name a row of this store
     */
    private static @Nullable Long toKey(@Nullable Object key) {
        if (key instanceof Number)
            return ((Number) key).longValue();
        if (key == null || !NumberUtils.isDigits(key.toString()))
            return null;
        return NumberUtils.createLong(key.toString());
    }
}
