/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.relationtools;

import net.scoreworks.relationtools.exceptions.EmptyPreparedInputException;
import net.scoreworks.relationtools.storage.RecordStore;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class of a record whose attributes live in a map and which is persisted to the {@link RecordStore} configured
 * in {@link Persistence}. Subclasses declare their attributes with {@link #attributes()} and contribute validation
 * rules by overriding {@link #validateAttribute(String, Object)}.
 */
public abstract class ActiveRecord implements Record {
    private static final Logger LOGGER = LoggerFactory.getLogger(ActiveRecord.class);

    private final Map<String, Object> values = new LinkedHashMap<>();

    private final Map<String, List<String>> errors = new LinkedHashMap<>();

    private boolean newRecord = true;

    /**
     * @return the table this record type is stored in, defaults to the uncapitalized simple class name
     */
    public String tableName() {
        return StringUtils.uncapitalize(getClass().getSimpleName());
    }

    @Override
    public String formName() {
        return getClass().getSimpleName();
    }

    @Override
    public String primaryKey() {
        return "id";
    }

    @Override
    public @Nullable Object getPrimaryKey() {
        return values.get(primaryKey());
    }

    @Override
    public boolean isNewRecord() {
        return newRecord;
    }

    @Override
    public @Nullable Object getAttribute(String name) {
        return values.get(name);
    }

    @Override
    public void setAttribute(String name, @Nullable Object value) {
        if (!attributes().contains(name))
            throw new IllegalArgumentException(getClass().getSimpleName() + " has no attribute \"" + name + "\"");
        values.put(name, value);
    }

    @Override
    public Map<String, Object> getAttributes() {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (String name : attributes()) {
            copy.put(name, values.get(name));
        }
        return copy;
    }

    @Override
    public void setAttributes(Map<String, ?> attributeValues) {
        List<String> attributes = attributes();
        for (Map.Entry<String, ?> entry : attributeValues.entrySet()) {
            if (attributes.contains(entry.getKey()))
                values.put(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Can be overridden to format raw input before it is assigned in {@link #load(Map, String)}
     * @param data raw attribute values of this record
     * @return the values to assign, must not be empty
     */
    protected Map<String, ?> prepare(Map<String, ?> data) {
        return data;
    }

    @Override
    @SuppressWarnings("unchecked")
    public boolean load(Map<String, ?> data, @Nullable String formName) {
        String scope = formName == null ? formName() : formName;

        Map<String, ?> raw = null;
        if (scope.isEmpty() && MapUtils.isNotEmpty(data)) {
            raw = data;
        } else if (data != null && data.get(scope) instanceof Map) {
            raw = (Map<String, ?>) data.get(scope);
        }

        if (MapUtils.isNotEmpty(raw)) {
            Map<String, ?> formatted = prepare(raw);
            if (MapUtils.isEmpty(formatted))
                throw new EmptyPreparedInputException(getClass());
            setAttributes(formatted);
            return true;
        }
        return false;
    }

    /**
     * Validation rule hook, called once per validated attribute. Report problems with {@link #addError(String, String)}
     */
    protected void validateAttribute(String attribute, @Nullable Object value) {}

    @Override
    public boolean validate(@Nullable Collection<String> attributeNames, boolean clearErrors) {
        if (clearErrors)
            errors.clear();
        for (String attribute : attributeNames == null ? attributes() : attributeNames) {
            validateAttribute(attribute, values.get(attribute));
        }
        return !hasErrors();
    }

    public void addError(String attribute, String message) {
        errors.computeIfAbsent(attribute, a -> new ArrayList<>()).add(message);
    }

    public void clearErrors() {
        errors.clear();
    }

    @Override
    public Map<String, List<String>> getErrors() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : errors.entrySet()) {
            copy.put(entry.getKey(), new ArrayList<>(entry.getValue()));
        }
        return copy;
    }

    @Override
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public boolean save(boolean runValidation, @Nullable Collection<String> attributeNames) {
        if (runValidation && !validate(attributeNames, true)) {
            LOGGER.info("{} not saved due to validation error", this);
            return false;
        }
        RecordStore store = Persistence.getInstance().getStore();
        if (newRecord) {
            Map<String, Object> row = getAttributes();
            Object assignedKey = row.remove(primaryKey());
            //a key assigned before the first save addresses the stored row it names
            if (CollectionDiff.identity(assignedKey) != null && store.update(tableName(), assignedKey, row)) {
                newRecord = false;
                return true;
            }
            Object key = store.insert(tableName(), row);
            if (key == null)
                return false;
            values.put(primaryKey(), key);
            newRecord = false;
            return true;
        }
        Map<String, Object> row = new LinkedHashMap<>();
        for (String attribute : attributeNames == null ? attributes() : attributeNames) {
            if (!attribute.equals(primaryKey()))
                row.put(attribute, values.get(attribute));
        }
        return store.update(tableName(), getPrimaryKey(), row);
    }

    /**
     * Hook invoked before the row of this record is deleted
     * @return false to prevent the deletion
     */
    protected boolean beforeDelete() {
        return true;
    }

    @Override
    public boolean delete() {
        if (newRecord || getPrimaryKey() == null)
            return false;
        if (!beforeDelete())
            return false;
        return Persistence.getInstance().getStore().delete(tableName(), getPrimaryKey());
    }

    /**
     * Fill a fresh instance with a row read from storage
     */
    void populate(Map<String, Object> row) {
        setAttributes(row);
        newRecord = false;
    }

    /**
     * @param condition attribute values the records must have
     * @return all stored records of the given class matching the condition
     */
    public static <R extends ActiveRecord> List<R> findAll(Class<R> clazz, Map<String, ?> condition) {
        R prototype = RecordMetadata.construct(clazz);
        List<R> records = new ArrayList<>();
        for (Map<String, Object> row : Persistence.getInstance().getStore().findAll(prototype.tableName(), condition)) {
            R record = RecordMetadata.construct(clazz);
            record.populate(row);
            records.add(record);
        }
        return records;
    }

    public static <R extends ActiveRecord> @Nullable R findOne(Class<R> clazz, Object key) {
        R prototype = RecordMetadata.construct(clazz);
        List<R> records = findAll(clazz, Map.of(prototype.primaryKey(), key));
        return records.isEmpty() ? null : records.get(0);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "#" + (getPrimaryKey() == null ? "new" : getPrimaryKey());
    }
}
