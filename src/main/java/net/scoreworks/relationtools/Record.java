/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.relationtools;

import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Single-record persistence primitive. A record knows how to load itself from raw input, validate, save and delete
 * itself and exposes its identity and attribute mapping. Relations between records are built on top of this interface
 * by {@link RelationalRecord}
 */
public interface Record {

    /**
     * Assign attributes from an untyped payload
     * @param data raw input
     * @param formName scope the attributes are nested under. Null uses {@link #formName()}, an empty string uses the
     *                 payload itself
     * @return true if the payload contained input for this record
     */
    boolean load(Map<String, ?> data, @Nullable String formName);

    default boolean load(Map<String, ?> data) {
        return load(data, null);
    }

    /**
     * @param attributeNames attributes to validate, null for all {@link #attributes()}
     * @param clearErrors whether errors of previous validations are discarded first
     * @return true if no validation errors exist afterwards
     */
    boolean validate(@Nullable Collection<String> attributeNames, boolean clearErrors);

    default boolean validate() {
        return validate(null, true);
    }

    /**
     * Insert or update this record
     * @param runValidation validate before saving and refuse to save invalid records
     * @param attributeNames attributes to validate and update, null for all
     */
    boolean save(boolean runValidation, @Nullable Collection<String> attributeNames);

    default boolean save() {
        return save(true, null);
    }

    boolean delete();

    /**
     * @return the identity of this record or null if it was never persisted
     */
    @Nullable Object getPrimaryKey();

    /**
     * @return name of the identity attribute
     */
    String primaryKey();

    boolean isNewRecord();

    /**
     * @return names of all declared attributes in declaration order
     */
    List<String> attributes();

    @Nullable Object getAttribute(String name);

    void setAttribute(String name, @Nullable Object value);

    /**
     * @return a copy of all attribute values keyed by attribute name
     */
    Map<String, Object> getAttributes();

    /**
     * Assign the given values. Keys that are not declared attributes are ignored
     */
    void setAttributes(Map<String, ?> values);

    /**
     * @return validation errors keyed by attribute name
     */
    Map<String, List<String>> getErrors();

    boolean hasErrors();

    /**
     * @return the conventional scope name input for this record type is nested under
     */
    String formName();
}
