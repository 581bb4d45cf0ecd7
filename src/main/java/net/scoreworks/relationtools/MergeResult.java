/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.relationtools;

import org.apache.commons.collections4.ListUtils;

import java.util.List;

/**
 * Outcome of merging a payload into a collection of records.
 * @param <C> class-type of the merged records
 */
public final class MergeResult<C extends Record> {
    private final List<C> records;
    private final boolean input;

    private MergeResult(List<C> records, boolean input) {
        this.records = ListUtils.unmodifiableList(records);
        this.input = input;
    }

    static <C extends Record> MergeResult<C> of(List<C> records) {
        return new MergeResult<>(records, true);
    }

    /**
     * The payload held no input for the records, which are returned unchanged
     */
    static <C extends Record> MergeResult<C> noInput(List<C> existing) {
        return new MergeResult<>(existing, false);
    }

    public List<C> getRecords() {
        return records;
    }

    /**
     * @return false if the payload contained nothing under the expected scope
     */
    public boolean hasInput() {
        return input;
    }
}
