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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges untyped input, e.g. submitted tabular forms, into collections of records. Rows carrying the identity of an
 * existing record update that record, all other rows become new, unsaved records. The merged collection is meant to
 * be assigned back to the relation, so records no longer present in the input get removed on the next save.
 */
public final class PayloadMerger {
    private static final Logger LOGGER = LoggerFactory.getLogger(PayloadMerger.class);

    private PayloadMerger() {}

    /**
     * Merge rows found in the payload under the scope of the child type
     * @param childType class of records to construct for rows without matching identity
     * @param existing current records
     * @param data payload holding the rows under the scope key, or the rows themselves if the scope is empty
     * @param formName scope of the rows, null for the {@link Record#formName()} of the child type
     */
    public static <C extends Record> MergeResult<C> mergeFromPayload(Class<C> childType, @Nullable List<? extends C> existing,
                                                                  @Nullable Map<String, ?> data, @Nullable String formName) {
        List<C> records = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
        C prototype = records.isEmpty() ? RecordMetadata.construct(childType) : records.get(0);
        String scope = formName == null ? prototype.formName() : formName;

        Object rows = scope.isEmpty() ? data : (data == null ? null : data.get(scope));
        if (rows == null) {
            LOGGER.debug("no input for {} under scope \"{}\"", childType.getSimpleName(), scope);
            return MergeResult.noInput(records);
        }
        return MergeResult.of(merge(childType, records, rows(rows)));
    }

    /**
     * Merge a sequence of rows without any scoping
     */
    public static <C extends Record> List<C> mergeFromPayload(Class<C> childType, @Nullable List<? extends C> existing,
                                                           List<? extends Map<String, ?>> rows) {
        return merge(childType, existing == null ? Collections.emptyList() : existing, rows);
    }

    /**
     * Back-fill identities onto the current records by position. Rows without identity leave their record untouched,
     * rows beyond the end of the current collection are ignored
     * @return the current records, in the same order
     */
    public static <C extends Record> List<C> mergeIdentityOnly(List<? extends C> current, List<? extends Map<String, ?>> rows) {
        List<C> records = new ArrayList<>(current);
        for (int i = 0; i < rows.size(); i++) {
            if (i >= records.size()) {
                LOGGER.debug("ignoring identities of {} rows without matching record", rows.size() - i);
                break;
            }
            C record = records.get(i);
            Object key = rows.get(i).get(record.primaryKey());
            if (CollectionDiff.identity(key) != null)
                record.setAttribute(record.primaryKey(), key);
        }
        return records;
    }

    private static <C extends Record> List<C> merge(Class<C> childType, List<? extends C> existing, List<? extends Map<String, ?>> rows) {
        Map<String, ? extends C> index = CollectionDiff.index(existing);
        String primaryKey = existing.isEmpty() ? RecordMetadata.construct(childType).primaryKey() : existing.get(0).primaryKey();
        List<C> merged = new ArrayList<>();
        for (Map<String, ?> row : rows) {
            String key = CollectionDiff.identity(row.get(primaryKey));
            C record = key == null ? null : index.get(key);
            //rows repeating an identity update the same record again, the last row wins
            if (record == null)
                record = RecordMetadata.construct(childType);
            //identities only select the record, they are never assigned from input
            Map<String, Object> attributes = new LinkedHashMap<>(row);
            attributes.remove(record.primaryKey());
            record.load(attributes, "");
            merged.add(record);
        }
        return merged;
    }

    /**
     * Interpret a payload value as a sequence of rows. Maps contribute their values in iteration order, since form
     * input is often keyed by row index. Entries that are not maps are skipped
     */
    @SuppressWarnings("unchecked")
    static List<Map<String, ?>> rows(Object payload) {
        Collection<?> entries;
        if (payload instanceof Collection)
            entries = (Collection<?>) payload;
        else if (payload instanceof Map)
            entries = ((Map<?, ?>) payload).values();
        else
            entries = Collections.emptyList();

        List<Map<String, ?>> rows = new ArrayList<>();
        for (Object entry : entries) {
            if (entry instanceof Map)
                rows.add((Map<String, ?>) entry);
        }
        return rows;
    }
}
