/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.relationtools;

import org.apache.commons.collections4.ListUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-instance store of the collection each relation held right before its last assignment. These collections are the
 * baseline a save pass diffs the desired collection against. Snapshots are never refreshed automatically after a save.
 */
class Snapshots {

    /** keyed by relation name in order of first assignment, last write wins */
    private final Map<String, List<Record>> snapshots = new LinkedHashMap<>();

    void capture(String name, List<? extends Record> records) {
        snapshots.put(name, new ArrayList<>(records));
    }

    boolean contains(String name) {
        return snapshots.containsKey(name);
    }

    /**
     * @return the snapshot of the relation or an empty list if it was never assigned
     */
    List<Record> get(String name) {
        return ListUtils.unmodifiableList(snapshots.getOrDefault(name, Collections.emptyList()));
    }

    Set<String> names() {
        return Collections.unmodifiableSet(snapshots.keySet());
    }
}
