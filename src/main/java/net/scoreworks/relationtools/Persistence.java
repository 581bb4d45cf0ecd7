/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.relationtools;

import net.scoreworks.relationtools.storage.RecordStore;

/**
 * Holds the {@link RecordStore} all {@link ActiveRecord}s are persisted to.
 */
public class Persistence {

    /**
     * this class is a singleton!
     */
    private static final Persistence persistence = new Persistence();
    private Persistence() {}

    public static Persistence getInstance() {
        return persistence;
    }

    private RecordStore store;

    public void setStore(RecordStore store) {
        this.store = store;
    }

    /**
     * @throws IllegalStateException if no store was configured
     */
    public RecordStore getStore() {
        if (store == null)
            throw new IllegalStateException("No RecordStore configured. Use Persistence.getInstance().setStore() first!");
        return store;
    }

    public boolean hasStore() {
        return store != null;
    }

    /**
     * disconnect the store
     */
    public void shutdown() {
        store = null;
    }
}
