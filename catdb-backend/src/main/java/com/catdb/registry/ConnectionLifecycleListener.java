package com.catdb.registry;

/**
 * Notified after the registry changes a named connection.
 */
@FunctionalInterface
public interface ConnectionLifecycleListener {

    /**
     * What happened to the connection.
     */
    enum Change {
        ADDED,
        EDITED,
        REMOVED,
        SCHEMA_CHANGED
    }

    /**
     * Called outside the registry lock.
     *
     * @param connectionName connection name
     * @param change change
     */
    void onConnectionChanged(String connectionName, Change change);
}
