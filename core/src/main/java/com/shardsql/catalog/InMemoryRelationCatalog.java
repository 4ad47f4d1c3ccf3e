package com.shardsql.catalog;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link RelationCatalog} backed by an in-memory map.
 *
 * <p>Hosts that already know the remote tables at session start register them
 * here; anything not registered is treated as not pushable.
 */
public class InMemoryRelationCatalog implements RelationCatalog {

    private final Map<RelationHandle, RemoteTable> tables = new ConcurrentHashMap<>();

    /**
     * Registers the remote table backing a relation, replacing any previous entry.
     *
     * @param handle the host relation
     * @param table the remote table
     * @return this catalog
     */
    public InMemoryRelationCatalog register(RelationHandle handle, RemoteTable table) {
        tables.put(Objects.requireNonNull(handle, "handle must not be null"),
                   Objects.requireNonNull(table, "table must not be null"));
        return this;
    }

    /**
     * Removes a relation from the catalog.
     *
     * @param handle the host relation
     */
    public void unregister(RelationHandle handle) {
        tables.remove(handle);
    }

    @Override
    public Optional<RemoteTable> lookup(RelationHandle handle) {
        return Optional.ofNullable(tables.get(handle));
    }
}
