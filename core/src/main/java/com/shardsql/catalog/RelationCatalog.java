package com.shardsql.catalog;

import java.util.Optional;

/**
 * Lookup from the host's base relations to remote tables.
 *
 * <p>Implementations must be safe to call from several compilations at once.
 */
@FunctionalInterface
public interface RelationCatalog {

    /**
     * Resolves a base relation to the remote table that backs it.
     *
     * @param handle the host relation
     * @return the remote table, or empty when the relation is not a plain remote
     *         table (a computed relation, a local dataset, a table on another system)
     */
    Optional<RemoteTable> lookup(RelationHandle handle);
}
