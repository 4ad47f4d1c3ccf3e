package com.shardsql.catalog;

import java.util.Objects;

/**
 * The host's identifier for a base relation, used to look the relation up in
 * a {@link RelationCatalog}.
 *
 * @param name the host-side relation name
 */
public record RelationHandle(String name) {

    public RelationHandle {
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public String toString() {
        return name;
    }
}
