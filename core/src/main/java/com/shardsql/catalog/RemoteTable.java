package com.shardsql.catalog;

import java.util.Objects;

/**
 * A concrete table on the remote engine that a base relation reads.
 *
 * @param database the database that owns the table
 * @param name the table name
 * @param distribution how the table is spread across the cluster
 */
public record RemoteTable(String database, String name, DistributionDescriptor distribution) {

    public RemoteTable {
        Objects.requireNonNull(database, "database must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(distribution, "distribution must not be null");
    }

    @Override
    public String toString() {
        return database + "." + name;
    }
}
