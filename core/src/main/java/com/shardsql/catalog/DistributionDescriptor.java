package com.shardsql.catalog;

import com.shardsql.types.DataType;
import java.util.List;
import java.util.Objects;

/**
 * Physical distribution of a remote table across the leaves of a cluster.
 *
 * <p>A {@link Kind#SHARDED} table is hash-partitioned on its shard key into
 * {@code partitionCount} partitions. A {@link Kind#REFERENCE} table is fully
 * replicated to every leaf and has no shard key.
 *
 * @param clusterId identity of the physical cluster (for example the aggregator host and port)
 * @param kind how rows are spread across leaves
 * @param shardKey the shard key columns in key order, empty for reference tables
 * @param partitionCount number of partitions of the owning database
 */
public record DistributionDescriptor(String clusterId, Kind kind, List<KeyColumn> shardKey, int partitionCount) {

    /**
     * Distribution kinds.
     */
    public enum Kind {
        SHARDED,
        REFERENCE
    }

    /**
     * One shard key column.
     *
     * @param name the column name
     * @param dataType the column type, which determines how the key hashes
     */
    public record KeyColumn(String name, DataType dataType) {

        public KeyColumn {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(dataType, "dataType must not be null");
        }
    }

    public DistributionDescriptor {
        Objects.requireNonNull(clusterId, "clusterId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        shardKey = List.copyOf(Objects.requireNonNull(shardKey, "shardKey must not be null"));
        if (kind == Kind.REFERENCE && !shardKey.isEmpty()) {
            throw new IllegalArgumentException("reference tables have no shard key");
        }
        if (partitionCount < 1) {
            throw new IllegalArgumentException("partitionCount must be positive, got: " + partitionCount);
        }
    }

    /**
     * Creates a descriptor for a table sharded on the given key.
     *
     * @param clusterId the cluster identity
     * @param partitionCount partitions of the owning database
     * @param shardKey the shard key columns
     * @return the descriptor
     */
    public static DistributionDescriptor sharded(String clusterId, int partitionCount, List<KeyColumn> shardKey) {
        return new DistributionDescriptor(clusterId, Kind.SHARDED, shardKey, partitionCount);
    }

    /**
     * Creates a descriptor for a table replicated to every leaf.
     *
     * @param clusterId the cluster identity
     * @param partitionCount partitions of the owning database
     * @return the descriptor
     */
    public static DistributionDescriptor reference(String clusterId, int partitionCount) {
        return new DistributionDescriptor(clusterId, Kind.REFERENCE, List.of(), partitionCount);
    }

    public boolean isReplicated() {
        return kind == Kind.REFERENCE;
    }
}
