/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import java.util.Set;

/**
 * Operations whose partial results, computed per shard, can be merged into the exact global result.
 *
 * <p>The sample operation must be associative, like {@code +} and {@code *} but not {@code /},
 * {@code %} or {@code ^}. When it feeds a vector aggregation or a set operation, the vector
 * operation must also distribute over it so that merging can be applied repeatedly across shards.
 * The vector aggregations {@code topk}, {@code bottomk}, {@code max} and {@code min} are excluded: a per-shard max grouped by
 * some label may discard a series whose value only wins once all shards are combined.
 */
public final class ShardableOperations {

    private static final Set<String> SHARDABLE = Set.of(
        // vector aggregations
        VectorOperation.SUM.getName(),
        // avg is rewritten into sum/count by the sharding planner
        VectorOperation.AVG.getName(),
        VectorOperation.COUNT.getName(),

        // range aggregations
        RangeOperation.COUNT_OVER_TIME.getName(),
        RangeOperation.RATE.getName(),
        RangeOperation.BYTES_OVER_TIME.getName(),
        RangeOperation.BYTES_RATE.getName(),
        RangeOperation.SUM_OVER_TIME.getName(),
        RangeOperation.MAX_OVER_TIME.getName(),
        RangeOperation.MIN_OVER_TIME.getName(),

        // arithmetic binary operators
        BinaryOperator.ADD.getSymbol(),
        BinaryOperator.MUL.getSymbol()
    );

    private ShardableOperations() {}

    /**
     * @param operation an operation name or operator symbol
     * @return true if the operation may be sharded
     */
    public static boolean isShardable(String operation) {
        return SHARDABLE.contains(operation);
    }

    /**
     * @return all shardable operation names and operator symbols
     */
    public static Set<String> all() {
        return SHARDABLE;
    }
}
