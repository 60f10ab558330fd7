/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.core.exception.LogQLParseException;

/**
 * Operations of range aggregations, which turn a log range into a sample per series.
 */
public enum RangeOperation {
    COUNT_OVER_TIME("count_over_time"),
    RATE("rate"),
    RATE_COUNTER("rate_counter"),
    BYTES_OVER_TIME("bytes_over_time"),
    BYTES_RATE("bytes_rate"),
    AVG_OVER_TIME("avg_over_time"),
    SUM_OVER_TIME("sum_over_time"),
    MIN_OVER_TIME("min_over_time"),
    MAX_OVER_TIME("max_over_time"),
    STDVAR_OVER_TIME("stdvar_over_time"),
    STDDEV_OVER_TIME("stddev_over_time"),
    QUANTILE_OVER_TIME("quantile_over_time"),
    FIRST_OVER_TIME("first_over_time"),
    LAST_OVER_TIME("last_over_time"),
    ABSENT_OVER_TIME("absent_over_time");

    private final String name;

    RangeOperation(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * @param name the operation name as written in a query
     * @return the operation
     * @throws LogQLParseException if the name is not a range aggregation
     */
    public static RangeOperation fromString(String name) {
        for (RangeOperation op : values()) {
            if (op.name.equals(name)) {
                return op;
            }
        }
        throw new LogQLParseException("unknown range aggregation operation: " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
