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
 * Operations of vector aggregations, which combine samples across series.
 */
public enum VectorOperation {
    SUM("sum"),
    AVG("avg"),
    MAX("max"),
    MIN("min"),
    COUNT("count"),
    STDDEV("stddev"),
    STDVAR("stdvar"),
    BOTTOMK("bottomk"),
    TOPK("topk");

    private final String name;

    VectorOperation(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * @return true for topk and bottomk, which take a mandatory integer parameter
     */
    public boolean requiresParam() {
        return this == TOPK || this == BOTTOMK;
    }

    /**
     * @param name the operation name as written in a query
     * @return the operation
     * @throws LogQLParseException if the name is not a vector aggregation
     */
    public static VectorOperation fromString(String name) {
        for (VectorOperation op : values()) {
            if (op.name.equals(name)) {
                return op;
            }
        }
        throw new LogQLParseException("unknown vector aggregation operation: " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
