/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import java.util.function.Consumer;

/**
 * Root of the LogQL expression tree.
 *
 * <p>The set of node kinds is closed. Nodes are created through validating static factories and
 * are immutable once construction has finished, apart from the explicit append operations used
 * while a query is being assembled.
 *
 * <p>{@link #toString()} renders the canonical query text of the node; parsing that text yields
 * an equivalent tree.
 */
public sealed interface Expr permits LogSelectorExpr, SampleExpr, StageExpr, LogRange {

    /**
     * Whether this subtree can be evaluated independently on each shard of the data and the
     * partial results merged into the exact global result.
     *
     * @return true if the subtree is shardable
     */
    boolean isShardable();

    /**
     * Visits this node and its owned children, depth first, self before children and children
     * left to right.
     *
     * @param visitor called once per visited node
     */
    void walk(Consumer<Expr> visitor);
}
