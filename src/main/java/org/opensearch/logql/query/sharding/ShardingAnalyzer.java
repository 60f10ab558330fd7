/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.query.sharding;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.logql.lang.logql.syntax.Expr;

import java.util.Objects;

/**
 * Decides whether a query may be split across shards.
 *
 * <p>Combines the {@link ShardingConfig#SHARDING_ENABLED} setting with the structural
 * {@link Expr#isShardable()} check of the expression tree.
 */
public class ShardingAnalyzer {

    private static final Logger logger = LogManager.getLogger(ShardingAnalyzer.class);

    private final ShardingConfig config;

    public ShardingAnalyzer(ShardingConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * @param expr the query
     * @return true if sharding is enabled and every operation in the tree can be sharded
     */
    public boolean canShard(Expr expr) {
        Objects.requireNonNull(expr, "expr cannot be null");
        if (!config.isShardingEnabled()) {
            logger.debug("Sharding disabled by [{}], evaluating [{}] unsharded", ShardingConfig.SHARDING_ENABLED.getKey(), expr);
            return false;
        }
        boolean shardable = expr.isShardable();
        logger.debug("Query [{}] is {}", expr, shardable ? "shardable" : "not shardable");
        return shardable;
    }

    public ShardingConfig getConfig() {
        return config;
    }
}
