/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.query.sharding;

import org.opensearch.common.settings.Setting;
import org.opensearch.common.settings.Settings;

import java.util.List;

/**
 * Configuration for shard-level query planning.
 *
 * <p>Sharding splits a query so that shardable subtrees are evaluated independently on each
 * shard of the data and merged at the coordinator. Grouping push-down lets a {@code sum} hand its
 * grouping to the range aggregation below it, so that samples are reduced to the output labels
 * while they are extracted.</p>
 */
public class ShardingConfig {

    /**
     * Enable or disable query sharding entirely.
     * When disabled, every query is evaluated as a whole.
     *
     * <p>Default: true (enabled)</p>
     */
    public static final Setting<Boolean> SHARDING_ENABLED = Setting.boolSetting(
        "logql.query.sharding.enabled",
        true, // default
        Setting.Property.NodeScope,
        Setting.Property.Dynamic
    );

    /**
     * Enable or disable pushing the grouping of {@code sum} down into the sample extractor of an
     * ungrouped counting or summing range aggregation.
     *
     * <p>Default: true (enabled)</p>
     */
    public static final Setting<Boolean> VECTOR_GROUPING_PUSH_DOWN_ENABLED = Setting.boolSetting(
        "logql.query.vector_grouping_push_down.enabled",
        true, // default
        Setting.Property.NodeScope,
        Setting.Property.Dynamic
    );

    private final boolean shardingEnabled;
    private final boolean vectorGroupingPushDownEnabled;

    /**
     * Create configuration from settings.
     *
     * @param settings the node settings
     */
    public ShardingConfig(Settings settings) {
        this.shardingEnabled = SHARDING_ENABLED.get(settings);
        this.vectorGroupingPushDownEnabled = VECTOR_GROUPING_PUSH_DOWN_ENABLED.get(settings);
    }

    /**
     * Create configuration with explicit values (for testing).
     *
     * @param shardingEnabled whether sharding is enabled
     * @param vectorGroupingPushDownEnabled whether the sum grouping push-down is enabled
     */
    public ShardingConfig(boolean shardingEnabled, boolean vectorGroupingPushDownEnabled) {
        this.shardingEnabled = shardingEnabled;
        this.vectorGroupingPushDownEnabled = vectorGroupingPushDownEnabled;
    }

    /**
     * Check if sharding is enabled.
     *
     * @return true if enabled
     */
    public boolean isShardingEnabled() {
        return shardingEnabled;
    }

    /**
     * Check if the sum grouping push-down is enabled.
     *
     * @return true if enabled
     */
    public boolean isVectorGroupingPushDownEnabled() {
        return vectorGroupingPushDownEnabled;
    }

    /**
     * All settings declared by this class, for registration by the hosting node.
     *
     * @return the settings
     */
    public static List<Setting<?>> getSettings() {
        return List.of(SHARDING_ENABLED, VECTOR_GROUPING_PUSH_DOWN_ENABLED);
    }

    /**
     * Default configuration for when settings are not available.
     *
     * @return default configuration
     */
    public static ShardingConfig defaultConfig() {
        return new ShardingConfig(
            true, // sharding enabled
            true  // grouping push-down enabled
        );
    }

    /**
     * Configuration that never shards and never pushes grouping down.
     * Useful for testing or for comparing against unsharded results.
     *
     * @return disabled configuration
     */
    public static ShardingConfig disabled() {
        return new ShardingConfig(false, false);
    }
}
