/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.query.extractor.SampleExtractorFactory;
import org.opensearch.logql.query.filter.FilterFactory;
import org.opensearch.logql.query.sharding.ShardingConfig;
import org.opensearch.logql.query.stage.StageFactory;

import java.util.Objects;

/**
 * Capabilities handed to pipeline and extractor compilation.
 */
public final class CompileContext {

    private final StageFactory stageFactory;
    private final FilterFactory filterFactory;
    private final SampleExtractorFactory extractorFactory;
    private final ShardingConfig config;

    /**
     * Creates a context with the default {@link ShardingConfig}.
     */
    public CompileContext(StageFactory stageFactory, FilterFactory filterFactory, SampleExtractorFactory extractorFactory) {
        this(stageFactory, filterFactory, extractorFactory, ShardingConfig.defaultConfig());
    }

    public CompileContext(
        StageFactory stageFactory,
        FilterFactory filterFactory,
        SampleExtractorFactory extractorFactory,
        ShardingConfig config
    ) {
        this.stageFactory = Objects.requireNonNull(stageFactory, "stageFactory cannot be null");
        this.filterFactory = Objects.requireNonNull(filterFactory, "filterFactory cannot be null");
        this.extractorFactory = Objects.requireNonNull(extractorFactory, "extractorFactory cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public StageFactory getStageFactory() {
        return stageFactory;
    }

    public FilterFactory getFilterFactory() {
        return filterFactory;
    }

    public SampleExtractorFactory getExtractorFactory() {
        return extractorFactory;
    }

    public ShardingConfig getConfig() {
        return config;
    }
}
