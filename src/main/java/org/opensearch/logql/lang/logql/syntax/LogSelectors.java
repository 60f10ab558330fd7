/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.core.model.MatchType;

import java.util.List;

/**
 * Operations on log selectors used when rewriting queries.
 */
public final class LogSelectors {

    private LogSelectors() {}

    /**
     * Appends a line filter to a selector. A bare stream selector becomes a new pipeline with the
     * filter as its only stage; a pipeline gets the filter appended in place.
     *
     * @param selector the selector to filter
     * @param type     the match type of the filter
     * @param op       the named predicate function, empty for none
     * @param match    the filter argument
     * @return the filtered selector
     * @throws IllegalArgumentException if the selector is neither a stream selector nor a pipeline
     */
    public static LogSelectorExpr addFilter(LogSelectorExpr selector, MatchType type, String op, String match) {
        LineFilterExpr filter = LineFilterExpr.of(type, op, match);
        if (selector instanceof MatchersExpr matchers) {
            return PipelineExpr.of(matchers, List.of(filter));
        }
        if (selector instanceof PipelineExpr pipeline) {
            pipeline.appendStage(filter);
            return pipeline;
        }
        throw new IllegalArgumentException("unknown log selector: " + selector);
    }
}
