/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.query.extractor.SampleExtractor;

import java.util.List;

/**
 * An expression that produces numeric samples.
 */
public sealed interface SampleExpr extends Expr permits RangeAggregationExpr, VectorAggregationExpr, BinOpExpr, LiteralExpr,
    LabelReplaceExpr {

    /**
     * @return the log selector that feeds this expression; for binary operations the left leg's
     */
    LogSelectorExpr getSelector();

    /**
     * Compiles this expression into a sample extractor.
     *
     * @param context factories and settings used for compilation
     * @return the extractor, or null for a literal, which extracts nothing
     * @throws org.opensearch.logql.core.exception.QueryCompilationException if compilation fails
     */
    SampleExtractor extractor(CompileContext context);

    /**
     * @return the (matchers, interval, offset) windows this expression reads, left to right
     */
    List<MatcherRange> getMatcherGroups();
}
