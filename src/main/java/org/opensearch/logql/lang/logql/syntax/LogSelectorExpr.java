/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.core.model.LabelMatcher;
import org.opensearch.logql.query.stage.Pipeline;

import java.util.List;

/**
 * An expression that selects log lines: a stream selector, optionally followed by pipeline stages.
 */
public sealed interface LogSelectorExpr extends Expr permits MatchersExpr, PipelineExpr, LiteralExpr {

    /**
     * @return the stream matchers of the selector, possibly empty
     */
    List<LabelMatcher> getMatchers();

    /**
     * Compiles the selector into an executable pipeline.
     *
     * @param context factories and settings used for compilation
     * @return the compiled pipeline, never null
     * @throws org.opensearch.logql.core.exception.QueryCompilationException if a stage cannot be compiled
     */
    Pipeline pipeline(CompileContext context);

    /**
     * @return true if the selector contains a line filter or a label filter stage
     */
    boolean hasFilter();
}
