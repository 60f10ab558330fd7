/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.query.stage.Stage;

/**
 * A single pipeline stage such as a line filter, parser or formatter.
 */
public sealed interface StageExpr extends Expr permits LineFilterExpr, LabelParserExpr, LabelFilterExpr, LineFmtExpr, LabelFmtExpr,
    JsonExpressionParserExpr {

    /**
     * @param context factories used for compilation
     * @return the compiled stage, possibly {@link Stage#NOOP}
     */
    Stage stage(CompileContext context);
}
