/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.core.utils.QueryStrings;
import org.opensearch.logql.query.stage.Stage;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Rewrites the line from a template: {@code | line_format "{{.status}} {{.path}}"}.
 */
public final class LineFmtExpr implements StageExpr {

    private final String template;

    private LineFmtExpr(String template) {
        this.template = template;
    }

    public static LineFmtExpr of(String template) {
        return new LineFmtExpr(Objects.requireNonNull(template, "line format template cannot be null"));
    }

    public String getTemplate() {
        return template;
    }

    @Override
    public Stage stage(CompileContext context) {
        return context.getStageFactory().newLineFormatter(template);
    }

    @Override
    public boolean isShardable() {
        return true;
    }

    @Override
    public void walk(Consumer<Expr> visitor) {
        visitor.accept(this);
    }

    @Override
    public String toString() {
        return "| line_format " + QueryStrings.quote(template);
    }
}
