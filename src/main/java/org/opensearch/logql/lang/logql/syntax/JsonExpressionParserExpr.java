/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.core.exception.LogQLParseException;
import org.opensearch.logql.query.stage.JsonExpression;
import org.opensearch.logql.query.stage.Stage;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * The JSON parser restricted to selected fields: {@code | json status="response.code",ua="headers[\"ua\"]"}.
 */
public final class JsonExpressionParserExpr implements StageExpr {

    private final List<JsonExpression> expressions;

    private JsonExpressionParserExpr(List<JsonExpression> expressions) {
        this.expressions = expressions;
    }

    /**
     * @throws LogQLParseException if {@code expressions} is empty
     */
    public static JsonExpressionParserExpr of(List<JsonExpression> expressions) {
        Objects.requireNonNull(expressions, "json expressions cannot be null");
        if (expressions.isEmpty()) {
            throw new LogQLParseException("json parser requires at least one expression");
        }
        return new JsonExpressionParserExpr(List.copyOf(expressions));
    }

    public List<JsonExpression> getExpressions() {
        return expressions;
    }

    @Override
    public Stage stage(CompileContext context) {
        return context.getStageFactory().newJsonExpressionParser(expressions);
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
        return "| json " + expressions.stream().map(JsonExpression::toString).collect(Collectors.joining(","));
    }
}
