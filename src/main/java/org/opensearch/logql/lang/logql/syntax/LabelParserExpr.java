/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.core.exception.LogQLParseException;
import org.opensearch.logql.core.utils.QueryStrings;
import org.opensearch.logql.query.stage.Stage;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * A parser stage extracting labels from the line, e.g. {@code | logfmt} or
 * {@code | pattern "<ip> - <_>"}.
 */
public final class LabelParserExpr implements StageExpr {

    private final ParserType type;
    private final String param;

    private LabelParserExpr(ParserType type, String param) {
        this.type = type;
        this.param = param;
    }

    public static LabelParserExpr of(ParserType type) {
        return of(type, "");
    }

    /**
     * @throws LogQLParseException if the parser takes an expression and {@code param} is empty
     */
    public static LabelParserExpr of(ParserType type, String param) {
        Objects.requireNonNull(type, "parser type cannot be null");
        String value = param == null ? "" : param;
        if (type.requiresParam() && value.isEmpty()) {
            throw new LogQLParseException("parameter required for parser " + type.getName());
        }
        return new LabelParserExpr(type, value);
    }

    public ParserType getType() {
        return type;
    }

    public String getParam() {
        return param;
    }

    @Override
    public Stage stage(CompileContext context) {
        return context.getStageFactory().newParser(type, param);
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
        if (param.isEmpty()) {
            return "| " + type.getName();
        }
        return "| " + type.getName() + " " + QueryStrings.quote(param);
    }
}
