/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.core.exception.LogQLParseException;
import org.opensearch.logql.core.model.LabelMatcher;
import org.opensearch.logql.core.utils.QueryStrings;
import org.opensearch.logql.query.extractor.SampleExtractor;
import org.opensearch.logql.query.stage.Pipeline;

import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * A numeric constant.
 *
 * <p>Literals only appear as legs of binary operations, where both a selector and a sample
 * expression are expected, so they are both. A literal selects no logs, compiles to a no-op
 * pipeline and has no extractor.
 */
public final class LiteralExpr implements LogSelectorExpr, SampleExpr {

    private final double value;

    private LiteralExpr(double value) {
        this.value = value;
    }

    public static LiteralExpr of(double value) {
        return new LiteralExpr(value);
    }

    /**
     * @param text   the number as written in the query
     * @param invert negate the parsed value (unary minus)
     * @throws LogQLParseException if the text is not a number
     */
    public static LiteralExpr of(String text, boolean invert) {
        double parsed;
        try {
            parsed = parse(text.trim());
        } catch (NumberFormatException e) {
            throw new LogQLParseException("unable to parse literal as a float: " + text, e);
        }
        return new LiteralExpr(invert ? -parsed : parsed);
    }

    private static double parse(String text) {
        return switch (text.toLowerCase(Locale.ROOT)) {
            case "inf", "+inf", "infinity", "+infinity" -> Double.POSITIVE_INFINITY;
            case "-inf", "-infinity" -> Double.NEGATIVE_INFINITY;
            case "nan" -> Double.NaN;
            default -> QueryStrings.parseFloat(text);
        };
    }

    public double getValue() {
        return value;
    }

    @Override
    public LogSelectorExpr getSelector() {
        return this;
    }

    @Override
    public List<LabelMatcher> getMatchers() {
        return List.of();
    }

    @Override
    public Pipeline pipeline(CompileContext context) {
        return Pipeline.noop();
    }

    @Override
    public boolean hasFilter() {
        return false;
    }

    /**
     * @return null, literals are evaluated without reading samples
     */
    @Override
    public SampleExtractor extractor(CompileContext context) {
        return null;
    }

    @Override
    public List<MatcherRange> getMatcherGroups() {
        return List.of();
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
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Double.compare(value, ((LiteralExpr) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return QueryStrings.formatFloat(value);
    }
}
