/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.core.exception.LogQLParseException;
import org.opensearch.logql.core.exception.QueryCompilationException;
import org.opensearch.logql.core.exception.StageException;
import org.opensearch.logql.core.model.MatchType;
import org.opensearch.logql.core.utils.QueryStrings;
import org.opensearch.logql.query.filter.AndFilter;
import org.opensearch.logql.query.filter.FilterFactory;
import org.opensearch.logql.query.filter.Filterer;
import org.opensearch.logql.query.stage.Stage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A line filter such as {@code |= "error"}, {@code !~ "debug|trace"} or {@code |= ip("10.0.0.0/8")}.
 *
 * <p>Consecutive line filters are chained: each link keeps a reference to the filter written
 * before it. The chain is rendered and compiled head first, so {@code |= "a" != "b"} is a single
 * expression whose {@link #getLeft() left} link is {@code |= "a"}.
 */
public final class LineFilterExpr implements StageExpr {

    /** Named predicate testing whether the line contains an IP address matching a pattern. */
    public static final String OP_IP = "ip";

    private final LineFilterExpr left;
    private final MatchType type;
    private final String match;
    private final String op;

    private LineFilterExpr(LineFilterExpr left, MatchType type, String match, String op) {
        this.left = left;
        this.type = type;
        this.match = match;
        this.op = op;
    }

    /**
     * Creates a plain line filter.
     */
    public static LineFilterExpr of(MatchType type, String match) {
        return of(type, "", match);
    }

    /**
     * Creates a line filter.
     *
     * @param type  the match type
     * @param op    the named predicate function, empty for a plain substring or regex filter
     * @param match the literal, regex or predicate argument
     * @throws LogQLParseException if {@code op} is not a known predicate
     */
    public static LineFilterExpr of(MatchType type, String op, String match) {
        Objects.requireNonNull(type, "match type cannot be null");
        Objects.requireNonNull(match, "match cannot be null");
        String function = op == null ? "" : op;
        if (!function.isEmpty() && !OP_IP.equals(function)) {
            throw new LogQLParseException("unknown line filter function: " + function);
        }
        return new LineFilterExpr(null, type, match, function);
    }

    /**
     * Chains {@code right} after {@code left}. Only the filter of {@code right} is kept; any
     * previous link of {@code right} is replaced by {@code left}.
     */
    public static LineFilterExpr nested(LineFilterExpr left, LineFilterExpr right) {
        Objects.requireNonNull(left, "left line filter cannot be null");
        Objects.requireNonNull(right, "right line filter cannot be null");
        return new LineFilterExpr(left, right.type, right.match, right.op);
    }

    public LineFilterExpr getLeft() {
        return left;
    }

    public MatchType getType() {
        return type;
    }

    public String getMatch() {
        return match;
    }

    public String getOp() {
        return op;
    }

    /**
     * Compiles the whole chain into one line predicate. A single link compiles to its own
     * filter, longer chains to an {@link AndFilter} over the links in written order.
     *
     * @throws StageException if the filter factory rejects a link
     */
    public Filterer filter(CompileContext context) {
        FilterFactory factory = context.getFilterFactory();
        List<Filterer> filters = new ArrayList<>();
        try {
            for (LineFilterExpr current = this; current != null; current = current.left) {
                Filterer filter = OP_IP.equals(current.op)
                    ? factory.newIpLineFilter(current.match, current.type)
                    : factory.newFilter(current.match, current.type);
                if (filter == null) {
                    throw new QueryCompilationException("no filter for line filter [" + current.renderSelf() + "]");
                }
                filters.add(filter);
            }
        } catch (StageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StageException(toString(), e);
        }
        if (filters.size() == 1) {
            return filters.get(0);
        }
        Collections.reverse(filters);
        return new AndFilter(filters);
    }

    @Override
    public Stage stage(CompileContext context) {
        return filter(context).toStage();
    }

    @Override
    public boolean isShardable() {
        return true;
    }

    @Override
    public void walk(Consumer<Expr> visitor) {
        visitor.accept(this);
        if (left != null) {
            left.walk(visitor);
        }
    }

    private String renderSelf() {
        StringBuilder sb = new StringBuilder(type.getLineFilterSymbol()).append(' ');
        if (op.isEmpty()) {
            sb.append(QueryStrings.quote(match));
        } else {
            sb.append(op).append('(').append(QueryStrings.quote(match)).append(')');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        if (left == null) {
            return renderSelf();
        }
        return left + " " + renderSelf();
    }
}
