/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.logql.core.exception.LogQLParseException;
import org.opensearch.logql.core.model.Sample;
import org.opensearch.logql.query.extractor.SampleExtractor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A binary operation between two sample expressions, e.g.
 * <code>(rate({app="foo"}[1m]) / on (instance) group_left (pod) sum by (instance) (rate({app="bar"}[1m])))</code>.
 *
 * <p>Use {@link #of(BinaryOperator, BinOpOptions, Expr, Expr)}: an operation between two literals
 * is folded into a single {@link LiteralExpr}, so a {@code BinOpExpr} never has two literal legs.
 */
public final class BinOpExpr implements SampleExpr {

    private static final Logger logger = LogManager.getLogger(BinOpExpr.class);

    private final SampleExpr left;
    private final SampleExpr right;
    private final BinaryOperator op;
    private final BinOpOptions options;

    private BinOpExpr(SampleExpr left, SampleExpr right, BinaryOperator op, BinOpOptions options) {
        this.left = left;
        this.right = right;
        this.op = op;
        this.options = options;
    }

    /**
     * @see #of(BinaryOperator, BinOpOptions, Expr, Expr)
     * @throws LogQLParseException if {@code op} is not a binary operator, or {@code bool} is set
     *                             on an operator other than a comparison
     */
    public static SampleExpr of(String op, BinOpOptions options, Expr lhs, Expr rhs) {
        BinaryOperator operator;
        try {
            operator = BinaryOperator.fromSymbol(op);
        } catch (IllegalArgumentException e) {
            throw new LogQLParseException(e.getMessage(), e);
        }
        return of(operator, options, lhs, rhs);
    }

    /**
     * Creates a binary operation.
     *
     * @param op      the operator
     * @param options modifiers, or null
     * @param lhs     the left leg, must be a sample expression
     * @param rhs     the right leg, must be a sample expression
     * @return a {@link LiteralExpr} if both legs are literals, otherwise a {@code BinOpExpr}
     * @throws LogQLParseException if a leg is not a sample expression, a logical/set operator has a
     *                             literal leg, or {@code bool} modifies a non-comparison operator
     */
    public static SampleExpr of(BinaryOperator op, BinOpOptions options, Expr lhs, Expr rhs) {
        Objects.requireNonNull(op, "binary operator cannot be null");
        if (!(lhs instanceof SampleExpr left)) {
            throw new LogQLParseException(
                String.format(Locale.ROOT, "unexpected type for left leg of binary operation (%s): %s", op, typeName(lhs))
            );
        }
        if (!(rhs instanceof SampleExpr right)) {
            throw new LogQLParseException(
                String.format(Locale.ROOT, "unexpected type for right leg of binary operation (%s): %s", op, typeName(rhs))
            );
        }
        if (op.isLogical()) {
            if (left instanceof LiteralExpr literal) {
                throw new LogQLParseException(
                    String.format(
                        Locale.ROOT,
                        "unexpected literal for left leg of logical/set binary operation (%s): %f",
                        op,
                        literal.getValue()
                    )
                );
            }
            if (right instanceof LiteralExpr literal) {
                throw new LogQLParseException(
                    String.format(
                        Locale.ROOT,
                        "unexpected literal for right leg of logical/set binary operation (%s): %f",
                        op,
                        literal.getValue()
                    )
                );
            }
        }
        if (options != null && options.isReturnBool() && !op.isComparison()) {
            throw new LogQLParseException("bool modifier can only be used on comparison operators, got (" + op + ")");
        }
        if (left instanceof LiteralExpr l && right instanceof LiteralExpr r) {
            return fold(op, l, r);
        }
        return new BinOpExpr(left, right, op, options);
    }

    private static LiteralExpr fold(BinaryOperator op, LiteralExpr left, LiteralExpr right) {
        Sample merged = SampleMerger.merge(op, new Sample(0, left.getValue()), new Sample(0, right.getValue()), false, false);
        LiteralExpr folded = LiteralExpr.of(merged.getValue());
        logger.debug("Folded literal binary operation ({} {} {}) into {}", left, op, right, folded);
        return folded;
    }

    private static String typeName(Expr expr) {
        return expr == null ? "null" : expr.getClass().getSimpleName();
    }

    public SampleExpr getLeft() {
        return left;
    }

    public SampleExpr getRight() {
        return right;
    }

    public BinaryOperator getOp() {
        return op;
    }

    /**
     * @return the modifiers, or null
     */
    public BinOpOptions getOptions() {
        return options;
    }

    @Override
    public LogSelectorExpr getSelector() {
        return left.getSelector();
    }

    /**
     * Returns the left leg's extractor; the right leg is compiled separately by the evaluator.
     */
    @Override
    public SampleExtractor extractor(CompileContext context) {
        return left.extractor(context);
    }

    @Override
    public List<MatcherRange> getMatcherGroups() {
        List<MatcherRange> groups = new ArrayList<>(left.getMatcherGroups());
        groups.addAll(right.getMatcherGroups());
        return groups;
    }

    /**
     * Not shardable under explicit vector matching, as {@code on}/{@code ignoring} and the group
     * modifiers change the label sets the result is grouped by.
     */
    @Override
    public boolean isShardable() {
        if (options != null && options.getVectorMatching() != null && options.getVectorMatching().isExplicit()) {
            return false;
        }
        return ShardableOperations.isShardable(op.getSymbol()) && left.isShardable() && right.isShardable();
    }

    @Override
    public void walk(Consumer<Expr> visitor) {
        visitor.accept(this);
        left.walk(visitor);
        right.walk(visitor);
    }

    @Override
    public String toString() {
        StringBuilder operator = new StringBuilder(op.getSymbol());
        if (options != null) {
            if (options.isReturnBool()) {
                operator.append(" bool");
            }
            VectorMatching matching = options.getVectorMatching();
            if (matching != null && matching.isExplicit()) {
                operator.append(matching.isOn() ? " on (" : " ignoring (");
                if (matching.getMatchingLabels() != null) {
                    operator.append(String.join(",", matching.getMatchingLabels()));
                }
                operator.append(')');
                String group = switch (matching.getCard()) {
                    case MANY_TO_ONE -> "group_left";
                    case ONE_TO_MANY -> "group_right";
                    default -> "";
                };
                if (!group.isEmpty()) {
                    operator.append(' ').append(group);
                    if (matching.getInclude() != null) {
                        operator.append(" (").append(String.join(",", matching.getInclude())).append(')');
                    }
                }
            }
        }
        return "(" + left + " " + operator + " " + right + ")";
    }
}
