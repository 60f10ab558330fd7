/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.core.model.Sample;

/**
 * Arithmetic and comparison of two samples under a binary operator.
 *
 * <p>A null sample stands for an absent value; any operation with an absent side yields null.
 * The result always carries the left sample's labels and timestamp.
 */
public final class SampleMerger {

    private SampleMerger() {}

    /**
     * @see #merge(BinaryOperator, Sample, Sample, boolean, boolean)
     * @throws IllegalArgumentException if {@code op} is not a binary operator
     */
    public static Sample merge(String op, Sample left, Sample right, boolean filter, boolean isVectorComparison) {
        return merge(BinaryOperator.fromSymbol(op), left, right, filter, isVectorComparison);
    }

    /**
     * Merges two samples.
     *
     * <p>Division and modulo by zero yield NaN. Comparisons yield 1 when true and 0 when false;
     * with {@code filter} a false comparison yields null instead. With both {@code filter} and
     * {@code isVectorComparison}, any non-null result is replaced by the left sample unchanged.
     *
     * @param op                 arithmetic or comparison operator
     * @param left               the left sample, or null
     * @param right              the right sample, or null
     * @param filter             drop samples failing a comparison instead of returning 0
     * @param isVectorComparison the comparison is between two vectors, so the left value is kept
     * @return the merged sample, or null
     * @throws IllegalArgumentException for logical/set operators, which do not merge sample values
     */
    public static Sample merge(BinaryOperator op, Sample left, Sample right, boolean filter, boolean isVectorComparison) {
        if (op.isLogical()) {
            throw new IllegalArgumentException("unexpected operation: (" + op.getSymbol() + ")");
        }
        if (left == null || right == null) {
            return null;
        }
        double l = left.getValue();
        double r = right.getValue();
        Sample result = switch (op) {
            case ADD -> left.withValue(l + r);
            case SUB -> left.withValue(l - r);
            case MUL -> left.withValue(l * r);
            case DIV -> left.withValue(r == 0 ? Double.NaN : l / r);
            case MOD -> left.withValue(r == 0 ? Double.NaN : l % r);
            case POW -> left.withValue(Math.pow(l, r));
            case CMP_EQ -> compare(left, l == r, filter);
            case NEQ -> compare(left, l != r, filter);
            case GT -> compare(left, l > r, filter);
            case GTE -> compare(left, l >= r, filter);
            case LT -> compare(left, l < r, filter);
            case LTE -> compare(left, l <= r, filter);
            default -> throw new IllegalArgumentException("unexpected operation: (" + op.getSymbol() + ")");
        };
        if (result != null && filter && isVectorComparison) {
            return left;
        }
        return result;
    }

    private static Sample compare(Sample left, boolean matched, boolean filter) {
        if (matched) {
            return left.withValue(1);
        }
        return filter ? null : left.withValue(0);
    }
}
