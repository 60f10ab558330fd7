/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

/**
 * Binary operators between sample expressions.
 */
public enum BinaryOperator {
    // logical/set
    OR("or"),
    AND("and"),
    UNLESS("unless"),

    // arithmetic
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    POW("^"),

    // comparison
    CMP_EQ("=="),
    NEQ("!="),
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<=");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return the operator as written in a query
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * @return true for {@code ==, !=, >, >=, <, <=}
     */
    public boolean isComparison() {
        return switch (this) {
            case CMP_EQ, NEQ, GT, GTE, LT, LTE -> true;
            default -> false;
        };
    }

    /**
     * @return true for the logical/set operators {@code and, or, unless}
     */
    public boolean isLogical() {
        return this == OR || this == AND || this == UNLESS;
    }

    /**
     * @return true for {@code +, -, *, /, %, ^}
     */
    public boolean isArithmetic() {
        return !isComparison() && !isLogical();
    }

    /**
     * @param symbol the operator as written in a query
     * @return the operator
     * @throws IllegalArgumentException if the symbol is not a binary operator
     */
    public static BinaryOperator fromSymbol(String symbol) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("unexpected operation: (" + symbol + ")");
    }

    @Override
    public String toString() {
        return symbol;
    }
}
