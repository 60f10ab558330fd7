/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.core.model;

import org.opensearch.logql.core.exception.LogQLParseException;

/**
 * Match operator shared by label matchers and line filters.
 */
public enum MatchType {
    EQUAL("="),
    NOT_EQUAL("!="),
    REGEX("=~"),
    NOT_REGEX("!~");

    private final String symbol;

    MatchType(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return the operator as written between a label name and its value
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * @return the operator as written in front of a line filter pattern
     */
    public String getLineFilterSymbol() {
        return switch (this) {
            case EQUAL -> "|=";
            case NOT_EQUAL -> "!=";
            case REGEX -> "|~";
            case NOT_REGEX -> "!~";
        };
    }

    /**
     * @return true for {@link #REGEX} and {@link #NOT_REGEX}
     */
    public boolean isRegex() {
        return this == REGEX || this == NOT_REGEX;
    }

    /**
     * @return true for the negated operators
     */
    public boolean isNegated() {
        return this == NOT_EQUAL || this == NOT_REGEX;
    }

    /**
     * Resolve a label matcher operator.
     *
     * @param symbol one of {@code =}, {@code !=}, {@code =~}, {@code !~}
     * @return the match type
     * @throws LogQLParseException if the symbol is unknown
     */
    public static MatchType fromSymbol(String symbol) {
        for (MatchType type : values()) {
            if (type.symbol.equals(symbol)) {
                return type;
            }
        }
        throw new LogQLParseException("unknown match operator: " + symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
