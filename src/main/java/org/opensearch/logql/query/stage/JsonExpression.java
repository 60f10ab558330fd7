/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.query.stage;

import org.opensearch.logql.core.utils.QueryStrings;

import java.util.Objects;

/**
 * A label to extract from a JSON log line and the path expression locating its value,
 * as in {@code | json status="response.status"}.
 */
public final class JsonExpression {

    private final String identifier;
    private final String expression;

    /**
     * @param identifier the label to create
     * @param expression the JSON path expression
     */
    public JsonExpression(String identifier, String expression) {
        this.identifier = Objects.requireNonNull(identifier, "identifier cannot be null");
        this.expression = Objects.requireNonNull(expression, "expression cannot be null");
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        JsonExpression that = (JsonExpression) o;
        return identifier.equals(that.identifier) && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, expression);
    }

    @Override
    public String toString() {
        return identifier + "=" + QueryStrings.quote(expression);
    }
}
