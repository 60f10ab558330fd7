/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.core.model;

import com.google.re2j.Pattern;
import com.google.re2j.PatternSyntaxException;
import org.opensearch.logql.core.exception.LogQLParseException;
import org.opensearch.logql.core.utils.QueryStrings;

import java.util.Objects;

/**
 * A stream selector label matcher such as {@code app="api"} or {@code env=~"prod|staging"}.
 *
 * <p>Regex matchers are anchored to the whole value and compiled eagerly, so an invalid
 * pattern fails construction.</p>
 */
public final class LabelMatcher {

    private final MatchType type;
    private final String name;
    private final String value;
    private final Pattern pattern;

    private LabelMatcher(MatchType type, String name, String value, Pattern pattern) {
        this.type = type;
        this.name = name;
        this.value = value;
        this.pattern = pattern;
    }

    /**
     * Create a label matcher.
     *
     * @param type the match operator
     * @param name the label name
     * @param value the value or regex to match
     * @return the matcher
     * @throws LogQLParseException if a regex value does not compile
     */
    public static LabelMatcher of(MatchType type, String name, String value) {
        Objects.requireNonNull(type, "match type cannot be null");
        Objects.requireNonNull(name, "label name cannot be null");
        Objects.requireNonNull(value, "label value cannot be null");
        Pattern pattern = null;
        if (type.isRegex()) {
            try {
                pattern = Pattern.compile("^(?:" + value + ")$");
            } catch (PatternSyntaxException e) {
                throw new LogQLParseException(e.getMessage(), e);
            }
        }
        return new LabelMatcher(type, name, value, pattern);
    }

    /**
     * Test a label value against this matcher.
     *
     * @param labelValue the value to test, empty when the label is missing
     * @return true if the value satisfies the matcher
     */
    public boolean matches(String labelValue) {
        return switch (type) {
            case EQUAL -> value.equals(labelValue);
            case NOT_EQUAL -> !value.equals(labelValue);
            case REGEX -> pattern.matcher(labelValue).matches();
            case NOT_REGEX -> !pattern.matcher(labelValue).matches();
        };
    }

    public MatchType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LabelMatcher that = (LabelMatcher) o;
        return type == that.type && name.equals(that.name) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, value);
    }

    @Override
    public String toString() {
        return name + type.getSymbol() + QueryStrings.quote(value);
    }
}
