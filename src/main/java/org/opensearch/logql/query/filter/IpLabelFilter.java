/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.query.filter;

import org.opensearch.logql.core.model.MatchType;
import org.opensearch.logql.core.utils.QueryStrings;

import java.util.Map;
import java.util.Objects;

/**
 * Label filter testing a label value against an IP pattern, as in {@code | addr=ip("10.0.0.0/8")}.
 *
 * <p>The pattern is parsed eagerly but a failure does not fail construction: it is kept and
 * reported by {@link #getPatternError()}. A filter with an invalid pattern drops every line.
 * Lines without the label are dropped.</p>
 */
public final class IpLabelFilter implements IpLabelFilterer {

    private final String label;
    private final MatchType type;
    private final String pattern;
    private final IpPattern ipPattern;
    private final RuntimeException patternError;

    /**
     * @param label the label holding the address
     * @param type {@link MatchType#EQUAL} or {@link MatchType#NOT_EQUAL}
     * @param pattern the IP pattern text
     */
    public IpLabelFilter(String label, MatchType type, String pattern) {
        this.label = Objects.requireNonNull(label, "label cannot be null");
        this.type = Objects.requireNonNull(type, "match type cannot be null");
        this.pattern = Objects.requireNonNull(pattern, "pattern cannot be null");
        IpPattern parsed = null;
        RuntimeException error = null;
        if (type.isRegex()) {
            error = new IllegalArgumentException("invalid match type for ip filter: " + type.getSymbol());
        } else {
            try {
                parsed = IpPattern.parse(pattern);
            } catch (IllegalArgumentException e) {
                error = e;
            }
        }
        this.ipPattern = parsed;
        this.patternError = error;
    }

    @Override
    public RuntimeException getPatternError() {
        return patternError;
    }

    @Override
    public String process(String line, Map<String, String> labels) {
        if (patternError != null) {
            return null;
        }
        String value = labels.get(label);
        if (value == null) {
            return null;
        }
        boolean matches = ipPattern.matches(value);
        return matches == (type == MatchType.EQUAL) ? line : null;
    }

    public String getLabel() {
        return label;
    }

    public String getPattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return label + type.getSymbol() + "ip(" + QueryStrings.quote(pattern) + ")";
    }
}
