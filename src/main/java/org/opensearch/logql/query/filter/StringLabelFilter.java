/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.query.filter;

import org.opensearch.logql.core.model.LabelMatcher;

import java.util.Map;
import java.util.Objects;

/**
 * Label filter backed by a {@link LabelMatcher}, as in {@code | level="error"} or
 * {@code | path=~"/api/.*"}. A missing label is matched as the empty string.
 */
public final class StringLabelFilter implements LabelFilterer {

    private final LabelMatcher matcher;

    public StringLabelFilter(LabelMatcher matcher) {
        this.matcher = Objects.requireNonNull(matcher, "matcher cannot be null");
    }

    @Override
    public String process(String line, Map<String, String> labels) {
        return matcher.matches(labels.getOrDefault(matcher.getName(), "")) ? line : null;
    }

    public LabelMatcher getMatcher() {
        return matcher;
    }

    @Override
    public String toString() {
        return matcher.toString();
    }
}
