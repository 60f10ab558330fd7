/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.query.filter;

/**
 * Keeps lines that contain (or, when negated, do not contain) a literal substring.
 */
public final class ContainsFilter implements Filterer {

    private final String match;
    private final boolean negated;

    /**
     * @param match the substring, must not be empty
     * @param negated true to keep lines that do not contain the substring
     */
    public ContainsFilter(String match, boolean negated) {
        if (match == null || match.isEmpty()) {
            throw new IllegalArgumentException("ContainsFilter requires a non-empty match");
        }
        this.match = match;
        this.negated = negated;
    }

    @Override
    public boolean filter(String line) {
        return line.contains(match) != negated;
    }

    public String getMatch() {
        return match;
    }

    public boolean isNegated() {
        return negated;
    }
}
