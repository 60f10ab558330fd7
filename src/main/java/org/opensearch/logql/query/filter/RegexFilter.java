/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.query.filter;

import com.google.re2j.Pattern;

/**
 * Keeps lines in which a regular expression finds a match anywhere (or, when negated, nowhere).
 * Uses RE2 semantics, so matching time is linear in the line length.
 */
public final class RegexFilter implements Filterer {

    private final Pattern pattern;
    private final boolean negated;

    /**
     * @param regex the unanchored regular expression
     * @param negated true to keep lines without a match
     * @throws com.google.re2j.PatternSyntaxException if the regex is invalid
     */
    public RegexFilter(String regex, boolean negated) {
        this.pattern = Pattern.compile(regex);
        this.negated = negated;
    }

    @Override
    public boolean filter(String line) {
        return pattern.matcher(line).find() != negated;
    }

    public String getRegex() {
        return pattern.pattern();
    }

    public boolean isNegated() {
        return negated;
    }
}
