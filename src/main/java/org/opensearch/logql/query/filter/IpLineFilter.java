/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.query.filter;

import org.opensearch.logql.core.model.MatchType;

/**
 * Keeps lines that mention an IP address within a pattern ({@code |= ip("...")}), or, when
 * negated, lines that mention none ({@code != ip("...")}).
 */
public final class IpLineFilter implements Filterer {

    private final IpPattern pattern;
    private final boolean negated;

    /**
     * @param pattern the IP pattern text
     * @param type {@link MatchType#EQUAL} or {@link MatchType#NOT_EQUAL}
     * @throws IllegalArgumentException if the pattern is invalid or the match type is a regex type
     */
    public IpLineFilter(String pattern, MatchType type) {
        if (type.isRegex()) {
            throw new IllegalArgumentException("invalid match type for ip filter: " + type.getLineFilterSymbol());
        }
        this.pattern = IpPattern.parse(pattern);
        this.negated = type == MatchType.NOT_EQUAL;
    }

    @Override
    public boolean filter(String line) {
        return containsMatch(line) != negated;
    }

    private boolean containsMatch(String line) {
        int start = -1;
        for (int i = 0; i <= line.length(); i++) {
            boolean addressChar = i < line.length() && isAddressChar(line.charAt(i));
            if (addressChar && start < 0) {
                start = i;
            } else if (!addressChar && start >= 0) {
                if (pattern.matches(line.substring(start, i))) {
                    return true;
                }
                start = -1;
            }
        }
        return false;
    }

    private static boolean isAddressChar(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F') || c == '.' || c == ':';
    }
}
