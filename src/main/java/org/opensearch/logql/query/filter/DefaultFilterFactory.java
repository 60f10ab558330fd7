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
 * Default line predicates: substring containment for {@code |=} and {@code !=}, RE2 regular
 * expressions for {@code |~} and {@code !~}, and address matching for {@code ip(...)} filters.
 *
 * <p>An empty {@code |=} filter keeps every line and compiles to {@link Filterer#TRUE}.</p>
 */
public class DefaultFilterFactory implements FilterFactory {

    @Override
    public Filterer newFilter(String match, MatchType type) {
        return switch (type) {
            case EQUAL -> match.isEmpty() ? Filterer.TRUE : new ContainsFilter(match, false);
            case NOT_EQUAL -> match.isEmpty() ? line -> !line.isEmpty() : new ContainsFilter(match, true);
            case REGEX -> match.isEmpty() ? Filterer.TRUE : new RegexFilter(match, false);
            case NOT_REGEX -> new RegexFilter(match, true);
        };
    }

    @Override
    public Filterer newIpLineFilter(String pattern, MatchType type) {
        return new IpLineFilter(pattern, type);
    }
}
