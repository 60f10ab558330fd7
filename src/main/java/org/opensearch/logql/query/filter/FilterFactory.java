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
 * Builds line predicates from line filter expressions. Implementations throw a runtime exception
 * for patterns they cannot compile.
 */
public interface FilterFactory {

    /**
     * @param match the substring or regex to look for
     * @param type the match operator
     * @return the line predicate
     */
    Filterer newFilter(String match, MatchType type);

    /**
     * @param pattern an address, CIDR block or address range
     * @param type the match operator, only {@link MatchType#EQUAL} and {@link MatchType#NOT_EQUAL} are valid
     * @return the line predicate
     */
    Filterer newIpLineFilter(String pattern, MatchType type);
}
