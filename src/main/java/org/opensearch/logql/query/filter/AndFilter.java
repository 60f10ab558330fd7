/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.query.filter;

import java.util.List;

/**
 * Conjunction of line filters, evaluated in order and short-circuiting on the first rejection.
 */
public final class AndFilter implements Filterer {

    private final List<Filterer> filters;

    /**
     * @param filters the filters in evaluation order
     */
    public AndFilter(List<Filterer> filters) {
        if (filters == null || filters.isEmpty()) {
            throw new IllegalArgumentException("AndFilter requires at least one filter");
        }
        this.filters = List.copyOf(filters);
    }

    @Override
    public boolean filter(String line) {
        for (Filterer filter : filters) {
            if (!filter.filter(line)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return the filters in evaluation order
     */
    public List<Filterer> getFilters() {
        return filters;
    }
}
