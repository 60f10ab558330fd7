/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.common.unit.TimeValue;
import org.opensearch.logql.core.model.LabelMatcher;

import java.util.List;

/**
 * Flattens an expression into the windows of data it reads.
 */
public final class MatcherGroups {

    private MatcherGroups() {}

    /**
     * Sample expressions report their own windows. A selector with matchers reads a single window
     * with zero interval and offset. Anything else reads nothing.
     *
     * @param expr any expression
     * @return the windows, left to right; empty if none
     */
    public static List<MatcherRange> of(Expr expr) {
        if (expr instanceof SampleExpr sample) {
            return sample.getMatcherGroups();
        }
        if (expr instanceof LogSelectorExpr selector) {
            List<LabelMatcher> matchers = selector.getMatchers();
            if (!matchers.isEmpty()) {
                return List.of(new MatcherRange(matchers, TimeValue.ZERO, TimeValue.ZERO));
            }
        }
        return List.of();
    }
}
