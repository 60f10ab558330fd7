/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.core.exception.LogQLParseException;

import java.util.List;
import java.util.Objects;

/**
 * How series from the two sides of a binary operation are paired:
 * {@code on (a,b)} / {@code ignoring (a,b)} and {@code group_left (c)} / {@code group_right (c)}.
 */
public final class VectorMatching {

    private final VectorMatchCardinality card;
    private final List<String> matchingLabels;
    private final boolean on;
    private final List<String> include;

    /**
     * @param card           the cardinality
     * @param matchingLabels labels defining equality of a pair, or null when none were written
     * @param on             true for {@code on}, false for {@code ignoring}
     * @param include        extra labels copied from the side with lower cardinality, or null
     * @throws LogQLParseException if a group modifier is given without {@code on} or {@code ignoring}
     */
    public VectorMatching(VectorMatchCardinality card, List<String> matchingLabels, boolean on, List<String> include) {
        this.card = Objects.requireNonNull(card, "cardinality cannot be null");
        if (card != VectorMatchCardinality.ONE_TO_ONE && !on && matchingLabels == null) {
            throw new LogQLParseException(
                (card == VectorMatchCardinality.MANY_TO_ONE ? "group_left" : "group_right") + " requires on or ignoring"
            );
        }
        this.matchingLabels = matchingLabels == null ? null : List.copyOf(matchingLabels);
        this.on = on;
        this.include = include == null ? null : List.copyOf(include);
    }

    public VectorMatchCardinality getCard() {
        return card;
    }

    /**
     * @return the matching labels, or null
     */
    public List<String> getMatchingLabels() {
        return matchingLabels;
    }

    public boolean isOn() {
        return on;
    }

    /**
     * @return true if {@code on}, {@code ignoring} or a group modifier was written
     */
    public boolean isExplicit() {
        return on || matchingLabels != null || card != VectorMatchCardinality.ONE_TO_ONE;
    }

    /**
     * @return the included labels, or null
     */
    public List<String> getInclude() {
        return include;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        VectorMatching that = (VectorMatching) o;
        return on == that.on && card == that.card && Objects.equals(matchingLabels, that.matchingLabels) && Objects.equals(include, that.include);
    }

    @Override
    public int hashCode() {
        return Objects.hash(card, matchingLabels, on, include);
    }
}
