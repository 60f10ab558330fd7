/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import java.util.List;
import java.util.Objects;

/**
 * The {@code by (...)} or {@code without (...)} clause of an aggregation.
 *
 * <p>An empty {@code by} grouping aggregates everything into a single series.
 */
public final class Grouping {

    private static final Grouping EMPTY = new Grouping(List.of(), false);

    private final List<String> groups;
    private final boolean without;

    private Grouping(List<String> groups, boolean without) {
        this.groups = groups;
        this.without = without;
    }

    public static Grouping of(List<String> groups, boolean without) {
        Objects.requireNonNull(groups, "groups cannot be null");
        return new Grouping(List.copyOf(groups), without);
    }

    public static Grouping by(String... groups) {
        return of(List.of(groups), false);
    }

    public static Grouping without(String... groups) {
        return of(List.of(groups), true);
    }

    /**
     * @return the empty {@code by} grouping
     */
    public static Grouping empty() {
        return EMPTY;
    }

    public List<String> getGroups() {
        return groups;
    }

    public boolean isWithout() {
        return without;
    }

    /**
     * @return true for a {@code by} grouping without labels
     */
    public boolean isNoop() {
        return !without && groups.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Grouping grouping = (Grouping) o;
        return without == grouping.without && groups.equals(grouping.groups);
    }

    @Override
    public int hashCode() {
        return Objects.hash(groups, without);
    }

    /**
     * Renders the clause with a leading space, e.g. {@code " by(a,b)"}. An empty {@code by}
     * grouping renders nothing.
     */
    @Override
    public String toString() {
        if (without) {
            return " without(" + String.join(",", groups) + ")";
        }
        if (groups.isEmpty()) {
            return "";
        }
        return " by(" + String.join(",", groups) + ")";
    }
}
