/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.core.model.LabelMatcher;
import org.opensearch.logql.query.stage.Pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * A bare stream selector such as <code>{app="foo", env=~"prod|dev"}</code>.
 */
public final class MatchersExpr implements LogSelectorExpr {

    private final List<LabelMatcher> matchers;

    private MatchersExpr(List<LabelMatcher> matchers) {
        this.matchers = matchers;
    }

    public static MatchersExpr of(List<LabelMatcher> matchers) {
        Objects.requireNonNull(matchers, "matchers cannot be null");
        List<LabelMatcher> copy = new ArrayList<>(matchers.size());
        for (LabelMatcher matcher : matchers) {
            copy.add(Objects.requireNonNull(matcher, "matcher cannot be null"));
        }
        return new MatchersExpr(copy);
    }

    public static MatchersExpr of(LabelMatcher... matchers) {
        return of(List.of(matchers));
    }

    /**
     * Adds matchers to the selector. Only valid while the query is being assembled.
     *
     * @param additional matchers appended after the existing ones
     */
    public void appendMatchers(List<LabelMatcher> additional) {
        Objects.requireNonNull(additional, "matchers cannot be null");
        for (LabelMatcher matcher : additional) {
            matchers.add(Objects.requireNonNull(matcher, "matcher cannot be null"));
        }
    }

    @Override
    public List<LabelMatcher> getMatchers() {
        return Collections.unmodifiableList(matchers);
    }

    @Override
    public Pipeline pipeline(CompileContext context) {
        return Pipeline.noop();
    }

    @Override
    public boolean hasFilter() {
        return false;
    }

    @Override
    public boolean isShardable() {
        return true;
    }

    @Override
    public void walk(Consumer<Expr> visitor) {
        visitor.accept(this);
    }

    @Override
    public String toString() {
        return matchers.stream().map(LabelMatcher::toString).collect(Collectors.joining(", ", "{", "}"));
    }
}
