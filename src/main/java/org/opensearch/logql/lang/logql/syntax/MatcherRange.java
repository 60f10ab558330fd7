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
import java.util.Objects;

/**
 * A window of data read by a query: the stream matchers together with the range interval and
 * offset they are read over. Plain selectors have a zero interval and offset.
 */
public final class MatcherRange {

    private final List<LabelMatcher> matchers;
    private final TimeValue interval;
    private final TimeValue offset;

    public MatcherRange(List<LabelMatcher> matchers, TimeValue interval, TimeValue offset) {
        this.matchers = List.copyOf(matchers);
        this.interval = Objects.requireNonNull(interval, "interval cannot be null");
        this.offset = Objects.requireNonNull(offset, "offset cannot be null");
    }

    public List<LabelMatcher> getMatchers() {
        return matchers;
    }

    public TimeValue getInterval() {
        return interval;
    }

    public TimeValue getOffset() {
        return offset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MatcherRange that = (MatcherRange) o;
        return matchers.equals(that.matchers) && interval.equals(that.interval) && offset.equals(that.offset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(matchers, interval, offset);
    }

    @Override
    public String toString() {
        return "MatcherRange{matchers=" + matchers + ", interval=" + interval + ", offset=" + offset + "}";
    }
}
