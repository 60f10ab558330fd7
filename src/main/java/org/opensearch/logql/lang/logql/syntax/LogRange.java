/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.common.unit.TimeValue;
import org.opensearch.logql.core.exception.LogQLParseException;
import org.opensearch.logql.core.utils.Durations;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * A log selector read over a time window, e.g. <code>{app="foo"} | unwrap latency [5m] offset 1h</code>.
 */
public final class LogRange implements Expr {

    private static final long NANOS_PER_MILLI = 1_000_000L;

    private final LogSelectorExpr left;
    private final TimeValue interval;
    private final UnwrapExpr unwrap;
    private final TimeValue offset;

    private LogRange(LogSelectorExpr left, TimeValue interval, UnwrapExpr unwrap, TimeValue offset) {
        this.left = left;
        this.interval = interval;
        this.unwrap = unwrap;
        this.offset = offset;
    }

    public static LogRange of(LogSelectorExpr left, TimeValue interval) {
        return of(left, interval, null, null);
    }

    /**
     * @param left     the selector
     * @param interval the window length, must be positive
     * @param unwrap   the unwrap clause, or null
     * @param offset   the offset, or null for none
     * @throws LogQLParseException if the interval is not positive, the offset is negative, or either
     *                             has sub-millisecond precision
     */
    public static LogRange of(LogSelectorExpr left, TimeValue interval, UnwrapExpr unwrap, TimeValue offset) {
        Objects.requireNonNull(left, "log range selector cannot be null");
        Objects.requireNonNull(interval, "log range interval cannot be null");
        if (interval.millis() <= 0) {
            throw new LogQLParseException("range interval must be positive but was " + interval);
        }
        TimeValue off = offset == null ? TimeValue.ZERO : offset;
        if (off.millis() < 0) {
            throw new LogQLParseException("offset must not be negative but was " + off);
        }
        if (interval.nanos() % NANOS_PER_MILLI != 0) {
            throw new LogQLParseException("range interval must be a whole number of milliseconds but was " + interval);
        }
        if (off.nanos() % NANOS_PER_MILLI != 0) {
            throw new LogQLParseException("offset must be a whole number of milliseconds but was " + off);
        }
        return new LogRange(left, interval, unwrap, off);
    }

    public LogSelectorExpr getLeft() {
        return left;
    }

    public TimeValue getInterval() {
        return interval;
    }

    /**
     * @return the unwrap clause, or null
     */
    public UnwrapExpr getUnwrap() {
        return unwrap;
    }

    public TimeValue getOffset() {
        return offset;
    }

    @Override
    public boolean isShardable() {
        return left.isShardable();
    }

    @Override
    public void walk(Consumer<Expr> visitor) {
        visitor.accept(this);
        left.walk(visitor);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(left.toString());
        if (unwrap != null) {
            sb.append(' ').append(unwrap);
        }
        sb.append('[').append(Durations.format(interval)).append(']');
        if (offset.millis() != 0) {
            sb.append(" offset ").append(Durations.format(offset));
        }
        return sb.toString();
    }
}
