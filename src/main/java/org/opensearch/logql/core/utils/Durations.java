/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.core.utils;

import org.opensearch.common.unit.TimeValue;

/**
 * Renders durations the way the query grammar writes them, e.g. {@code 5m}, {@code 1h30m},
 * {@code 2d}, {@code 1w}, {@code 250ms}.
 *
 * <p>Years, weeks and days are only used when they divide the duration exactly; hours, minutes,
 * seconds and milliseconds are then emitted from largest to smallest, skipping zero components.
 * Sub-millisecond precision is dropped.</p>
 */
public final class Durations {

    private static final long SECOND = 1000L;
    private static final long MINUTE = 60 * SECOND;
    private static final long HOUR = 60 * MINUTE;
    private static final long DAY = 24 * HOUR;
    private static final long WEEK = 7 * DAY;
    private static final long YEAR = 365 * DAY;

    private Durations() {}

    /**
     * Format a duration.
     *
     * @param duration the duration, must not be negative
     * @return the canonical text, {@code 0s} for zero
     * @throws IllegalArgumentException if the duration is negative
     */
    public static String format(TimeValue duration) {
        long millis = duration.millis();
        if (millis < 0) {
            throw new IllegalArgumentException("duration cannot be negative: " + duration);
        }
        if (millis == 0) {
            return "0s";
        }
        StringBuilder sb = new StringBuilder();
        millis = appendExact(sb, millis, YEAR, "y");
        millis = appendExact(sb, millis, WEEK, "w");
        millis = appendExact(sb, millis, DAY, "d");
        millis = append(sb, millis, HOUR, "h");
        millis = append(sb, millis, MINUTE, "m");
        millis = append(sb, millis, SECOND, "s");
        append(sb, millis, 1, "ms");
        return sb.toString();
    }

    private static long appendExact(StringBuilder sb, long millis, long unit, String suffix) {
        if (millis % unit != 0) {
            return millis;
        }
        return append(sb, millis, unit, suffix);
    }

    private static long append(StringBuilder sb, long millis, long unit, String suffix) {
        long count = millis / unit;
        if (count > 0) {
            sb.append(count).append(suffix);
            return millis - count * unit;
        }
        return millis;
    }
}
