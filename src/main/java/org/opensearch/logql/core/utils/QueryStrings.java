/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.core.utils;

import java.math.BigDecimal;

/**
 * Helpers for rendering literal values in canonical LogQL text.
 *
 * <p>String quoting follows the double-quoted string literal rules of the query grammar so that
 * any rendered literal reparses to the same value.</p>
 */
public final class QueryStrings {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private QueryStrings() {}

    /**
     * Quote a string as a double-quoted LogQL string literal.
     *
     * @param value the raw string
     * @return the quoted and escaped literal
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\u0007' -> sb.append("\\a");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\u000B' -> sb.append("\\v");
                default -> {
                    if (c < 0x20 || c == 0x7F) {
                        sb.append("\\x").append(HEX[(c >> 4) & 0xF]).append(HEX[c & 0xF]);
                    } else if (Character.isISOControl(c) || Character.getType(c) == Character.UNASSIGNED) {
                        sb.append("\\u")
                            .append(HEX[(c >> 12) & 0xF])
                            .append(HEX[(c >> 8) & 0xF])
                            .append(HEX[(c >> 4) & 0xF])
                            .append(HEX[c & 0xF]);
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
        return sb.toString();
    }

    /**
     * Parse a finite decimal or hexadecimal number. Java type suffixes such as {@code 2f} or
     * {@code 1d} are not part of the query grammar and are rejected.
     *
     * @param text the number as written
     * @return the parsed value
     * @throws NumberFormatException if the text is not a number
     */
    public static double parseFloat(String text) {
        if (!text.isEmpty()) {
            char last = text.charAt(text.length() - 1);
            if (last == 'f' || last == 'F' || last == 'd' || last == 'D') {
                throw new NumberFormatException("invalid number: " + text);
            }
        }
        return Double.parseDouble(text);
    }

    /**
     * Render a number with no exponent and no superfluous digits, e.g. {@code 2}, {@code 0.99}.
     * Non-finite values render as {@code NaN}, {@code +Inf} and {@code -Inf}.
     *
     * @param value the number
     * @return the canonical rendering
     */
    public static String formatFloat(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "+Inf" : "-Inf";
        }
        if (value == 0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
