/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.core.exception;

import org.opensearch.OpenSearchException;
import org.opensearch.core.rest.RestStatus;

import java.util.Locale;

/**
 * Construction error raised while building a LogQL expression tree.
 *
 * <p>Every node factory validates its arguments synchronously and throws this exception on
 * violation, aborting the construction of the whole tree. The position is optional: when both
 * line and column are zero the message carries no position.</p>
 */
public class LogQLParseException extends OpenSearchException {

    private final String reason;
    private final int line;
    private final int col;

    /**
     * Create a construction error without a source position.
     *
     * @param reason human-readable description of the violation
     */
    public LogQLParseException(String reason) {
        this(reason, 0, 0);
    }

    /**
     * Create a construction error at a source position.
     *
     * @param reason human-readable description of the violation
     * @param line 1-based line, or 0 when unknown
     * @param col 1-based column, or 0 when unknown
     */
    public LogQLParseException(String reason, int line, int col) {
        super(format(reason, line, col));
        this.reason = reason;
        this.line = line;
        this.col = col;
    }

    /**
     * Create a construction error caused by another failure, e.g. an invalid regex.
     *
     * @param reason human-readable description of the violation
     * @param cause the underlying failure
     */
    public LogQLParseException(String reason, Throwable cause) {
        super(format(reason, 0, 0), cause);
        this.reason = reason;
        this.line = 0;
        this.col = 0;
    }

    private static String format(String reason, int line, int col) {
        if (line == 0 && col == 0) {
            return "parse error : " + reason;
        }
        return String.format(Locale.ROOT, "parse error at line %d, col %d: %s", line, col, reason);
    }

    /**
     * @return the violation description without the position prefix
     */
    public String getReason() {
        return reason;
    }

    /**
     * @return the 1-based line, or 0 when unknown
     */
    public int getLine() {
        return line;
    }

    /**
     * @return the 1-based column, or 0 when unknown
     */
    public int getCol() {
        return col;
    }

    @Override
    public RestStatus status() {
        return RestStatus.BAD_REQUEST;
    }
}
