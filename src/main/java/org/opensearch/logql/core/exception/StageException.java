/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.core.exception;

/**
 * Compilation error of a single pipeline stage. Carries the canonical text of the stage
 * expression that failed so the caller can tell which part of the query is at fault.
 */
public class StageException extends QueryCompilationException {

    private final String expr;

    /**
     * @param expr rendered text of the failing stage expression
     * @param cause the factory failure
     */
    public StageException(String expr, Throwable cause) {
        super("stage '" + expr + "' : " + cause.getMessage(), cause);
        this.expr = expr;
    }

    /**
     * @return the rendered text of the failing stage expression
     */
    public String getExpr() {
        return expr;
    }
}
