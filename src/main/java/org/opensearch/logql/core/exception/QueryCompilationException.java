/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.core.exception;

import org.opensearch.OpenSearchException;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.rest.RestStatus;

import java.io.IOException;

/**
 * Compilation error raised when an expression tree cannot be turned into an executable pipeline
 * or sample extractor, e.g. because a factory rejected a pattern or an operation has no extractor.
 */
public class QueryCompilationException extends OpenSearchException {

    public QueryCompilationException(String msg) {
        super(msg);
    }

    public QueryCompilationException(String msg, Throwable cause) {
        super(msg, cause);
    }

    public QueryCompilationException(StreamInput in) throws IOException {
        super(in);
    }

    @Override
    public RestStatus status() {
        return RestStatus.BAD_REQUEST;
    }
}
