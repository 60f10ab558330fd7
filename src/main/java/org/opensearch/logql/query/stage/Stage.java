/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.query.stage;

import java.util.Map;

/**
 * One executable unit of line processing in a log pipeline: a filter, a parser or a formatter.
 *
 * <p>Stages may read and modify the mutable label map handed to them. Returning {@code null}
 * drops the line from the pipeline.</p>
 */
@FunctionalInterface
public interface Stage {

    /**
     * Sentinel for a stage that does nothing. Pipeline compilation elides it instead of
     * inserting it, so factories return it for degenerate configurations.
     */
    Stage NOOP = (line, labels) -> line;

    /**
     * Process a single log line.
     *
     * @param line the line content
     * @param labels the line's labels, may be modified in place
     * @return the (possibly rewritten) line, or {@code null} if the line is filtered out
     */
    String process(String line, Map<String, String> labels);
}
