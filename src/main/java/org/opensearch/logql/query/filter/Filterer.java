/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.query.filter;

import org.opensearch.logql.query.stage.Stage;

/**
 * A predicate over the content of a log line.
 */
@FunctionalInterface
public interface Filterer {

    /**
     * A filter that keeps every line. Its stage form is {@link Stage#NOOP}.
     */
    Filterer TRUE = new Filterer() {
        @Override
        public boolean filter(String line) {
            return true;
        }

        @Override
        public Stage toStage() {
            return Stage.NOOP;
        }
    };

    /**
     * @param line the line content
     * @return true if the line is kept
     */
    boolean filter(String line);

    /**
     * @return a pipeline stage that drops the lines this filter rejects
     */
    default Stage toStage() {
        return (line, labels) -> filter(line) ? line : null;
    }
}
