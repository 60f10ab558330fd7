/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.query.stage;

import java.util.List;
import java.util.Map;

/**
 * An ordered sequence of executable stages applied to each log line.
 */
public final class Pipeline {

    private static final Pipeline NOOP = new Pipeline(List.of());

    private final List<Stage> stages;

    /**
     * @param stages the stages in application order
     */
    public Pipeline(List<Stage> stages) {
        this.stages = List.copyOf(stages);
    }

    /**
     * @return a pipeline without stages that passes every line through unchanged
     */
    public static Pipeline noop() {
        return NOOP;
    }

    /**
     * Run a line through every stage in order.
     *
     * @param line the line content
     * @param labels the line's labels, may be modified by the stages
     * @return the processed line, or {@code null} as soon as a stage drops it
     */
    public String process(String line, Map<String, String> labels) {
        String current = line;
        for (Stage stage : stages) {
            current = stage.process(current, labels);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * @return the stages in application order
     */
    public List<Stage> getStages() {
        return stages;
    }

    /**
     * @return true if the pipeline has no stages
     */
    public boolean isNoop() {
        return stages.isEmpty();
    }
}
