/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.query.extractor;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Converts a log line and its labels into a numeric sample value for range aggregations.
 */
@FunctionalInterface
public interface SampleExtractor {

    /**
     * @param line the line content
     * @param labels the line's labels, may be modified by the extractor's stages
     * @return the extracted value, or empty if the line yields no sample
     */
    OptionalDouble process(String line, Map<String, String> labels);
}
