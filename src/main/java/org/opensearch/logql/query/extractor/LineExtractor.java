/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.query.extractor;

import java.nio.charset.StandardCharsets;

/**
 * How a sample value is derived from a log line when no label is unwrapped.
 */
public enum LineExtractor {
    /** Every line counts as 1. */
    COUNT,
    /** The line length in bytes. */
    BYTES;

    /**
     * @param line the line content
     * @return the sample value for the line
     */
    public double extract(String line) {
        return switch (this) {
            case COUNT -> 1.0;
            case BYTES -> line.getBytes(StandardCharsets.UTF_8).length;
        };
    }
}
