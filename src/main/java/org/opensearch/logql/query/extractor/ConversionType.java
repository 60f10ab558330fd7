/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.query.extractor;

/**
 * Conversion applied to an unwrapped label value before it becomes a sample.
 */
public enum ConversionType {
    /** Plain floating point number. */
    FLOAT,
    /** Humanized byte size such as {@code 5 KiB}. */
    BYTES,
    /** Duration such as {@code 250ms}, converted to seconds. */
    DURATION
}
