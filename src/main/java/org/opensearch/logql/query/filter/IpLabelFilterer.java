/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.query.filter;

/**
 * A label filter testing a label against an IP pattern. Invalid patterns are accepted when the
 * filter is built and reported through {@link #getPatternError()}, which is surfaced as an error
 * when the filter is compiled into a pipeline stage.
 */
public interface IpLabelFilterer extends LabelFilterer {

    /**
     * @return the pattern parsing failure, or {@code null} if the pattern is valid
     */
    RuntimeException getPatternError();
}
