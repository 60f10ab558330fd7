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
 * A filter over extracted labels, such as {@code | status="500"}. The filterer is itself the
 * pipeline stage; {@link #toString()} must return its canonical query text without the pipe.
 */
public interface LabelFilterer extends Stage {}
