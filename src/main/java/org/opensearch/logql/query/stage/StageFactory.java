/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.query.stage;

import org.opensearch.logql.lang.logql.syntax.ParserType;

import java.util.List;

/**
 * Builds the executable stages a log pipeline is made of. Implementations may throw any runtime
 * exception for invalid parameters (for instance a regexp parser with an invalid expression);
 * pipeline compilation wraps such failures with the text of the offending stage.
 *
 * <p>Any method may return {@link Stage#NOOP} when the requested stage would do nothing.</p>
 */
public interface StageFactory {

    /**
     * @param type the parser operator
     * @param param operator-specific parameter (regexp or pattern expression), empty when unused
     * @return the parser stage
     */
    Stage newParser(ParserType type, String param);

    /**
     * @param expressions the labels to extract and their JSON paths
     * @return the JSON extraction stage
     */
    Stage newJsonExpressionParser(List<JsonExpression> expressions);

    /**
     * @param template the line template
     * @return the line formatting stage
     */
    Stage newLineFormatter(String template);

    /**
     * @param formats rename and template rules, applied in order
     * @return the label formatting stage
     */
    Stage newLabelsFormatter(List<LabelFmt> formats);
}
