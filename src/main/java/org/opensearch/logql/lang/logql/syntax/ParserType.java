/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.core.exception.LogQLParseException;

/**
 * Structured-field parsers available as pipeline stages, e.g. {@code | json} or
 * {@code | regexp "(?P<status>\\d+)"}.
 */
public enum ParserType {
    JSON("json", false),
    LOGFMT("logfmt", false),
    REGEXP("regexp", true),
    UNPACK("unpack", false),
    PATTERN("pattern", true);

    private final String name;
    private final boolean requiresParam;

    ParserType(String name, boolean requiresParam) {
        this.name = name;
        this.requiresParam = requiresParam;
    }

    /**
     * @return the operator name as written in a query
     */
    public String getName() {
        return name;
    }

    /**
     * @return true if the parser takes an expression parameter
     */
    public boolean requiresParam() {
        return requiresParam;
    }

    /**
     * @param name the operator name
     * @return the parser type
     * @throws LogQLParseException if the name is not a parser operator
     */
    public static ParserType fromString(String name) {
        for (ParserType type : values()) {
            if (type.name.equals(name)) {
                return type;
            }
        }
        throw new LogQLParseException("unknown parser operator: " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
