/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.core.exception.LogQLParseException;
import org.opensearch.logql.query.extractor.ConversionType;
import org.opensearch.logql.query.filter.LabelFilterer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The {@code | unwrap} clause of a log range: names the label whose value becomes the sample
 * value, with an optional conversion and label filters applied after unwrapping.
 */
public final class UnwrapExpr {

    /**
     * Conversion functions applicable to the unwrapped label, e.g. {@code unwrap bytes(size)}.
     */
    public enum Conversion {
        BYTES("bytes", ConversionType.BYTES),
        DURATION("duration", ConversionType.DURATION),
        DURATION_SECONDS("duration_seconds", ConversionType.DURATION);

        private final String name;
        private final ConversionType type;

        Conversion(String name, ConversionType type) {
            this.name = name;
            this.type = type;
        }

        public String getName() {
            return name;
        }

        /**
         * @return the value conversion the extractor applies
         */
        public ConversionType getType() {
            return type;
        }

        public static Conversion fromString(String name) {
            for (Conversion conversion : values()) {
                if (conversion.name.equals(name)) {
                    return conversion;
                }
            }
            throw new LogQLParseException("unknown unwrap conversion: " + name);
        }
    }

    private final String identifier;
    private final Conversion conversion;
    private final List<LabelFilterer> postFilters = new ArrayList<>();

    private UnwrapExpr(String identifier, Conversion conversion) {
        this.identifier = identifier;
        this.conversion = conversion;
    }

    public static UnwrapExpr of(String identifier) {
        return of(identifier, (Conversion) null);
    }

    /**
     * @param identifier the label to unwrap
     * @param conversion the conversion function name, empty or null for none
     * @throws LogQLParseException if the conversion is unknown
     */
    public static UnwrapExpr of(String identifier, String conversion) {
        return of(identifier, conversion == null || conversion.isEmpty() ? null : Conversion.fromString(conversion));
    }

    public static UnwrapExpr of(String identifier, Conversion conversion) {
        Objects.requireNonNull(identifier, "unwrap identifier cannot be null");
        if (identifier.isEmpty()) {
            throw new LogQLParseException("unwrap requires a label name");
        }
        return new UnwrapExpr(identifier, conversion);
    }

    /**
     * Adds a filter applied to samples after unwrapping. Only valid while the query is being assembled.
     *
     * @return this
     */
    public UnwrapExpr addPostFilter(LabelFilterer filter) {
        postFilters.add(Objects.requireNonNull(filter, "post filter cannot be null"));
        return this;
    }

    public String getIdentifier() {
        return identifier;
    }

    /**
     * @return the conversion, or null when the label value is parsed as a float
     */
    public Conversion getConversion() {
        return conversion;
    }

    /**
     * @return the value conversion the extractor applies
     */
    public ConversionType getConversionType() {
        return conversion == null ? ConversionType.FLOAT : conversion.getType();
    }

    public List<LabelFilterer> getPostFilters() {
        return Collections.unmodifiableList(postFilters);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("| unwrap ");
        if (conversion != null) {
            sb.append(conversion.getName()).append('(').append(identifier).append(')');
        } else {
            sb.append(identifier);
        }
        for (LabelFilterer filter : postFilters) {
            sb.append(" | ").append(filter);
        }
        return sb.toString();
    }
}
