/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

/**
 * Cardinality relationship between the two sides of a binary operation with vector matching.
 */
public enum VectorMatchCardinality {
    ONE_TO_ONE("one-to-one"),
    /** {@code group_left}: many series on the left match one on the right. */
    MANY_TO_ONE("many-to-one"),
    /** {@code group_right}: one series on the left matches many on the right. */
    ONE_TO_MANY("one-to-many");

    private final String description;

    VectorMatchCardinality(String description) {
        this.description = description;
    }

    @Override
    public String toString() {
        return description;
    }
}
