/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

/**
 * Modifiers of a binary operation.
 */
public final class BinOpOptions {

    private final boolean returnBool;
    private final VectorMatching vectorMatching;

    /**
     * @param returnBool     true for the {@code bool} modifier of comparisons
     * @param vectorMatching the vector matching clause, or null
     */
    public BinOpOptions(boolean returnBool, VectorMatching vectorMatching) {
        this.returnBool = returnBool;
        this.vectorMatching = vectorMatching;
    }

    public boolean isReturnBool() {
        return returnBool;
    }

    public VectorMatching getVectorMatching() {
        return vectorMatching;
    }
}
