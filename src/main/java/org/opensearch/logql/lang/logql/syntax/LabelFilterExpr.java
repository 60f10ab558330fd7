/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.core.exception.QueryCompilationException;
import org.opensearch.logql.query.filter.IpLabelFilterer;
import org.opensearch.logql.query.filter.LabelFilterer;
import org.opensearch.logql.query.stage.Stage;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * A label filter stage such as {@code | level="error"} or {@code | addr=ip("10.0.0.0/8")}.
 */
public final class LabelFilterExpr implements StageExpr {

    private final LabelFilterer filterer;

    private LabelFilterExpr(LabelFilterer filterer) {
        this.filterer = filterer;
    }

    public static LabelFilterExpr of(LabelFilterer filterer) {
        return new LabelFilterExpr(Objects.requireNonNull(filterer, "label filterer cannot be null"));
    }

    public LabelFilterer getFilterer() {
        return filterer;
    }

    /**
     * Returns the filterer itself. An IP filterer whose pattern failed to parse is reported here
     * instead of at construction.
     *
     * @throws QueryCompilationException carrying the deferred pattern error
     */
    @Override
    public Stage stage(CompileContext context) {
        if (filterer instanceof IpLabelFilterer ip && ip.getPatternError() != null) {
            RuntimeException error = ip.getPatternError();
            throw new QueryCompilationException(error.getMessage(), error);
        }
        return filterer;
    }

    @Override
    public boolean isShardable() {
        return true;
    }

    @Override
    public void walk(Consumer<Expr> visitor) {
        visitor.accept(this);
    }

    @Override
    public String toString() {
        return "| " + filterer;
    }
}
