/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.core.model.LabelMatcher;
import org.opensearch.logql.query.stage.Pipeline;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A stream selector followed by one or more pipeline stages, e.g.
 * <code>{app="foo"} |= "error" | json | level="warn"</code>.
 */
public final class PipelineExpr implements LogSelectorExpr {

    private final MatchersExpr left;
    private final MultiStageExpr stages;

    private PipelineExpr(MatchersExpr left, MultiStageExpr stages) {
        this.left = left;
        this.stages = stages;
    }

    public static PipelineExpr of(MatchersExpr left, List<StageExpr> stages) {
        Objects.requireNonNull(left, "pipeline selector cannot be null");
        Objects.requireNonNull(stages, "pipeline stages cannot be null");
        return new PipelineExpr(left, new MultiStageExpr(stages));
    }

    /**
     * Appends a stage at the end of the pipeline. Only valid while the query is being assembled.
     */
    public void appendStage(StageExpr stage) {
        stages.append(stage);
    }

    public MatchersExpr getLeft() {
        return left;
    }

    public MultiStageExpr getStages() {
        return stages;
    }

    @Override
    public List<LabelMatcher> getMatchers() {
        return left.getMatchers();
    }

    @Override
    public Pipeline pipeline(CompileContext context) {
        return stages.pipeline(context);
    }

    @Override
    public boolean hasFilter() {
        for (StageExpr stage : stages) {
            if (stage instanceof LineFilterExpr || stage instanceof LabelFilterExpr) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean isShardable() {
        for (StageExpr stage : stages) {
            if (!stage.isShardable()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void walk(Consumer<Expr> visitor) {
        visitor.accept(this);
        left.walk(visitor);
        for (StageExpr stage : stages) {
            stage.walk(visitor);
        }
    }

    @Override
    public String toString() {
        if (stages.isEmpty()) {
            return left.toString();
        }
        return left + " " + stages;
    }
}
