/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.logql.core.exception.QueryCompilationException;
import org.opensearch.logql.core.exception.StageException;
import org.opensearch.logql.query.stage.Pipeline;
import org.opensearch.logql.query.stage.Stage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The ordered stages of a {@link PipelineExpr}.
 *
 * <p>Compilation keeps the stage order, drops stages compiled to {@link Stage#NOOP} and
 * fails as a whole on the first stage that cannot be compiled.
 */
public final class MultiStageExpr implements Iterable<StageExpr> {

    private static final Logger logger = LogManager.getLogger(MultiStageExpr.class);

    private final List<StageExpr> stages;

    MultiStageExpr(List<StageExpr> stages) {
        this.stages = new ArrayList<>(stages.size());
        for (StageExpr stage : stages) {
            append(stage);
        }
    }

    void append(StageExpr stage) {
        stages.add(Objects.requireNonNull(stage, "stage cannot be null"));
    }

    /**
     * Compiles all stages into a pipeline.
     *
     * @throws StageException wrapping the first failure, with the failing stage's text
     */
    public Pipeline pipeline(CompileContext context) {
        return new Pipeline(stages(context));
    }

    /**
     * Compiles all stages, omitting no-op stages.
     *
     * @throws StageException wrapping the first failure, with the failing stage's text
     */
    public List<Stage> stages(CompileContext context) {
        List<Stage> compiled = new ArrayList<>(stages.size());
        for (StageExpr expr : stages) {
            Stage stage;
            try {
                stage = expr.stage(context);
                if (stage == null) {
                    throw new QueryCompilationException("no stage compiled");
                }
            } catch (StageException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new StageException(expr.toString(), e);
            }
            if (stage == Stage.NOOP) {
                logger.debug("Eliding no-op stage [{}]", expr);
                continue;
            }
            compiled.add(stage);
        }
        return compiled;
    }

    public List<StageExpr> asList() {
        return Collections.unmodifiableList(stages);
    }

    public int size() {
        return stages.size();
    }

    public boolean isEmpty() {
        return stages.isEmpty();
    }

    @Override
    public Iterator<StageExpr> iterator() {
        return asList().iterator();
    }

    @Override
    public String toString() {
        return stages.stream().map(StageExpr::toString).collect(Collectors.joining(" "));
    }
}
