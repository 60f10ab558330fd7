/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.core.exception.LogQLParseException;
import org.opensearch.logql.query.stage.LabelFmt;
import org.opensearch.logql.query.stage.Stage;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Renames labels or sets them from templates: {@code | label_format dst=src,msg="{{.a}}"}.
 *
 * <p>Never shardable: rewritten labels can make one series on a shard collide with another
 * series on a different shard.
 */
public final class LabelFmtExpr implements StageExpr {

    private final List<LabelFmt> formats;

    private LabelFmtExpr(List<LabelFmt> formats) {
        this.formats = formats;
    }

    /**
     * @throws LogQLParseException if {@code formats} is empty
     */
    public static LabelFmtExpr of(List<LabelFmt> formats) {
        Objects.requireNonNull(formats, "label formats cannot be null");
        if (formats.isEmpty()) {
            throw new LogQLParseException("label_format requires at least one label");
        }
        return new LabelFmtExpr(List.copyOf(formats));
    }

    public List<LabelFmt> getFormats() {
        return formats;
    }

    @Override
    public Stage stage(CompileContext context) {
        return context.getStageFactory().newLabelsFormatter(formats);
    }

    @Override
    public boolean isShardable() {
        return false;
    }

    @Override
    public void walk(Consumer<Expr> visitor) {
        visitor.accept(this);
    }

    @Override
    public String toString() {
        return "| label_format " + formats.stream().map(LabelFmt::toString).collect(Collectors.joining(","));
    }
}
