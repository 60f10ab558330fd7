/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.core.exception.LogQLParseException;
import org.opensearch.logql.core.exception.QueryCompilationException;
import org.opensearch.logql.core.model.LabelMatcher;
import org.opensearch.logql.core.utils.QueryStrings;
import org.opensearch.logql.query.extractor.LineExtractor;
import org.opensearch.logql.query.extractor.SampleExtractor;
import org.opensearch.logql.query.extractor.SampleExtractorFactory;
import org.opensearch.logql.query.stage.Stage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Aggregates a {@link LogRange} into one sample per series, e.g.
 * <code>rate({app="foo"}[5m])</code> or
 * <code>quantile_over_time(0.99, {app="foo"} | unwrap latency [5m]) by (path)</code>.
 *
 * <p>Static rules checked at construction:
 * <ul>
 *   <li>only {@code quantile_over_time} takes a parameter, and it must take one;</li>
 *   <li>a grouping is only allowed for operations that keep label sets apart;</li>
 *   <li>with {@code unwrap} only value aggregations are allowed, without it only line counting ones.</li>
 * </ul>
 */
public final class RangeAggregationExpr implements SampleExpr {

    private final LogRange left;
    private final RangeOperation operation;
    private final Grouping grouping;
    private final Double param;

    private RangeAggregationExpr(LogRange left, RangeOperation operation, Grouping grouping, Double param) {
        this.left = left;
        this.operation = operation;
        this.grouping = grouping;
        this.param = param;
    }

    public static RangeAggregationExpr of(LogRange left, RangeOperation operation) {
        return of(left, operation, null, (Double) null);
    }

    /**
     * @param left      the log range
     * @param operation the operation name
     * @param grouping  the grouping, or null
     * @param param     the parameter as written in the query, or null
     * @throws LogQLParseException if the operation is unknown, the parameter is invalid or
     *                             {@link #validate()} fails
     */
    public static RangeAggregationExpr of(LogRange left, String operation, Grouping grouping, String param) {
        RangeOperation op = RangeOperation.fromString(operation);
        Double value = null;
        if (param != null) {
            if (op != RangeOperation.QUANTILE_OVER_TIME) {
                throw new LogQLParseException(String.format(Locale.ROOT, "parameter %s not supported for operation %s", param, op));
            }
            try {
                value = parseParam(param);
            } catch (NumberFormatException e) {
                throw new LogQLParseException(String.format(Locale.ROOT, "invalid parameter for operation %s: %s", op, param), e);
            }
        }
        return of(left, op, grouping, value);
    }

    /**
     * @throws LogQLParseException if the parameter is missing or not allowed, or {@link #validate()} fails
     */
    public static RangeAggregationExpr of(LogRange left, RangeOperation operation, Grouping grouping, Double param) {
        Objects.requireNonNull(left, "range aggregation log range cannot be null");
        Objects.requireNonNull(operation, "range aggregation operation cannot be null");
        if (param != null && operation != RangeOperation.QUANTILE_OVER_TIME) {
            throw new LogQLParseException(
                String.format(Locale.ROOT, "parameter %s not supported for operation %s", QueryStrings.formatFloat(param), operation)
            );
        }
        if (param == null && operation == RangeOperation.QUANTILE_OVER_TIME) {
            throw new LogQLParseException("parameter required for operation " + operation);
        }
        RangeAggregationExpr expr = new RangeAggregationExpr(left, operation, grouping, param);
        expr.validate();
        return expr;
    }

    private static double parseParam(String param) {
        String trimmed = param.trim();
        return switch (trimmed.toLowerCase(Locale.ROOT)) {
            case "inf", "+inf" -> Double.POSITIVE_INFINITY;
            case "-inf" -> Double.NEGATIVE_INFINITY;
            default -> QueryStrings.parseFloat(trimmed);
        };
    }

    /**
     * Checks the grouping and unwrap rules of the aggregation.
     *
     * @throws LogQLParseException if the combination of operation, grouping and unwrap is not allowed
     */
    public void validate() {
        if (grouping != null) {
            switch (operation) {
                case AVG_OVER_TIME, STDDEV_OVER_TIME, STDVAR_OVER_TIME, QUANTILE_OVER_TIME, MAX_OVER_TIME, MIN_OVER_TIME, FIRST_OVER_TIME,
                    LAST_OVER_TIME -> {
                }
                default -> throw new LogQLParseException("grouping not allowed for " + operation + " aggregation");
            }
        }
        if (left.getUnwrap() != null) {
            switch (operation) {
                case AVG_OVER_TIME, SUM_OVER_TIME, MAX_OVER_TIME, MIN_OVER_TIME, STDDEV_OVER_TIME, STDVAR_OVER_TIME, QUANTILE_OVER_TIME,
                    RATE, RATE_COUNTER, ABSENT_OVER_TIME, FIRST_OVER_TIME, LAST_OVER_TIME -> {
                }
                default -> throw new LogQLParseException("invalid aggregation " + operation + " with unwrap");
            }
            return;
        }
        switch (operation) {
            case BYTES_OVER_TIME, BYTES_RATE, COUNT_OVER_TIME, RATE, ABSENT_OVER_TIME -> {
            }
            default -> throw new LogQLParseException("invalid aggregation " + operation + " without unwrap");
        }
    }

    public LogRange getLeft() {
        return left;
    }

    public RangeOperation getOperation() {
        return operation;
    }

    /**
     * @return the grouping, or null when none was written
     */
    public Grouping getGrouping() {
        return grouping;
    }

    /**
     * @return the quantile parameter, or null
     */
    public Double getParam() {
        return param;
    }

    @Override
    public LogSelectorExpr getSelector() {
        return left.getLeft();
    }

    @Override
    public List<MatcherRange> getMatcherGroups() {
        List<LabelMatcher> matchers = left.getLeft().getMatchers();
        if (matchers.isEmpty()) {
            return List.of();
        }
        return List.of(new MatcherRange(matchers, left.getInterval(), left.getOffset()));
    }

    @Override
    public SampleExtractor extractor(CompileContext context) {
        return extractor(context, null);
    }

    /**
     * Builds the extractor, taking the output grouping from {@code override} when given instead
     * of the aggregation's own grouping.
     */
    SampleExtractor extractor(CompileContext context, Grouping override) {
        Grouping effective = override != null ? override : grouping;
        List<String> groups = new ArrayList<>();
        boolean without = false;
        boolean noLabels = false;
        if (effective != null) {
            groups.addAll(effective.getGroups());
            without = effective.isWithout();
            noLabels = effective.isNoop();
        }
        // absent_over_time yields a single series regardless of the input labels
        if (operation == RangeOperation.ABSENT_OVER_TIME) {
            noLabels = true;
        }
        Collections.sort(groups);

        List<Stage> stages = List.of();
        if (left.getLeft() instanceof PipelineExpr pipeline) {
            stages = pipeline.getStages().stages(context);
        }

        SampleExtractorFactory factory = context.getExtractorFactory();
        UnwrapExpr unwrap = left.getUnwrap();
        try {
            if (unwrap != null) {
                return factory.newLabelSampleExtractor(
                    unwrap.getIdentifier(),
                    unwrap.getConversionType(),
                    groups,
                    without,
                    noLabels,
                    stages,
                    unwrap.getPostFilters()
                );
            }
            LineExtractor lineExtractor = switch (operation) {
                case RATE, COUNT_OVER_TIME, ABSENT_OVER_TIME -> LineExtractor.COUNT;
                case BYTES_RATE, BYTES_OVER_TIME -> LineExtractor.BYTES;
                default -> throw new QueryCompilationException("unsupported range vector aggregation operation: " + operation);
            };
            return factory.newLineSampleExtractor(lineExtractor, stages, groups, without, noLabels);
        } catch (QueryCompilationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new QueryCompilationException("failed to build sample extractor for [" + this + "]", e);
        }
    }

    @Override
    public boolean isShardable() {
        return ShardableOperations.isShardable(operation.getName()) && left.isShardable();
    }

    @Override
    public void walk(Consumer<Expr> visitor) {
        visitor.accept(this);
        left.walk(visitor);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(operation.getName()).append('(');
        if (param != null) {
            sb.append(QueryStrings.formatFloat(param)).append(',');
        }
        sb.append(left).append(')');
        if (grouping != null) {
            sb.append(grouping);
        }
        return sb.toString();
    }
}
