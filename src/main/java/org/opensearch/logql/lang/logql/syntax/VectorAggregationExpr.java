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
import org.opensearch.logql.core.exception.LogQLParseException;
import org.opensearch.logql.query.extractor.SampleExtractor;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Aggregates samples across series, e.g. <code>sum by (app) (rate({env="prod"}[1m]))</code> or
 * <code>topk(5, count_over_time({app="foo"}[5m]))</code>.
 */
public final class VectorAggregationExpr implements SampleExpr {

    private static final Logger logger = LogManager.getLogger(VectorAggregationExpr.class);

    private final SampleExpr left;
    private final VectorOperation operation;
    private final Grouping grouping;
    private final int param;

    private VectorAggregationExpr(SampleExpr left, VectorOperation operation, Grouping grouping, int param) {
        this.left = left;
        this.operation = operation;
        this.grouping = grouping;
        this.param = param;
    }

    public static VectorAggregationExpr of(SampleExpr left, VectorOperation operation, Grouping grouping) {
        return of(left, operation.getName(), grouping, null);
    }

    /**
     * @param left      the aggregated expression
     * @param operation the operation name
     * @param grouping  the grouping, or null for an empty {@code by} grouping
     * @param param     the parameter as written in the query, or null
     * @throws LogQLParseException if the operation is unknown, or the parameter is missing, not an
     *                             integer, or given to an operation that takes none
     */
    public static VectorAggregationExpr of(SampleExpr left, String operation, Grouping grouping, String param) {
        Objects.requireNonNull(left, "vector aggregation expression cannot be null");
        VectorOperation op = VectorOperation.fromString(operation);
        int value = 0;
        if (op.requiresParam()) {
            if (param == null) {
                throw new LogQLParseException("parameter required for operation " + op);
            }
            try {
                value = Integer.parseInt(param.trim());
            } catch (NumberFormatException e) {
                throw new LogQLParseException(String.format(Locale.ROOT, "invalid parameter %s(%s,", op, param), e);
            }
        } else if (param != null) {
            throw new LogQLParseException(String.format(Locale.ROOT, "unsupported parameter for operation %s(%s,", op, param));
        }
        return new VectorAggregationExpr(left, op, grouping == null ? Grouping.empty() : grouping, value);
    }

    public SampleExpr getLeft() {
        return left;
    }

    public VectorOperation getOperation() {
        return operation;
    }

    public Grouping getGrouping() {
        return grouping;
    }

    /**
     * @return the k of topk/bottomk, 0 for other operations
     */
    public int getParam() {
        return param;
    }

    @Override
    public LogSelectorExpr getSelector() {
        return left.getSelector();
    }

    @Override
    public List<MatcherRange> getMatcherGroups() {
        return left.getMatcherGroups();
    }

    /**
     * Compiles the inner expression. A {@code sum} over an ungrouped counting or summing range
     * aggregation hands its own grouping to the range aggregation's extractor, so that samples
     * are reduced to the output labels while being extracted.
     */
    @Override
    public SampleExtractor extractor(CompileContext context) {
        if (context.getConfig().isVectorGroupingPushDownEnabled()
            && left instanceof RangeAggregationExpr range
            && range.getGrouping() == null
            && canPushDownGrouping(operation, range.getOperation())) {
            logger.debug("Pushing grouping [{}] of [{}] down into [{}]", grouping, operation, range);
            return range.extractor(context, grouping);
        }
        return left.extractor(context);
    }

    static boolean canPushDownGrouping(VectorOperation vectorOp, RangeOperation rangeOp) {
        if (vectorOp != VectorOperation.SUM) {
            return false;
        }
        return switch (rangeOp) {
            case BYTES_OVER_TIME, BYTES_RATE, SUM_OVER_TIME, RATE, COUNT_OVER_TIME -> true;
            default -> false;
        };
    }

    /**
     * {@code count} and {@code avg} are only shardable when no parser runs below them: parsed
     * labels can split one stream into series that exist on several shards and would be counted
     * once per shard.
     */
    @Override
    public boolean isShardable() {
        if (operation == VectorOperation.COUNT || operation == VectorOperation.AVG) {
            if (!left.isShardable()) {
                return false;
            }
            AtomicBoolean parsed = new AtomicBoolean(false);
            left.walk(expr -> {
                if (expr instanceof LabelParserExpr) {
                    parsed.set(true);
                }
            });
            return !parsed.get();
        }
        return ShardableOperations.isShardable(operation.getName()) && left.isShardable();
    }

    @Override
    public void walk(Consumer<Expr> visitor) {
        visitor.accept(this);
        left.walk(visitor);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(operation.getName()).append(grouping).append('(');
        if (operation.requiresParam()) {
            sb.append(param).append(',');
        }
        return sb.append(left).append(')').toString();
    }
}
