/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.common.unit.TimeValue;
import org.opensearch.logql.core.exception.LogQLParseException;
import org.opensearch.logql.core.model.MatchType;
import org.opensearch.logql.query.extractor.ConversionType;
import org.opensearch.logql.query.extractor.LineExtractor;
import org.opensearch.logql.query.extractor.SampleExtractorFactory;
import org.opensearch.logql.query.sharding.ShardingConfig;
import org.opensearch.logql.query.stage.LabelFmt;
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.opensearch.logql.lang.logql.syntax.LogQLTestUtils.context;
import static org.opensearch.logql.lang.logql.syntax.LogQLTestUtils.countOverTime;
import static org.opensearch.logql.lang.logql.syntax.LogQLTestUtils.pipeline;
import static org.opensearch.logql.lang.logql.syntax.LogQLTestUtils.rate;
import static org.opensearch.logql.lang.logql.syntax.LogQLTestUtils.selector;

/**
 * Tests for {@link VectorAggregationExpr}.
 */
public class VectorAggregationExprTests extends OpenSearchTestCase {

    private static final TimeValue ONE_MINUTE = TimeValue.timeValueMinutes(1);

    private final RangeAggregationExpr rate = rate(selector("app", "foo"), ONE_MINUTE);

    public void testTopkRequiresIntegerParameter() {
        LogQLParseException missing = expectThrows(LogQLParseException.class, () -> VectorAggregationExpr.of(rate, "topk", null, null));
        assertEquals("parameter required for operation topk", missing.getReason());

        LogQLParseException invalid = expectThrows(LogQLParseException.class, () -> VectorAggregationExpr.of(rate, "bottomk", null, "2.5"));
        assertEquals("invalid parameter bottomk(2.5,", invalid.getReason());

        assertEquals(10, VectorAggregationExpr.of(rate, "topk", Grouping.by("app"), "10").getParam());
    }

    public void testParameterRejectedForOtherOperations() {
        LogQLParseException e = expectThrows(LogQLParseException.class, () -> VectorAggregationExpr.of(rate, "sum", null, "5"));
        assertEquals("unsupported parameter for operation sum(5,", e.getReason());
    }

    public void testUnknownOperation() {
        expectThrows(LogQLParseException.class, () -> VectorAggregationExpr.of(rate, "median", null, null));
    }

    public void testMissingGroupingIsEmptyBy() {
        VectorAggregationExpr expr = VectorAggregationExpr.of(rate, VectorOperation.MAX, null);
        assertEquals(Grouping.empty(), expr.getGrouping());
        assertTrue(expr.getGrouping().isNoop());
    }

    public void testSumPushesGroupingIntoRangeExtractor() {
        LogQLTestUtils.RecordingExtractorFactory extractors = new LogQLTestUtils.RecordingExtractorFactory();
        CompileContext context = context(new LogQLTestUtils.RecordingStageFactory(), extractors);

        VectorAggregationExpr.of(rate, VectorOperation.SUM, Grouping.by("pod", "app")).extractor(context);
        assertEquals(LineExtractor.COUNT, extractors.lineExtractor);
        assertEquals(List.of("app", "pod"), extractors.groups);
        assertFalse(extractors.without);
        assertFalse(extractors.noLabels);

        VectorAggregationExpr.of(rate, VectorOperation.SUM, Grouping.without("pod")).extractor(context);
        assertEquals(List.of("pod"), extractors.groups);
        assertTrue(extractors.without);
        assertFalse(extractors.noLabels);

        VectorAggregationExpr.of(rate, VectorOperation.SUM, null).extractor(context);
        assertEquals(List.of(), extractors.groups);
        assertTrue(extractors.noLabels);
    }

    public void testPushDownVerifiedWithMock() {
        SampleExtractorFactory extractors = mock(SampleExtractorFactory.class);
        RangeAggregationExpr bytes = RangeAggregationExpr.of(LogRange.of(selector("app", "foo"), ONE_MINUTE), RangeOperation.BYTES_RATE);

        VectorAggregationExpr.of(bytes, VectorOperation.SUM, Grouping.by("cluster"))
            .extractor(context(new LogQLTestUtils.RecordingStageFactory(), extractors));
        verify(extractors).newLineSampleExtractor(eq(LineExtractor.BYTES), anyList(), eq(List.of("cluster")), eq(false), eq(false));
    }

    public void testPushDownForSummedUnwrap() {
        LogQLTestUtils.RecordingExtractorFactory extractors = new LogQLTestUtils.RecordingExtractorFactory();
        RangeAggregationExpr sumOverTime = RangeAggregationExpr.of(
            LogRange.of(selector("app", "foo"), ONE_MINUTE, UnwrapExpr.of("size", "bytes"), null),
            RangeOperation.SUM_OVER_TIME
        );
        VectorAggregationExpr.of(sumOverTime, VectorOperation.SUM, Grouping.by("app"))
            .extractor(context(new LogQLTestUtils.RecordingStageFactory(), extractors));
        assertEquals(ConversionType.BYTES, extractors.conversion);
        assertEquals(List.of("app"), extractors.groups);
    }

    public void testNoPushDownForOtherOperations() {
        LogQLTestUtils.RecordingExtractorFactory extractors = new LogQLTestUtils.RecordingExtractorFactory();
        CompileContext context = context(new LogQLTestUtils.RecordingStageFactory(), extractors);

        VectorAggregationExpr.of(rate, VectorOperation.MAX, Grouping.by("app")).extractor(context);
        assertEquals(List.of(), extractors.groups);
        assertFalse(extractors.noLabels);

        RangeAggregationExpr maxOverTime = RangeAggregationExpr.of(
            LogRange.of(selector("app", "foo"), ONE_MINUTE, UnwrapExpr.of("latency"), null),
            RangeOperation.MAX_OVER_TIME
        );
        VectorAggregationExpr.of(maxOverTime, VectorOperation.SUM, Grouping.by("app")).extractor(context);
        assertEquals(List.of(), extractors.groups);
        assertFalse(extractors.noLabels);
    }

    public void testNoPushDownThroughNestedAggregation() {
        LogQLTestUtils.RecordingExtractorFactory extractors = new LogQLTestUtils.RecordingExtractorFactory();
        VectorAggregationExpr inner = VectorAggregationExpr.of(rate, VectorOperation.MAX, Grouping.by("pod"));
        VectorAggregationExpr.of(inner, VectorOperation.SUM, Grouping.by("app"))
            .extractor(context(new LogQLTestUtils.RecordingStageFactory(), extractors));
        assertEquals(List.of(), extractors.groups);
    }

    public void testPushDownDisabledBySetting() {
        LogQLTestUtils.RecordingExtractorFactory extractors = new LogQLTestUtils.RecordingExtractorFactory();
        CompileContext context = context(new LogQLTestUtils.RecordingStageFactory(), extractors, new ShardingConfig(true, false));

        VectorAggregationExpr.of(rate, VectorOperation.SUM, Grouping.by("app")).extractor(context);
        assertEquals(List.of(), extractors.groups);
        assertFalse(extractors.noLabels);
    }

    public void testCanPushDownGrouping() {
        for (RangeOperation op : RangeOperation.values()) {
            boolean expected = switch (op) {
                case BYTES_OVER_TIME, BYTES_RATE, SUM_OVER_TIME, RATE, COUNT_OVER_TIME -> true;
                default -> false;
            };
            assertEquals(op.toString(), expected, VectorAggregationExpr.canPushDownGrouping(VectorOperation.SUM, op));
            assertFalse(VectorAggregationExpr.canPushDownGrouping(VectorOperation.AVG, op));
        }
    }

    public void testCountAndAvgNotShardableOverParser() {
        PipelineExpr parsed = pipeline(selector("app", "foo"), LabelParserExpr.of(ParserType.LOGFMT));
        RangeAggregationExpr parsedRate = rate(parsed, ONE_MINUTE);
        assertTrue(parsedRate.isShardable());

        assertFalse(VectorAggregationExpr.of(parsedRate, VectorOperation.COUNT, null).isShardable());
        assertFalse(VectorAggregationExpr.of(parsedRate, VectorOperation.AVG, Grouping.by("level")).isShardable());
        assertTrue(VectorAggregationExpr.of(parsedRate, VectorOperation.SUM, Grouping.by("level")).isShardable());

        PipelineExpr filtered = pipeline(selector("app", "foo"), LineFilterExpr.of(MatchType.EQUAL, "error"));
        assertTrue(VectorAggregationExpr.of(countOverTime(filtered, ONE_MINUTE), VectorOperation.COUNT, null).isShardable());
        assertTrue(VectorAggregationExpr.of(rate, VectorOperation.AVG, null).isShardable());
    }

    public void testShardability() {
        assertTrue(VectorAggregationExpr.of(rate, VectorOperation.SUM, null).isShardable());
        assertFalse(VectorAggregationExpr.of(rate, VectorOperation.MAX, null).isShardable());
        assertFalse(VectorAggregationExpr.of(rate, VectorOperation.MIN, null).isShardable());
        assertFalse(VectorAggregationExpr.of(rate, "topk", null, "3").isShardable());
        assertFalse(VectorAggregationExpr.of(rate, VectorOperation.STDDEV, null).isShardable());

        PipelineExpr relabeled = pipeline(selector("app", "foo"), LabelFmtExpr.of(List.of(LabelFmt.rename("a", "b"))));
        assertFalse(VectorAggregationExpr.of(rate(relabeled, ONE_MINUTE), VectorOperation.COUNT, null).isShardable());
        assertFalse(VectorAggregationExpr.of(rate(relabeled, ONE_MINUTE), VectorOperation.SUM, null).isShardable());
    }

    public void testDelegatesSelectorAndMatcherGroups() {
        VectorAggregationExpr expr = VectorAggregationExpr.of(rate, VectorOperation.SUM, null);
        assertSame(rate.getSelector(), expr.getSelector());
        assertEquals(rate.getMatcherGroups(), expr.getMatcherGroups());
    }
}
