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
import org.opensearch.logql.core.model.LabelMatcher;
import org.opensearch.logql.core.model.MatchType;
import org.opensearch.logql.query.extractor.ConversionType;
import org.opensearch.logql.query.filter.StringLabelFilter;
import org.opensearch.logql.query.stage.JsonExpression;
import org.opensearch.logql.query.stage.LabelFmt;
import org.opensearch.test.OpenSearchTestCase;

import java.util.ArrayList;
import java.util.List;

import static org.opensearch.logql.lang.logql.syntax.LogQLTestUtils.selector;

/**
 * Tests for the construction rules of the smaller syntax types: grouping, unwrap, log range,
 * parsers, formatters and operator vocabularies.
 */
public class SyntaxNodeTests extends OpenSearchTestCase {

    public void testGrouping() {
        assertEquals(" by(a,b)", Grouping.by("a", "b").toString());
        assertEquals(" without(a)", Grouping.without("a").toString());
        assertEquals(" without()", Grouping.without().toString());
        assertEquals("", Grouping.empty().toString());
        assertEquals(Grouping.empty(), Grouping.of(List.of(), false));
        assertTrue(Grouping.by().isNoop());
        assertFalse(Grouping.without().isNoop());
        assertNotEquals(Grouping.by("a"), Grouping.without("a"));
    }

    public void testUnwrapConversions() {
        assertEquals(ConversionType.FLOAT, UnwrapExpr.of("x").getConversionType());
        assertEquals(ConversionType.FLOAT, UnwrapExpr.of("x", "").getConversionType());
        assertEquals(ConversionType.BYTES, UnwrapExpr.of("x", "bytes").getConversionType());
        assertEquals(ConversionType.DURATION, UnwrapExpr.of("x", "duration").getConversionType());
        assertEquals(ConversionType.DURATION, UnwrapExpr.of("x", "duration_seconds").getConversionType());
        assertEquals("| unwrap duration_seconds(x)", UnwrapExpr.of("x", "duration_seconds").toString());
        expectThrows(LogQLParseException.class, () -> UnwrapExpr.of("x", "kilobytes"));
        expectThrows(LogQLParseException.class, () -> UnwrapExpr.of("", (String) null));
    }

    public void testUnwrapPostFilters() {
        StringLabelFilter first = new StringLabelFilter(LabelMatcher.of(MatchType.EQUAL, "a", "1"));
        StringLabelFilter second = new StringLabelFilter(LabelMatcher.of(MatchType.NOT_REGEX, "b", "2.*"));
        UnwrapExpr unwrap = UnwrapExpr.of("latency").addPostFilter(first).addPostFilter(second);
        assertEquals(List.of(first, second), unwrap.getPostFilters());
        assertEquals("| unwrap latency | a=\"1\" | b!~\"2.*\"", unwrap.toString());
    }

    public void testLogRangeRules() {
        expectThrows(LogQLParseException.class, () -> LogRange.of(selector("a", "b"), TimeValue.ZERO));
        expectThrows(
            LogQLParseException.class,
            () -> LogRange.of(selector("a", "b"), TimeValue.timeValueMinutes(1), null, TimeValue.timeValueMillis(-1))
        );
        LogRange range = LogRange.of(selector("a", "b"), TimeValue.timeValueMillis(1500));
        assertEquals(TimeValue.ZERO, range.getOffset());
        assertNull(range.getUnwrap());
        assertEquals("{a=\"b\"}[1s500ms]", range.toString());
        assertEquals("{a=\"b\"}[2w] offset 1d", LogRange.of(selector("a", "b"), TimeValue.timeValueDays(14), null, TimeValue.timeValueDays(1)).toString());
    }

    public void testLogRangeRejectsSubMillisecondPrecision() {
        expectThrows(LogQLParseException.class, () -> LogRange.of(selector("a", "b"), TimeValue.timeValueNanos(1_500_000)));
        expectThrows(
            LogQLParseException.class,
            () -> LogRange.of(selector("a", "b"), TimeValue.timeValueMinutes(1), null, TimeValue.timeValueNanos(2_000_001))
        );
        LogRange whole = LogRange.of(selector("a", "b"), TimeValue.timeValueNanos(2_000_000), null, TimeValue.timeValueNanos(3_000_000));
        assertEquals("{a=\"b\"}[2ms] offset 3ms", whole.toString());
    }

    public void testMatchersRejectNullEntries() {
        List<LabelMatcher> withNull = new ArrayList<>();
        withNull.add(null);
        expectThrows(NullPointerException.class, () -> MatchersExpr.of(withNull));

        MatchersExpr matchers = selector("a", "b");
        expectThrows(NullPointerException.class, () -> matchers.appendMatchers(null));
        expectThrows(NullPointerException.class, () -> matchers.appendMatchers(withNull));
        assertEquals(1, matchers.getMatchers().size());

        matchers.appendMatchers(List.of(LabelMatcher.of(MatchType.REGEX, "c", "d.*")));
        assertEquals("{a=\"b\", c=~\"d.*\"}", matchers.toString());
    }

    public void testLogRangeShardabilityFollowsSelector() {
        assertTrue(LogRange.of(selector("a", "b"), TimeValue.timeValueMinutes(1)).isShardable());
        PipelineExpr relabeled = LogQLTestUtils.pipeline(
            selector("a", "b"),
            LabelFmtExpr.of(List.of(LabelFmt.rename("x", "y")))
        );
        assertFalse(LogRange.of(relabeled, TimeValue.timeValueMinutes(1)).isShardable());
    }

    public void testParserParameters() {
        expectThrows(LogQLParseException.class, () -> LabelParserExpr.of(ParserType.REGEXP));
        expectThrows(LogQLParseException.class, () -> LabelParserExpr.of(ParserType.PATTERN, null));
        assertEquals("", LabelParserExpr.of(ParserType.JSON, null).getParam());
        assertEquals(ParserType.UNPACK, ParserType.fromString("unpack"));
        expectThrows(LogQLParseException.class, () -> ParserType.fromString("xml"));
    }

    public void testFormattersRequireEntries() {
        expectThrows(LogQLParseException.class, () -> LabelFmtExpr.of(List.of()));
        expectThrows(LogQLParseException.class, () -> JsonExpressionParserExpr.of(List.of()));
        assertEquals(1, JsonExpressionParserExpr.of(List.of(new JsonExpression("a", "b"))).getExpressions().size());
    }

    public void testStageShardability() {
        assertTrue(LabelParserExpr.of(ParserType.LOGFMT).isShardable());
        assertTrue(LineFmtExpr.of("x").isShardable());
        assertTrue(JsonExpressionParserExpr.of(List.of(new JsonExpression("a", "b"))).isShardable());
        assertTrue(LabelFilterExpr.of(new StringLabelFilter(LabelMatcher.of(MatchType.EQUAL, "a", "b"))).isShardable());
        assertFalse(LabelFmtExpr.of(List.of(LabelFmt.template("a", "b"))).isShardable());
    }

    public void testBinaryOperatorClassification() {
        for (BinaryOperator op : BinaryOperator.values()) {
            int kinds = (op.isComparison() ? 1 : 0) + (op.isLogical() ? 1 : 0) + (op.isArithmetic() ? 1 : 0);
            assertEquals(op.toString(), 1, kinds);
            assertSame(op, BinaryOperator.fromSymbol(op.getSymbol()));
        }
        assertTrue(BinaryOperator.LTE.isComparison());
        assertTrue(BinaryOperator.UNLESS.isLogical());
        assertTrue(BinaryOperator.POW.isArithmetic());
        expectThrows(IllegalArgumentException.class, () -> BinaryOperator.fromSymbol("=~"));
    }

    public void testOperationNames() {
        for (RangeOperation op : RangeOperation.values()) {
            assertSame(op, RangeOperation.fromString(op.getName()));
        }
        for (VectorOperation op : VectorOperation.values()) {
            assertSame(op, VectorOperation.fromString(op.getName()));
        }
        assertEquals("rate_counter", RangeOperation.RATE_COUNTER.getName());
        assertTrue(VectorOperation.TOPK.requiresParam());
        assertFalse(VectorOperation.COUNT.requiresParam());
        expectThrows(LogQLParseException.class, () -> RangeOperation.fromString("rate_over_time"));
        expectThrows(LogQLParseException.class, () -> VectorOperation.fromString("avg_over_time"));
    }

    public void testVectorMatchCardinalityNames() {
        assertEquals("one-to-one", VectorMatchCardinality.ONE_TO_ONE.toString());
        assertEquals("many-to-one", VectorMatchCardinality.MANY_TO_ONE.toString());
        assertEquals("one-to-many", VectorMatchCardinality.ONE_TO_MANY.toString());
    }
}
