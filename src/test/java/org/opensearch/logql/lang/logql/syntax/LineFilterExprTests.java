/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.core.exception.LogQLParseException;
import org.opensearch.logql.core.exception.StageException;
import org.opensearch.logql.core.model.MatchType;
import org.opensearch.logql.query.filter.AndFilter;
import org.opensearch.logql.query.filter.ContainsFilter;
import org.opensearch.logql.query.filter.Filterer;
import org.opensearch.logql.query.filter.IpLineFilter;
import org.opensearch.logql.query.filter.RegexFilter;
import org.opensearch.logql.query.stage.Stage;
import org.opensearch.test.OpenSearchTestCase;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.opensearch.logql.lang.logql.syntax.LogQLTestUtils.context;

/**
 * Tests for {@link LineFilterExpr} chains and their compilation.
 */
public class LineFilterExprTests extends OpenSearchTestCase {

    private final CompileContext context = context(
        new LogQLTestUtils.RecordingStageFactory(),
        new LogQLTestUtils.RecordingExtractorFactory()
    );

    public void testSingleFilterIsNotWrapped() {
        Filterer filter = LineFilterExpr.of(MatchType.EQUAL, "error").filter(context);
        assertThat(filter, instanceOf(ContainsFilter.class));
        assertEquals("error", ((ContainsFilter) filter).getMatch());
        assertFalse(((ContainsFilter) filter).isNegated());
    }

    public void testChainCompilesInWrittenOrder() {
        LineFilterExpr chain = LineFilterExpr.nested(
            LineFilterExpr.nested(LineFilterExpr.of(MatchType.EQUAL, "first"), LineFilterExpr.of(MatchType.NOT_EQUAL, "second")),
            LineFilterExpr.of(MatchType.REGEX, "third.*")
        );
        Filterer filter = chain.filter(context);
        assertThat(filter, instanceOf(AndFilter.class));
        List<Filterer> filters = ((AndFilter) filter).getFilters();
        assertEquals(3, filters.size());
        assertEquals("first", ((ContainsFilter) filters.get(0)).getMatch());
        assertEquals("second", ((ContainsFilter) filters.get(1)).getMatch());
        assertTrue(((ContainsFilter) filters.get(1)).isNegated());
        assertEquals("third.*", ((RegexFilter) filters.get(2)).getRegex());
    }

    public void testChainedStageFiltersLines() {
        LineFilterExpr chain = LineFilterExpr.nested(LineFilterExpr.of(MatchType.EQUAL, "error"), LineFilterExpr.of(MatchType.NOT_REGEX, "time(out|d)"));
        Stage stage = chain.stage(context);
        assertEquals("error in db", stage.process("error in db", Map.of()));
        assertNull(stage.process("error: timeout", Map.of()));
        assertNull(stage.process("all good", Map.of()));
    }

    public void testNestedKeepsOnlyRightFilter() {
        LineFilterExpr right = LineFilterExpr.nested(LineFilterExpr.of(MatchType.EQUAL, "dropped"), LineFilterExpr.of(MatchType.EQUAL, "kept"));
        LineFilterExpr chain = LineFilterExpr.nested(LineFilterExpr.of(MatchType.EQUAL, "head"), right);
        assertEquals("|= \"head\" |= \"kept\"", chain.toString());
        assertEquals("head", chain.getLeft().getMatch());
        assertNull(chain.getLeft().getLeft());
    }

    public void testEmptyContainsFilterIsNoop() {
        assertSame(Filterer.TRUE, LineFilterExpr.of(MatchType.EQUAL, "").filter(context));
        assertSame(Stage.NOOP, LineFilterExpr.of(MatchType.EQUAL, "").stage(context));
    }

    public void testIpFilter() {
        Filterer filter = LineFilterExpr.of(MatchType.EQUAL, LineFilterExpr.OP_IP, "10.0.0.0/8").filter(context);
        assertThat(filter, instanceOf(IpLineFilter.class));
        assertTrue(filter.filter("client 10.1.2.3 connected"));
        assertFalse(filter.filter("client 192.168.1.1 connected"));
    }

    public void testIpFilterInChain() {
        LineFilterExpr chain = LineFilterExpr.nested(
            LineFilterExpr.of(MatchType.EQUAL, "connected"),
            LineFilterExpr.of(MatchType.NOT_EQUAL, LineFilterExpr.OP_IP, "10.0.0.0/8")
        );
        List<Filterer> filters = ((AndFilter) chain.filter(context)).getFilters();
        assertThat(filters.get(0), instanceOf(ContainsFilter.class));
        assertThat(filters.get(1), instanceOf(IpLineFilter.class));
    }

    public void testUnknownFunctionRejected() {
        LogQLParseException e = expectThrows(LogQLParseException.class, () -> LineFilterExpr.of(MatchType.EQUAL, "cidr", "10.0.0.0/8"));
        assertEquals("unknown line filter function: cidr", e.getReason());
    }

    public void testInvalidIpPatternFailsAtCompilation() {
        LineFilterExpr expr = LineFilterExpr.of(MatchType.EQUAL, LineFilterExpr.OP_IP, "not-an-ip");
        StageException e = expectThrows(StageException.class, () -> expr.filter(context));
        assertEquals("|= ip(\"not-an-ip\")", e.getExpr());
    }

    public void testIpFilterWithRegexMatchFailsAtCompilation() {
        LineFilterExpr expr = LineFilterExpr.of(MatchType.REGEX, LineFilterExpr.OP_IP, "10.0.0.1");
        expectThrows(StageException.class, () -> expr.stage(context));
    }

    public void testInvalidRegexFailsAtCompilation() {
        LineFilterExpr chain = LineFilterExpr.nested(LineFilterExpr.of(MatchType.EQUAL, "ok"), LineFilterExpr.of(MatchType.REGEX, "(unclosed"));
        StageException e = expectThrows(StageException.class, () -> chain.filter(context));
        assertEquals("|= \"ok\" |~ \"(unclosed\"", e.getExpr());
        assertThat(e.getMessage(), containsString("stage '|= \"ok\" |~ \"(unclosed\"' : "));
    }

    public void testWalkVisitsSelfThenPreviousLinks() {
        LineFilterExpr first = LineFilterExpr.of(MatchType.EQUAL, "a");
        LineFilterExpr chain = LineFilterExpr.nested(first, LineFilterExpr.of(MatchType.EQUAL, "b"));
        List<Expr> visited = new ArrayList<>();
        chain.walk(visited::add);
        assertEquals(List.of(chain, first), visited);
    }

    public void testAlwaysShardable() {
        assertTrue(LineFilterExpr.of(MatchType.NOT_REGEX, "x").isShardable());
    }
}
