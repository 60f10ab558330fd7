/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import org.opensearch.logql.core.exception.StageException;
import org.opensearch.logql.core.model.LabelMatcher;
import org.opensearch.logql.core.model.MatchType;
import org.opensearch.logql.query.filter.IpLabelFilter;
import org.opensearch.logql.query.filter.StringLabelFilter;
import org.opensearch.logql.query.stage.JsonExpression;
import org.opensearch.logql.query.stage.LabelFmt;
import org.opensearch.logql.query.stage.Pipeline;
import org.opensearch.logql.query.stage.Stage;
import org.opensearch.logql.query.stage.StageFactory;
import org.opensearch.test.OpenSearchTestCase;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.instanceOf;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.opensearch.logql.lang.logql.syntax.LogQLTestUtils.context;
import static org.opensearch.logql.lang.logql.syntax.LogQLTestUtils.pipeline;
import static org.opensearch.logql.lang.logql.syntax.LogQLTestUtils.selector;

/**
 * Tests for {@link PipelineExpr} and the compilation of its stages.
 */
public class PipelineExprTests extends OpenSearchTestCase {

    public void testMatchersCompileToNoopPipeline() {
        MatchersExpr matchers = selector("app", "foo");
        Pipeline compiled = matchers.pipeline(context(new LogQLTestUtils.RecordingStageFactory(), new LogQLTestUtils.RecordingExtractorFactory()));
        assertTrue(compiled.isNoop());
        assertEquals("line", compiled.process("line", Map.of()));
        assertFalse(matchers.hasFilter());
    }

    public void testStagesCompiledInOrder() {
        LogQLTestUtils.RecordingStageFactory stages = new LogQLTestUtils.RecordingStageFactory();
        PipelineExpr expr = pipeline(
            selector("app", "foo"),
            LabelParserExpr.of(ParserType.LOGFMT),
            JsonExpressionParserExpr.of(List.of(new JsonExpression("a", "b"))),
            LabelFmtExpr.of(List.of(LabelFmt.rename("x", "y"))),
            LineFmtExpr.of("{{.x}}")
        );
        Pipeline compiled = expr.pipeline(context(stages, new LogQLTestUtils.RecordingExtractorFactory()));
        assertEquals(4, compiled.getStages().size());
        assertEquals(List.of("parser:logfmt", "json_expressions:1", "label_format:1", "line_format:{{.x}}"), stages.calls);
    }

    public void testNoopStagesAreElided() {
        LogQLTestUtils.RecordingStageFactory stages = new LogQLTestUtils.RecordingStageFactory(ParserType.UNPACK);
        PipelineExpr expr = pipeline(
            selector("app", "foo"),
            LabelParserExpr.of(ParserType.UNPACK),
            LineFilterExpr.of(MatchType.EQUAL, ""),
            LineFilterExpr.of(MatchType.EQUAL, "error")
        );
        List<Stage> compiled = expr.getStages().stages(context(stages, new LogQLTestUtils.RecordingExtractorFactory()));
        assertEquals(1, compiled.size());
        assertFalse(compiled.contains(Stage.NOOP));
        assertEquals("an error", compiled.get(0).process("an error", Map.of()));
    }

    public void testPipelineProcessesLines() {
        PipelineExpr expr = pipeline(
            selector("app", "foo"),
            LineFilterExpr.of(MatchType.EQUAL, "error"),
            LabelFilterExpr.of(new StringLabelFilter(LabelMatcher.of(MatchType.EQUAL, "level", "warn"))),
            LineFmtExpr.of("formatted")
        );
        Pipeline compiled = expr.pipeline(context(new LogQLTestUtils.RecordingStageFactory(), new LogQLTestUtils.RecordingExtractorFactory()));

        Map<String, String> warn = new HashMap<>(Map.of("level", "warn"));
        assertEquals("formatted", compiled.process("an error", warn));
        assertNull(compiled.process("all good", warn));
        assertNull(compiled.process("an error", Map.of("level", "info")));
    }

    public void testFailingStageIsWrappedWithItsText() {
        StageFactory failing = mock(StageFactory.class);
        when(failing.newLineFormatter(anyString())).thenThrow(new IllegalArgumentException("bad template"));
        PipelineExpr expr = pipeline(selector("app", "foo"), LineFilterExpr.of(MatchType.EQUAL, "x"), LineFmtExpr.of("{{.broken"));

        StageException e = expectThrows(
            StageException.class,
            () -> expr.pipeline(context(failing, new LogQLTestUtils.RecordingExtractorFactory()))
        );
        assertEquals("| line_format \"{{.broken\"", e.getExpr());
        assertEquals("stage '| line_format \"{{.broken\"' : bad template", e.getMessage());
        assertThat(e.getCause(), instanceOf(IllegalArgumentException.class));
    }

    public void testIpLabelFilterPatternErrorSurfacesAtCompilation() {
        IpLabelFilter invalid = new IpLabelFilter("addr", MatchType.EQUAL, "300.1.1.1");
        assertNotNull(invalid.getPatternError());
        PipelineExpr expr = pipeline(selector("app", "foo"), LabelFilterExpr.of(invalid));

        StageException e = expectThrows(
            StageException.class,
            () -> expr.pipeline(context(new LogQLTestUtils.RecordingStageFactory(), new LogQLTestUtils.RecordingExtractorFactory()))
        );
        assertEquals("| addr=ip(\"300.1.1.1\")", e.getExpr());
        assertSame(invalid.getPatternError(), e.getCause().getCause());
    }

    public void testValidIpLabelFilterCompilesToItself() {
        IpLabelFilter valid = new IpLabelFilter("addr", MatchType.EQUAL, "10.0.0.0/8");
        CompileContext context = context(new LogQLTestUtils.RecordingStageFactory(), new LogQLTestUtils.RecordingExtractorFactory());
        assertSame(valid, LabelFilterExpr.of(valid).stage(context));
    }

    public void testHasFilter() {
        assertTrue(pipeline(selector("app", "foo"), LineFilterExpr.of(MatchType.EQUAL, "x")).hasFilter());
        assertTrue(
            pipeline(
                selector("app", "foo"),
                LabelParserExpr.of(ParserType.JSON),
                LabelFilterExpr.of(new StringLabelFilter(LabelMatcher.of(MatchType.EQUAL, "a", "b")))
            ).hasFilter()
        );
        assertFalse(pipeline(selector("app", "foo"), LabelParserExpr.of(ParserType.JSON), LineFmtExpr.of("x")).hasFilter());
    }

    public void testAppendStageAndMatchers() {
        PipelineExpr expr = pipeline(selector("app", "foo"), LabelParserExpr.of(ParserType.JSON));
        expr.appendStage(LineFilterExpr.of(MatchType.EQUAL, "x"));
        expr.getLeft().appendMatchers(List.of(LabelMatcher.of(MatchType.REGEX, "env", "prod|dev")));
        assertEquals("{app=\"foo\", env=~\"prod|dev\"} | json |= \"x\"", expr.toString());
        assertEquals(2, expr.getMatchers().size());
        assertEquals(2, expr.getStages().size());
    }

    public void testShardability() {
        assertTrue(pipeline(selector("app", "foo"), LabelParserExpr.of(ParserType.JSON), LineFmtExpr.of("x")).isShardable());
        assertFalse(pipeline(selector("app", "foo"), LabelFmtExpr.of(List.of(LabelFmt.template("a", "{{.b}}")))).isShardable());
    }

    public void testWalkVisitsMatchersThenStages() {
        MatchersExpr matchers = selector("app", "foo");
        LineFilterExpr filter = LineFilterExpr.of(MatchType.EQUAL, "x");
        LabelParserExpr parser = LabelParserExpr.of(ParserType.LOGFMT);
        PipelineExpr expr = pipeline(matchers, filter, parser);

        List<Expr> visited = new ArrayList<>();
        expr.walk(visited::add);
        assertEquals(List.of(expr, matchers, filter, parser), visited);
    }
}
