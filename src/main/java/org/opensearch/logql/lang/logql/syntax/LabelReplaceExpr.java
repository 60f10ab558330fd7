/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.lang.logql.syntax;

import com.google.re2j.Pattern;
import com.google.re2j.PatternSyntaxException;
import org.opensearch.logql.core.exception.LogQLParseException;
import org.opensearch.logql.core.utils.QueryStrings;
import org.opensearch.logql.query.extractor.SampleExtractor;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * <code>label_replace(expr, "dst", "replacement", "src", "regex")</code>: for each series, if the
 * value of {@code src} matches the anchored regex, sets {@code dst} to the expanded replacement.
 */
public final class LabelReplaceExpr implements SampleExpr {

    private final SampleExpr left;
    private final String dst;
    private final String replacement;
    private final String src;
    private final String regex;
    private final Pattern pattern;

    private LabelReplaceExpr(SampleExpr left, String dst, String replacement, String src, String regex, Pattern pattern) {
        this.left = left;
        this.dst = dst;
        this.replacement = replacement;
        this.src = src;
        this.regex = regex;
        this.pattern = pattern;
    }

    /**
     * @throws LogQLParseException if the regex does not compile
     */
    public static LabelReplaceExpr of(SampleExpr left, String dst, String replacement, String src, String regex) {
        Objects.requireNonNull(left, "label_replace expression cannot be null");
        Objects.requireNonNull(dst, "label_replace destination cannot be null");
        Objects.requireNonNull(replacement, "label_replace replacement cannot be null");
        Objects.requireNonNull(src, "label_replace source cannot be null");
        Objects.requireNonNull(regex, "label_replace regex cannot be null");
        Pattern pattern;
        try {
            pattern = Pattern.compile("^(?:" + regex + ")$");
        } catch (PatternSyntaxException e) {
            throw new LogQLParseException("invalid regex in label_replace: " + e.getMessage(), e);
        }
        return new LabelReplaceExpr(left, dst, replacement, src, regex, pattern);
    }

    public SampleExpr getLeft() {
        return left;
    }

    public String getDst() {
        return dst;
    }

    public String getReplacement() {
        return replacement;
    }

    public String getSrc() {
        return src;
    }

    public String getRegex() {
        return regex;
    }

    /**
     * @return the compiled, anchored regex
     */
    public Pattern getPattern() {
        return pattern;
    }

    @Override
    public LogSelectorExpr getSelector() {
        return left.getSelector();
    }

    @Override
    public SampleExtractor extractor(CompileContext context) {
        return left.extractor(context);
    }

    @Override
    public List<MatcherRange> getMatcherGroups() {
        return left.getMatcherGroups();
    }

    @Override
    public boolean isShardable() {
        return false;
    }

    @Override
    public void walk(Consumer<Expr> visitor) {
        visitor.accept(this);
        left.walk(visitor);
    }

    @Override
    public String toString() {
        return "label_replace("
            + left
            + ","
            + QueryStrings.quote(dst)
            + ","
            + QueryStrings.quote(replacement)
            + ","
            + QueryStrings.quote(src)
            + ","
            + QueryStrings.quote(regex)
            + ")";
    }
}
