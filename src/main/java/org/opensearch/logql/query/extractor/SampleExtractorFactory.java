/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.query.extractor;

import org.opensearch.logql.query.filter.LabelFilterer;
import org.opensearch.logql.query.stage.Stage;

import java.util.List;

/**
 * Builds sample extractors for range aggregations. Implementations may throw a runtime exception
 * for unsupported combinations.
 *
 * <p>The grouping arguments describe which labels the produced samples keep: {@code groups} with
 * {@code without=false} keeps only those labels, with {@code without=true} drops them, and
 * {@code noLabels} drops every label.</p>
 */
public interface SampleExtractorFactory {

    /**
     * Extractor deriving values from the line itself.
     *
     * @param extractor count or bytes
     * @param stages the compiled pipeline stages to run first
     * @param groups sorted grouping labels
     * @param without whether {@code groups} are excluded rather than kept
     * @param noLabels whether every label is dropped
     * @return the extractor
     */
    SampleExtractor newLineSampleExtractor(LineExtractor extractor, List<Stage> stages, List<String> groups, boolean without, boolean noLabels);

    /**
     * Extractor deriving values from an unwrapped label.
     *
     * @param labelName the label holding the value
     * @param conversion the conversion applied to the label value
     * @param groups sorted grouping labels
     * @param without whether {@code groups} are excluded rather than kept
     * @param noLabels whether every label is dropped
     * @param stages the compiled pipeline stages to run first
     * @param postFilters label filters applied after the conversion, all of which must pass
     * @return the extractor
     */
    SampleExtractor newLabelSampleExtractor(
        String labelName,
        ConversionType conversion,
        List<String> groups,
        boolean without,
        boolean noLabels,
        List<Stage> stages,
        List<LabelFilterer> postFilters
    );
}
