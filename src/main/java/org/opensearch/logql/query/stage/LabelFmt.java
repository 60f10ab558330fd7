/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.query.stage;

import org.opensearch.logql.core.utils.QueryStrings;

import java.util.Objects;

/**
 * A single {@code label_format} rule. A rename rule ({@code dst=src}) copies an existing label;
 * a template rule ({@code dst="{{.src}}"}) renders a template.
 */
public final class LabelFmt {

    private final String name;
    private final String value;
    private final boolean rename;

    private LabelFmt(String name, String value, boolean rename) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.value = Objects.requireNonNull(value, "value cannot be null");
        this.rename = rename;
    }

    /**
     * @param dst the destination label
     * @param src the source label
     * @return a rename rule
     */
    public static LabelFmt rename(String dst, String src) {
        return new LabelFmt(dst, src, true);
    }

    /**
     * @param dst the destination label
     * @param template the value template
     * @return a template rule
     */
    public static LabelFmt template(String dst, String template) {
        return new LabelFmt(dst, template, false);
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public boolean isRename() {
        return rename;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LabelFmt labelFmt = (LabelFmt) o;
        return rename == labelFmt.rename && name.equals(labelFmt.name) && value.equals(labelFmt.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, rename);
    }

    @Override
    public String toString() {
        return name + "=" + (rename ? value : QueryStrings.quote(value));
    }
}
