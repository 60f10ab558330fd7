/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A single point of a series: its labels, a timestamp in milliseconds and a value.
 * Instances are immutable; the labels are kept sorted by name.
 */
public final class Sample {

    private final Map<String, String> labels;
    private final long timestamp;
    private final double value;

    /**
     * @param labels the series labels, copied
     * @param timestamp timestamp in milliseconds since epoch
     * @param value the sample value
     */
    public Sample(Map<String, String> labels, long timestamp, double value) {
        this.labels = Collections.unmodifiableMap(new TreeMap<>(labels));
        this.timestamp = timestamp;
        this.value = value;
    }

    /**
     * Create an unlabelled sample, as used for scalar literals.
     *
     * @param timestamp timestamp in milliseconds since epoch
     * @param value the sample value
     */
    public Sample(long timestamp, double value) {
        this(Map.of(), timestamp, value);
    }

    /**
     * @param newValue the replacement value
     * @return a sample with the same labels and timestamp and the given value
     */
    public Sample withValue(double newValue) {
        return new Sample(labels, timestamp, newValue);
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Sample sample = (Sample) o;
        return timestamp == sample.timestamp && Double.compare(value, sample.value) == 0 && labels.equals(sample.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(labels, timestamp, value);
    }

    @Override
    public String toString() {
        return "Sample{labels=" + labels + ", timestamp=" + timestamp + ", value=" + value + "}";
    }
}
