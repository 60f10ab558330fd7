/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.query.filter;

import org.opensearch.common.collect.Tuple;
import org.opensearch.common.network.InetAddresses;

import java.net.InetAddress;

/**
 * An IP pattern accepted by the {@code ip("...")} filters: a single address
 * ({@code 192.168.0.1}), a CIDR block ({@code 192.168.0.0/16}) or an inclusive range
 * ({@code 192.168.0.1-192.168.0.50}). IPv4 and IPv6 are both supported; addresses of different
 * families never match.
 */
public final class IpPattern {

    private final byte[] lower;
    private final byte[] upper;

    private IpPattern(byte[] lower, byte[] upper) {
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * Parse a pattern.
     *
     * @param pattern the pattern text
     * @return the parsed pattern
     * @throws IllegalArgumentException if the pattern is not a valid address, CIDR block or range
     */
    public static IpPattern parse(String pattern) {
        String trimmed = pattern.trim();
        if (trimmed.contains("/")) {
            Tuple<InetAddress, Integer> cidr = InetAddresses.parseCidr(trimmed);
            byte[] address = cidr.v1().getAddress();
            int prefix = cidr.v2();
            byte[] lower = address.clone();
            byte[] upper = address.clone();
            for (int bit = prefix; bit < address.length * 8; bit++) {
                int index = bit / 8;
                int mask = 1 << (7 - (bit % 8));
                lower[index] &= (byte) ~mask;
                upper[index] |= (byte) mask;
            }
            return new IpPattern(lower, upper);
        }
        int dash = trimmed.indexOf('-');
        if (dash >= 0) {
            byte[] lower = parseAddress(trimmed.substring(0, dash).trim());
            byte[] upper = parseAddress(trimmed.substring(dash + 1).trim());
            if (lower.length != upper.length) {
                throw new IllegalArgumentException("ip range mixes address families: " + pattern);
            }
            if (compare(lower, upper) > 0) {
                throw new IllegalArgumentException("ip range start is after its end: " + pattern);
            }
            return new IpPattern(lower, upper);
        }
        byte[] address = parseAddress(trimmed);
        return new IpPattern(address, address);
    }

    /**
     * @param candidate text that may be an IP address
     * @return true if the candidate is an address within this pattern
     */
    public boolean matches(String candidate) {
        if (candidate == null || !InetAddresses.isInetAddress(candidate)) {
            return false;
        }
        byte[] address = InetAddresses.forString(candidate).getAddress();
        return address.length == lower.length && compare(lower, address) <= 0 && compare(address, upper) <= 0;
    }

    private static byte[] parseAddress(String text) {
        if (!InetAddresses.isInetAddress(text)) {
            throw new IllegalArgumentException("invalid ip address: " + text);
        }
        return InetAddresses.forString(text).getAddress();
    }

    private static int compare(byte[] a, byte[] b) {
        for (int i = 0; i < a.length; i++) {
            int cmp = Integer.compare(a[i] & 0xFF, b[i] & 0xFF);
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }
}
