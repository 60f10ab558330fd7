/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.logql.core.utils;

import org.opensearch.test.OpenSearchTestCase;

/**
 * Tests for {@link QueryStrings}.
 */
public class QueryStringsTests extends OpenSearchTestCase {

    public void testQuote() {
        assertEquals("\"api\"", QueryStrings.quote("api"));
        assertEquals("\"\"", QueryStrings.quote(""));
        assertEquals("\"say \\\"hi\\\"\"", QueryStrings.quote("say \"hi\""));
        assertEquals("\"C:\\\\logs\"", QueryStrings.quote("C:\\logs"));
        assertEquals("\"a\\tb\\nc\"", QueryStrings.quote("a\tb\nc"));
        assertEquals("\"\\x01\"", QueryStrings.quote("\u0001"));
        assertEquals("\"héllo\"", QueryStrings.quote("héllo"));
    }

    public void testParseFloat() {
        assertEquals(2.5, QueryStrings.parseFloat("2.5"), 0.0);
        assertEquals(1e3, QueryStrings.parseFloat("1e3"), 0.0);
        assertEquals(8.0, QueryStrings.parseFloat("0x1p3"), 0.0);
        expectThrows(NumberFormatException.class, () -> QueryStrings.parseFloat("2f"));
        expectThrows(NumberFormatException.class, () -> QueryStrings.parseFloat("1d"));
        expectThrows(NumberFormatException.class, () -> QueryStrings.parseFloat(""));
    }

    public void testFormatFloat() {
        assertEquals("0", QueryStrings.formatFloat(0));
        assertEquals("2", QueryStrings.formatFloat(2));
        assertEquals("-2", QueryStrings.formatFloat(-2));
        assertEquals("0.99", QueryStrings.formatFloat(0.99));
        assertEquals("100", QueryStrings.formatFloat(100));
        assertEquals("0.0000001", QueryStrings.formatFloat(1e-7));
        assertEquals("NaN", QueryStrings.formatFloat(Double.NaN));
        assertEquals("+Inf", QueryStrings.formatFloat(Double.POSITIVE_INFINITY));
        assertEquals("-Inf", QueryStrings.formatFloat(Double.NEGATIVE_INFINITY));
    }
}
