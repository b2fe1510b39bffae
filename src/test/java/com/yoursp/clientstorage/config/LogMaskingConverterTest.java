package com.yoursp.clientstorage.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Client keys must never reach the log in full.
 */
class LogMaskingConverterTest {

    private static final String KEY = "0123abcd" + "e".repeat(56);

    private final LogMaskingConverter converter = new LogMaskingConverter();

    @Test
    void masksClientKeyHeaderValue() {
        String result = converter.transform(null, "x-client-key=secretvalue12345");
        assertEquals("x-client-key=secretva...", result);
    }

    @Test
    void masksClientKeyInJson() {
        String result = converter.transform(null, "{\"x-client-key\":\"abcdefghijklmnop\"}");
        assertTrue(result.contains("abcdefgh..."));
        assertFalse(result.contains("ijklmnop"));
    }

    @Test
    void masksClientQueryParameter() {
        String result = converter.transform(null, "GET /storage/list?client=" + KEY);
        assertTrue(result.contains("?client=0123abcd..."));
        assertFalse(result.contains(KEY));
    }

    @Test
    void masksBareKeysInsidePaths() {
        String result = converter.transform(null, "Stored storage-data/" + KEY + "/u42/report.pdf");
        assertEquals("Stored storage-data/0123abcd.../u42/report.pdf", result);
    }

    @Test
    void passesNonSensitiveDataThrough() {
        String input = "Stored 2026-10-19T08-15-30-123Z_3f9a0c1e_report.pdf (1024 bytes)";
        assertEquals(input, converter.transform(null, input));
    }

    @Test
    void handlesNullInput() {
        assertNull(converter.transform(null, null));
    }
}
