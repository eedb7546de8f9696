package com.evfinder.infrastructure.http;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HttpClientUtil.
 */
class HttpClientUtilTest {

    @Test
    void testWithQueryEncodesParameters() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("dates", "20260314");
        params.put("team", "Paris Saint-Germain & co");

        String url = HttpClientUtil.withQuery("https://example.org/scoreboard", params);

        assertEquals("https://example.org/scoreboard?dates=20260314&team=Paris+Saint-Germain+%26+co", url);
    }

    @Test
    void testWithQueryWithoutParameters() {
        assertEquals("https://example.org", HttpClientUtil.withQuery("https://example.org", Map.of()));
        assertEquals("https://example.org", HttpClientUtil.withQuery("https://example.org", null));
    }
}
