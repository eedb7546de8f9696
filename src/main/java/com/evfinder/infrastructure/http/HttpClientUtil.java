package com.evfinder.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Utility for GET requests against JSON APIs.
 */
public final class HttpClientUtil {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientUtil.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final int MAX_LOG_BODY_LENGTH = 500;

    private HttpClientUtil() {
    }

    /**
     * Makes a GET request and returns the response as JsonNode.
     *
     * @param url     Full URL
     * @param headers Request headers, may be null
     * @param timeout Connection request and response timeout
     * @throws IOException on transport errors, non-2xx status or a non-JSON body
     */
    public static JsonNode getJson(String url, Map<String, String> headers, Duration timeout) throws IOException {
        RequestConfig config = RequestConfig.custom()
            .setConnectionRequestTimeout(Timeout.of(timeout))
            .setResponseTimeout(Timeout.of(timeout))
            .build();

        try (CloseableHttpClient httpClient = HttpClients.custom().setDefaultRequestConfig(config).build()) {
            HttpGet request = new HttpGet(url);
            if (headers != null) {
                headers.forEach(request::addHeader);
            }

            try (CloseableHttpResponse response = httpClient.execute(request)) {
                int statusCode = response.getCode();
                HttpEntity entity = response.getEntity();
                String contentType = entity != null ? entity.getContentType() : null;

                String responseBody;
                try {
                    responseBody = entity != null ? EntityUtils.toString(entity) : "";
                } catch (ParseException e) {
                    throw new IOException("Failed to parse response", e);
                }

                if (statusCode < 200 || statusCode >= 300) {
                    logger.warn("HTTP request to {} failed with status {}", url, statusCode);
                    throw new IOException("HTTP request failed with status " + statusCode);
                }

                // A missing content type is still parsed as JSON
                if (contentType != null && !contentType.isEmpty()
                    && !contentType.toLowerCase().startsWith("application/json")) {
                    logger.warn("Expected JSON but received content-type: {}. URL: {}", contentType, url);
                    logResponseBodyPreview(responseBody);
                    throw new IOException("Expected JSON response but received: " + contentType);
                }

                try {
                    return objectMapper.readTree(responseBody);
                } catch (JsonProcessingException e) {
                    logger.warn("Failed to parse JSON. URL: {}", url);
                    logResponseBodyPreview(responseBody);
                    throw new IOException("Failed to parse JSON response: " + e.getOriginalMessage(), e);
                }
            }
        }
    }

    /**
     * Makes a GET request with query parameters and returns the response as JsonNode.
     */
    public static JsonNode getJson(String baseUrl, Map<String, String> params, Map<String, String> headers,
                                   Duration timeout) throws IOException {
        return getJson(withQuery(baseUrl, params), headers, timeout);
    }

    static String withQuery(String baseUrl, Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return baseUrl;
        }
        StringBuilder urlBuilder = new StringBuilder(baseUrl).append('?');
        for (Map.Entry<String, String> entry : params.entrySet()) {
            urlBuilder.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                .append('=')
                .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
                .append('&');
        }
        urlBuilder.setLength(urlBuilder.length() - 1);
        return urlBuilder.toString();
    }

    private static void logResponseBodyPreview(String responseBody) {
        String preview = responseBody.length() > MAX_LOG_BODY_LENGTH
            ? responseBody.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : responseBody;
        logger.warn("Response body preview: {}", preview);
    }
}
