package com.gitagent.server.gemini;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Gemini {@code generateContent} endpoint.
 *
 * Single-turn and text-only: one prompt in, the first candidate's text out. The model is
 * asked for JSON, but it tends to wrap it in a Markdown code fence, so fences are removed
 * before the text is returned.
 */
@Component
public class GeminiClient {

    private static final Logger log = LoggerFactory.getLogger(GeminiClient.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateResponse(List<Candidate> candidates) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Candidate(Content content) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Content(List<Part> parts) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Part(String text) {}

        /** Text of the first part of the first candidate, "" if the response has none. */
        String firstText() {
            if (candidates == null || candidates.isEmpty()) return "";
            Content content = candidates.get(0).content();
            if (content == null || content.parts() == null || content.parts().isEmpty()) return "";
            String text = content.parts().get(0).text();
            return text != null ? text : "";
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       model;
    private final String       baseUrl;
    private final Duration     requestTimeout;

    public GeminiClient(@Value("${gemini.api-key:}") String apiKey,
                        @Value("${gemini.model:gemini-2.5-flash}") String model,
                        @Value("${gemini.base-url:https://generativelanguage.googleapis.com/v1beta}") String baseUrl,
                        @Value("${gemini.request-timeout:30s}") Duration requestTimeout,
                        ObjectMapper objectMapper) {
        this.apiKey         = apiKey;
        this.model          = model;
        this.baseUrl        = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        if (!isConfigured()) {
            log.warn("GEMINI_API_KEY is not set. Assistant endpoints will return errors until it is configured.");
        }
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Send one text prompt and return the reply text with code fences stripped.
     *
     * @throws GeminiApiException if no key is configured, the API answers with a non-2xx
     *                            status, or the request fails in transport
     */
    public String generate(String prompt) {
        if (!isConfigured()) {
            throw new GeminiApiException("GEMINI_API_KEY environment variable is not set.");
        }
        try {
            String requestBody = json.writeValueAsString(Map.of(
                    "contents", List.of(Map.of("parts", List.of(Map.of("text", prompt))))
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/models/" + model + ":generateContent?key="
                            + URLEncoder.encode(apiKey, StandardCharsets.UTF_8)))
                    .timeout(requestTimeout)
                    .header("content-type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new GeminiApiException(response.statusCode(), response.body());
            }
            return parseResponse(response.body());

        } catch (IOException e) {
            throw new GeminiApiException("Gemini API request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeminiApiException("Gemini API request interrupted", e);
        }
    }

    // -------------------------------------------------------------------------
    // Package-private helpers (tested directly)
    // -------------------------------------------------------------------------

    String parseResponse(String body) throws JsonProcessingException {
        GenerateResponse parsed = json.readValue(body, GenerateResponse.class);
        return stripFences(parsed.firstText());
    }

    static String stripFences(String text) {
        return text.replace("```json", "").replace("```", "").strip();
    }

    // -------------------------------------------------------------------------
    // Exception type
    // -------------------------------------------------------------------------

    public static class GeminiApiException extends RuntimeException {
        private final int statusCode;

        public GeminiApiException(String message) {
            super(message);
            this.statusCode = -1;
        }

        public GeminiApiException(String message, Throwable cause) {
            super(message, cause);
            this.statusCode = -1;
        }

        public GeminiApiException(int statusCode, String body) {
            super("Gemini API error %d: %s".formatted(statusCode, body));
            this.statusCode = statusCode;
        }

        /** HTTP status returned by the API, or -1 if no response was received. */
        public int statusCode() { return statusCode; }
    }
}
