package com.labpulse.driver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.labpulse.model.DriverCredentials;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for drivers that talk HTTP to their service.
 */
public abstract class AbstractHttpDriver implements Driver {

    protected final long integrationId;
    protected final DriverCredentials credentials;
    protected final HttpClient httpClient;
    protected final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    protected AbstractHttpDriver(long integrationId, DriverCredentials credentials, DriverContext context, Duration requestTimeout) {
        this.integrationId = integrationId;
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.httpClient = Objects.requireNonNull(context, "context").httpClient();
        this.objectMapper = context.objectMapper();
        this.requestTimeout = requestTimeout;
        if (credentials.baseUrl().isBlank()) {
            throw new MissingCredentialsException(getClass().getSimpleName() + " requires a url");
        }
    }

    @Override
    public long getIntegrationId() {
        return integrationId;
    }

    protected String getText(String path, Map<String, String> headers) {
        HttpRequest.Builder builder = newRequest(path, headers).GET();
        return send(builder.build(), path);
    }

    protected JsonNode getJson(String path, Map<String, String> headers) {
        return parseJson(getText(path, headers), path);
    }

    protected JsonNode postJson(String path, Object body, Map<String, String> headers) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body is not serializable", e);
        }
        HttpRequest.Builder builder = newRequest(path, headers)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
        return parseJson(send(builder.build(), path), path);
    }

    protected static String basicAuth(String username, String password) {
        String raw = (username == null ? "" : username) + ":" + (password == null ? "" : password);
        return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    private HttpRequest.Builder newRequest(String path, Map<String, String> headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(credentials.baseUrl() + path))
                .timeout(requestTimeout);
        if (headers != null) {
            headers.forEach(builder::header);
        }
        return builder;
    }

    private String send(HttpRequest request, String path) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new DriverException(getDisplayName() + " request failed: " + path + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DriverException(getDisplayName() + " request interrupted: " + path, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String body = response.body();
            String details = body == null || body.isBlank() ? "" : ": " + abbreviate(body);
            throw new DriverException(getDisplayName() + " returned HTTP " + status + " for " + path + details);
        }
        return response.body();
    }

    private JsonNode parseJson(String text, String path) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new DriverException(getDisplayName() + " returned invalid JSON for " + path, e);
        }
    }

    private static String abbreviate(String text) {
        String trimmed = text.trim();
        return trimmed.length() <= 200 ? trimmed : trimmed.substring(0, 200) + "...";
    }
}
