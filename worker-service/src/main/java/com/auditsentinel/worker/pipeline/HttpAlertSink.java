package com.auditsentinel.worker.pipeline;

import com.auditsentinel.core.alerting.AlertDelivery;
import com.auditsentinel.core.alerting.AlertDeliveryException;
import com.auditsentinel.core.alerting.AlertSink;
import com.auditsentinel.core.model.Alert;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link AlertSink} posting each alert as JSON to {@code {api}/api/alerts}.
 *
 * <p>
 * A 2xx answer is parsed as {@code {"success": ..., "alert": {...}}}. Other
 * statuses, transport errors and unreadable bodies raise
 * {@link AlertDeliveryException}.
 * </p>
 *
 * @since 1.0.0
 */
public class HttpAlertSink implements AlertSink {

    private final HttpClient http;
    private final URI alertsUri;
    private final String serviceToken;
    private final Duration timeout;
    private final ObjectMapper mapper;

    public HttpAlertSink(HttpClient http, String apiBaseUrl, String serviceToken,
            Duration timeout, ObjectMapper mapper) {
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.alertsUri = URI.create(UploadedDataSource.stripTrailingSlash(
                Objects.requireNonNull(apiBaseUrl, "apiBaseUrl must not be null")) + "/api/alerts");
        this.serviceToken = serviceToken;
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public AlertDelivery postAlert(Alert alert) throws AlertDeliveryException {
        Objects.requireNonNull(alert, "alert must not be null");
        String body;
        try {
            body = mapper.writeValueAsString(alert);
        } catch (JsonProcessingException e) {
            throw new AlertDeliveryException("Failed to serialize alert '" + alert.getTitle() + "'", e);
        }

        HttpRequest.Builder request = HttpRequest.newBuilder(alertsUri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (serviceToken != null && !serviceToken.isBlank()) {
            request.header(UploadedDataSource.SERVICE_TOKEN_HEADER, serviceToken);
        }

        HttpResponse<String> response;
        try {
            response = http.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new AlertDeliveryException("Alert request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AlertDeliveryException("Interrupted while posting alert", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new AlertDeliveryException("Alert service answered HTTP " + status);
        }
        try {
            return mapper.readValue(response.body(), AlertDelivery.class);
        } catch (JsonProcessingException e) {
            throw new AlertDeliveryException("Malformed alert service response", e);
        }
    }

    public URI getAlertsUri() {
        return alertsUri;
    }
}
