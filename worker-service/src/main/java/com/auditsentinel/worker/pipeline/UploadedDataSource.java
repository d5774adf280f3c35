package com.auditsentinel.worker.pipeline;

import com.auditsentinel.core.model.AuditRecord;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Fetches records uploaded through the API:
 * {@code GET {api}/api/upload/data/{extractionId}} answering
 * {@code {"success": true, "data": [...]}}.
 *
 * <p>
 * Requests carry the service token in the {@value #SERVICE_TOKEN_HEADER}
 * header. Any non-200 status, transport error or unsuccessful body is
 * reported as {@link AuditDataException} so a fallback source can take over.
 * </p>
 *
 * @since 1.0.0
 */
public class UploadedDataSource implements AuditDataSource {

    private static final Logger LOG = LoggerFactory.getLogger(UploadedDataSource.class);

    public static final String SERVICE_TOKEN_HEADER = "x-service-token";

    private final HttpClient http;
    private final String apiBaseUrl;
    private final String serviceToken;
    private final Duration timeout;
    private final ObjectMapper mapper;

    public UploadedDataSource(HttpClient http, String apiBaseUrl, String serviceToken,
            Duration timeout, ObjectMapper mapper) {
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.apiBaseUrl = stripTrailingSlash(Objects.requireNonNull(apiBaseUrl, "apiBaseUrl must not be null"));
        this.serviceToken = serviceToken;
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public List<AuditRecord> load(String extractionId) throws AuditDataException {
        Objects.requireNonNull(extractionId, "extractionId must not be null");
        URI uri = URI.create(apiBaseUrl + "/api/upload/data/"
                + URLEncoder.encode(extractionId, StandardCharsets.UTF_8));
        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        if (serviceToken != null && !serviceToken.isBlank()) {
            request.header(SERVICE_TOKEN_HEADER, serviceToken);
        }

        HttpResponse<String> response;
        try {
            response = http.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new AuditDataException("Uploaded data request failed for extraction " + extractionId
                    + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuditDataException("Interrupted while fetching uploaded data for extraction " + extractionId, e);
        }

        if (response.statusCode() != 200) {
            throw new AuditDataException("Upload service answered HTTP " + response.statusCode()
                    + " for extraction " + extractionId);
        }
        UploadedData body;
        try {
            body = mapper.readValue(response.body(), UploadedData.class);
        } catch (JsonProcessingException e) {
            throw new AuditDataException("Malformed upload response for extraction " + extractionId, e);
        }
        if (!body.success || body.data == null) {
            throw new AuditDataException("No uploaded data for extraction " + extractionId);
        }
        LOG.info("Fetched {} uploaded record(s) for extraction {}", body.data.size(), extractionId);
        return body.data;
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Response body of the upload endpoint.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class UploadedData {
        private final boolean success;
        private final List<AuditRecord> data;

        @JsonCreator
        UploadedData(@JsonProperty("success") boolean success,
                @JsonProperty("data") List<AuditRecord> data) {
            this.success = success;
            this.data = data;
        }
    }
}
