package com.auditsentinel.worker.pipeline;

import com.auditsentinel.core.alerting.AlertDelivery;
import com.auditsentinel.core.alerting.AlertDeliveryException;
import com.auditsentinel.core.model.Alert;
import com.auditsentinel.core.model.Severity;
import com.auditsentinel.worker.scheduler.MessageCodec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpAlertSinkTest {

    private final ObjectMapper mapper = MessageCodec.newObjectMapper();
    private StubApiServer api;
    private HttpAlertSink sink;

    @BeforeEach
    void setUp() throws Exception {
        api = new StubApiServer();
        sink = new HttpAlertSink(HttpClient.newHttpClient(), api.baseUrl(), "secret", Duration.ofSeconds(5), mapper);
    }

    @AfterEach
    void tearDown() {
        api.close();
    }

    @Test
    @DisplayName("Should post the alert as JSON and return the created alert")
    void shouldPostAlert() throws Exception {
        api.respond(201, "{\"success\":true,\"alert\":{\"id\":\"alert-1\"}}");

        AlertDelivery delivery = sink.postAlert(alert());

        assertThat(delivery.isSuccess()).isTrue();
        assertThat(delivery.getAlert()).containsEntry("id", "alert-1");
        StubApiServer.Request request = api.getRequests().get(0);
        assertThat(request.method).isEqualTo("POST");
        assertThat(request.path).isEqualTo("/api/alerts");
        assertThat(request.token).isEqualTo("secret");
        JsonNode body = mapper.readTree(request.body);
        assertThat(body.path("title").asText()).isEqualTo("MFA disabled");
        assertThat(body.path("analysisId").asText()).isEqualTo("analysis-1");
    }

    @Test
    @DisplayName("Should fail on a non-2xx answer")
    void shouldFailOnHttpError() {
        api.respond(500, "{\"error\":\"boom\"}");

        assertThatThrownBy(() -> sink.postAlert(alert()))
                .isInstanceOf(AlertDeliveryException.class)
                .hasMessageContaining("500");
    }

    @Test
    @DisplayName("Should fail on a malformed answer")
    void shouldFailOnMalformedAnswer() {
        api.respond(200, "<html>");

        assertThatThrownBy(() -> sink.postAlert(alert()))
                .isInstanceOf(AlertDeliveryException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should resolve the alerts endpoint below the base URL")
    void shouldBuildAlertsUri() {
        HttpAlertSink withSlash = new HttpAlertSink(HttpClient.newHttpClient(), "http://api:3000/", null,
                Duration.ofSeconds(1), mapper);

        assertThat(withSlash.getAlertsUri()).hasToString("http://api:3000/api/alerts");
    }

    private static Alert alert() {
        return Alert.builder()
                .title("MFA disabled")
                .description("MFA was disabled for a user")
                .severity(Severity.CRITICAL)
                .source("entra_audit_logs")
                .organizationId("org-1")
                .analysisId("analysis-1")
                .extractionId("ext-1")
                .build();
    }
}
