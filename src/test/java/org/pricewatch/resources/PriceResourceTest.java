package org.pricewatch.resources;

import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.pricewatch.PricewatchConfiguration;
import org.pricewatch.ScriptedPricewatchApplication;
import org.pricewatch.ScriptedQueryEngine;
import org.pricewatch.dto.ApiError;
import org.pricewatch.dto.PriceResponse;
import org.pricewatch.dto.PriceRow;
import org.pricewatch.engine.JobState;

import javax.ws.rs.client.WebTarget;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

// Full application over HTTP with a scripted engine behind it
@ExtendWith(DropwizardExtensionsSupport.class)
class PriceResourceTest {

    private static final DropwizardAppExtension<PricewatchConfiguration> APP = new DropwizardAppExtension<>(
            ScriptedPricewatchApplication.class,
            ResourceHelpers.resourceFilePath("test-config.yml"));

    private static final ScriptedQueryEngine ENGINE = ScriptedPricewatchApplication.ENGINE;

    private static final List<String> HEADER = List.of("date", "price_usd", "volume_usd");

    @BeforeEach
    void setUp() {
        ENGINE.reset();
    }

    private static WebTarget target(String path) {
        return APP.client().target(String.format("http://localhost:%d%s", APP.getLocalPort(), path));
    }

    @Test
    void testGetCrypto_SucceedsAfterTwoPolls() {
        // Given
        ENGINE.script(List.of(JobState.RUNNING, JobState.SUCCEEDED), List.of(
                HEADER,
                List.of("2024-01-01", "42000.5", "1000000"),
                List.of("2024-01-02", "42500", "1100000"),
                List.of("2024-01-03", "43000.25", "1200000")));

        // When
        Response response = target("/crypto").queryParam("days", "30").request().get();

        // Then
        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getMediaType().isCompatible(MediaType.APPLICATION_JSON_TYPE)).isTrue();
        assertThat(response.getHeaderString("Access-Control-Allow-Origin")).isEqualTo("*");

        PriceResponse body = response.readEntity(PriceResponse.class);
        assertThat(body.getData()).containsExactly(
                new PriceRow("2024-01-01", 42000.5, 1_000_000),
                new PriceRow("2024-01-02", 42500, 1_100_000),
                new PriceRow("2024-01-03", 43000.25, 1_200_000));

        assertThat(ENGINE.statusChecks()).isEqualTo(2);
        assertThat(ENGINE.submittedQueries()).hasSize(1);
        assertThat(ENGINE.submittedQueries().get(0)).contains("date_add('day', -30, current_date)");
    }

    @Test
    void testGetCrypto_JsonUsesSnakeCaseFields() {
        ENGINE.script(List.of(JobState.SUCCEEDED), List.of(HEADER, List.of("2024-01-01", "1.5", "2")));

        String json = target("/crypto").queryParam("days", "7").request().get(String.class);

        assertThat(json).isEqualTo("{\"data\":[{\"date\":\"2024-01-01\",\"price_usd\":1.5,\"volume_usd\":2.0}]}");
    }

    @Test
    void testGetCrypto_NoDaysUsesDefaultRange() {
        ENGINE.script(List.of(JobState.SUCCEEDED), List.of(HEADER));

        Response response = target("/crypto").request().get();

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.readEntity(PriceResponse.class).getData()).isEmpty();
        assertThat(ENGINE.submittedQueries()).hasSize(1);
        assertThat(ENGINE.submittedQueries().get(0)).contains("-90,");
    }

    @Test
    void testGetCrypto_SubmissionFailureIs500WithoutRetry() {
        ENGINE.failSubmission("AccessDeniedException: not authorized");

        Response response = target("/crypto").queryParam("days", "30").request().get();

        assertThat(response.getStatus()).isEqualTo(500);
        ApiError error = response.readEntity(ApiError.class);
        assertThat(error.getError()).isNotBlank().contains("AccessDeniedException");
        assertThat(ENGINE.submits()).isEqualTo(1);
        assertThat(ENGINE.statusChecks()).isZero();
    }

    @Test
    void testGetCrypto_FailedJobIs500WithReason() {
        ENGINE.script(List.of(JobState.RUNNING, JobState.FAILED), List.of(HEADER));

        Response response = target("/crypto").queryParam("days", "7").request().get();

        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(response.readEntity(ApiError.class).getError())
                .isEqualTo("Query failed: FAILED: scripted failure");
        assertThat(ENGINE.statusChecks()).isEqualTo(2);
        assertThat(ENGINE.fetches()).isZero();
    }

    @Test
    void testGetCrypto_StuckJobTimesOut() {
        ENGINE.script(List.of(JobState.RUNNING), List.of(HEADER));

        Response response = target("/crypto").queryParam("days", "7").request().get();

        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(response.readEntity(ApiError.class).getError()).startsWith("Query timed out");
        assertThat(ENGINE.fetches()).isZero();
    }

    @Test
    void testGetCrypto_ClientAbortStopsPollingAtDeadline() throws Exception {
        // Given: a job that never finishes
        ENGINE.script(List.of(JobState.RUNNING), List.of(HEADER));

        // When: the client sends the request and hangs up before any answer
        try (Socket socket = new Socket("localhost", APP.getLocalPort())) {
            OutputStream out = socket.getOutputStream();
            out.write("GET /crypto?days=7 HTTP/1.1\r\nHost: localhost\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
            out.flush();
            Thread.sleep(300);
        }

        // Then: status checks stop once the 2 s poll deadline passes
        long giveUp = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        int previous = -1;
        int current = ENGINE.statusChecks();
        while (current != previous && System.nanoTime() < giveUp) {
            previous = current;
            Thread.sleep(500);
            current = ENGINE.statusChecks();
        }
        assertThat(current).isPositive().isEqualTo(previous);
        assertThat(ENGINE.fetches()).isZero();

        // and the worker is free for the next request
        ENGINE.reset();
        ENGINE.script(List.of(JobState.SUCCEEDED), List.of(HEADER));
        assertThat(target("/crypto").queryParam("days", "7").request().get().getStatus()).isEqualTo(200);
    }

    @Test
    void testOptions_PreflightAllowed() {
        Response response = target("/crypto").request().options();

        assertThat(response.getStatus()).isEqualTo(204);
        assertThat(response.getHeaderString("Access-Control-Allow-Origin")).isEqualTo("*");
        assertThat(response.getHeaderString("Access-Control-Allow-Methods")).contains("GET");
        assertThat(ENGINE.submits()).isZero();
    }

    @Test
    void testUnknownPath_Is404Json() {
        Response response = target("/nope").request().get();

        assertThat(response.getStatus()).isEqualTo(404);
        assertThat(response.readEntity(ApiError.class).getError()).isEqualTo("URL not found");
    }
}
