package com.gnovoa.publeague;

import static org.assertj.core.api.AssertionsForClassTypes.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.resttestclient.autoconfigure.AutoConfigureRestTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.client.RestTestClient;

/** Basic integration tests */
@ActiveProfiles("integrationTest")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureRestTestClient
class PubLeagueSchedulerApplicationTests {

  @Autowired private RestTestClient restTestClient;

  @Test
  @DisplayName("Should verify health endpoint returns UP")
  void healthEndpointReturnsUp() {
    restTestClient
        .get()
        .uri("/actuator/health")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.status")
        .isEqualTo("UP");
  }

  @Test
  @DisplayName("Should verify Swagger UI HTML page loads")
  void swaggerUiIsReachable() {
    restTestClient
        .get()
        .uri("/swagger-ui/index.html")
        .exchange()
        .expectStatus()
        .isOk()
        .expectHeader()
        .contentTypeCompatibleWith("text/html")
        .expectBody(String.class)
        .consumeWith(
            result -> {
              String body = result.getResponseBody();
              assertThat(body).isNotNull();
              assertThat(body).containsIgnoringCase("swagger ui");
            });
  }

  @Test
  @DisplayName("Should verify OpenAPI JSON spec is available")
  void openApiSpecShouldBeAvailable() {
    restTestClient
        .get()
        .uri("/v3/api-docs")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.openapi")
        .exists()
        .jsonPath("$.info.title")
        .isNotEmpty()
        .jsonPath("$.paths['/api/divisions/{divisionId}/schedule/generate']")
        .exists();
  }

  @Test
  @DisplayName("Generate, preview, audit and commit a premier season over HTTP")
  void generatePreviewCommit() {
    restTestClient
        .post()
        .uri("/api/divisions/premier/schedule/generate")
        .contentType(MediaType.APPLICATION_JSON)
        .body(Map.of("startDate", "2025-03-02"))
        .exchange()
        .expectStatus()
        .isCreated()
        .expectBody()
        .jsonPath("$.acceptable")
        .isEqualTo(true)
        .jsonPath("$.preview.totalRows")
        .isEqualTo(96);

    restTestClient
        .get()
        .uri("/api/divisions/premier/schedule/preview")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.weeks.length()")
        .isEqualTo(12)
        .jsonPath("$.weeks[0].entries[0].homeTeam")
        .isEqualTo("Ballard FC")
        .jsonPath("$.weeks[0].entries[0].time")
        .isEqualTo("08:20:00")
        .jsonPath("$.weeks[8].label")
        .isEqualTo("Fun Week");

    restTestClient
        .get()
        .uri("/api/divisions/premier/schedule/audit")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.totalMatches")
        .isEqualTo(56)
        .jsonPath("$.c1DoubleRoundRobin")
        .isEqualTo(true);

    // No body and no ids: every uncommitted row of the division.
    restTestClient
        .post()
        .uri("/api/divisions/premier/schedule/commit")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.affected")
        .isEqualTo(96);

    restTestClient
        .get()
        .uri("/api/divisions/premier/schedule/preview")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.totalRows")
        .isEqualTo(0);
  }

  @Test
  void deleteRemovesUncommittedClassicRows() {
    restTestClient
        .post()
        .uri("/api/divisions/classic/schedule/generate")
        .contentType(MediaType.APPLICATION_JSON)
        .body(Map.of("startDate", "2025-03-02", "withPractice", true))
        .exchange()
        .expectStatus()
        .isCreated();

    restTestClient
        .delete()
        .uri("/api/divisions/classic/schedule")
        .exchange()
        .expectStatus()
        .isOk()
        .expectBody()
        .jsonPath("$.affected")
        .isEqualTo(36);

    restTestClient
        .get()
        .uri("/api/divisions/classic/schedule/preview")
        .exchange()
        .expectBody()
        .jsonPath("$.totalRows")
        .isEqualTo(0);
  }

  @Test
  void unknownDivisionIsNotFound() {
    restTestClient
        .get()
        .uri("/api/divisions/womens/schedule/preview")
        .exchange()
        .expectStatus()
        .isNotFound()
        .expectBody()
        .jsonPath("$.error")
        .isEqualTo("DIVISION_NOT_FOUND");
  }

  @Test
  void blankWeekTypeIsRejected() {
    Map<String, Object> body =
        Map.of("weeks", List.of(Map.of("date", "2025-03-02", "weekType", "", "weekOrder", 1)));

    restTestClient
        .post()
        .uri("/api/divisions/premier/schedule/generate")
        .contentType(MediaType.APPLICATION_JSON)
        .body(body)
        .exchange()
        .expectStatus()
        .isBadRequest()
        .expectBody()
        .jsonPath("$.error")
        .isEqualTo("VALIDATION_ERROR");
  }

  @Test
  void missingStartDateIsBadRequest() {
    restTestClient
        .post()
        .uri("/api/divisions/classic/schedule/generate")
        .contentType(MediaType.APPLICATION_JSON)
        .body(Map.of())
        .exchange()
        .expectStatus()
        .isBadRequest()
        .expectBody()
        .jsonPath("$.error")
        .isEqualTo("MISSING_START_DATE");
  }
}
