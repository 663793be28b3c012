package com.whereq.tessera.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@AutoConfigureWebTestClient(timeout = "PT30S")
class QueryControllerTest {

    @Autowired
    private WebTestClient client;

    private WebTestClient.ResponseSpec validate(Map<String, Object> body) {
        return client.post().uri("/api/v1/queries/validate")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .exchange();
    }

    @Test
    void validSelectComesBackWithPlan() {
        validate(Map.of("queryText", "SELECT 42 AS answer", "engineId", "embedded"))
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.engineId").isEqualTo("duckdb")
            .jsonPath("$.valid").isEqualTo(true)
            .jsonPath("$.queryType").isEqualTo("SELECT")
            .jsonPath("$.planText").isNotEmpty()
            .jsonPath("$.errors.length()").isEqualTo(0);
    }

    @Test
    void missingTableIsAnInvalidVerdictNotAnError() {
        validate(Map.of("queryText", "SELECT * FROM no_such_table_for_validation"))
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.engineId").isEqualTo("duckdb")
            .jsonPath("$.valid").isEqualTo(false)
            .jsonPath("$.errors[0]").value(message -> assertThat((String) message)
                .contains("no_such_table_for_validation"))
            .jsonPath("$.errorKind").doesNotExist();
    }

    @Test
    void unknownEngineIsBadRequest() {
        validate(Map.of("queryText", "SELECT 1", "engineId", "snowflake"))
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.errorKind").isEqualTo("UNKNOWN_ENGINE")
            .jsonPath("$.errorMessage").isEqualTo("Unknown engine: snowflake");
    }

    @Test
    void missingQueryTextIsBadRequest() {
        validate(Map.of("engineId", "duckdb"))
            .expectStatus().isBadRequest();
    }
}
