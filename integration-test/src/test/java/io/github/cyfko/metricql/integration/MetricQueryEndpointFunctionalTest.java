package io.github.cyfko.metricql.integration;

import io.github.cyfko.MetricQueryController.CommandRequest;
import io.github.cyfko.MetricQueryController.ErrorResponse;
import io.github.cyfko.MetricQueryController.QueryResponse;
import io.github.cyfko.MetricQueryController.StructuredRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Functional tests of the metric query endpoints over HTTP.
 */
@SpringBootTest(
    classes = io.github.cyfko.Main.class,
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class MetricQueryEndpointFunctionalTest {

    @Autowired
    private TestRestTemplate restTemplate;

    private static HttpEntity<String> json(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    @Test
    void shouldCompileCommand() {
        // WHEN: a grouped command
        ResponseEntity<QueryResponse> response = restTemplate.postForEntity(
                "/api/v1/metrics/command",
                new CommandRequest("/query AGE -group inr method"),
                QueryResponse.class);

        // THEN
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertNotNull(response.getBody());
        assertTrue(response.getBody().query().contains("groupBy: INR_MODE"));
        assertTrue(response.getBody().query().contains("kpiGroup { kpi1: kpi { caseCount } groupedBy { groupItemName } }"));
    }

    @Test
    void structuredAndCommandFormsShouldAgree() {
        QueryResponse structured = restTemplate.postForObject(
                "/api/v1/metrics/query",
                new StructuredRequest(List.of("DTN"), "OR(STROKE==ICH, STROKE==TIA)", List.of("DTN:12:0:120"), true, null),
                QueryResponse.class);
        QueryResponse command = restTemplate.postForObject(
                "/api/v1/metrics/command",
                new CommandRequest("/query DTN -filter OR(STROKE==ICH, STROKE==TIA) -stats -distribution DTN:12:0:120"),
                QueryResponse.class);

        assertEquals(command.query(), structured.query());
    }

    @Test
    void shouldTranslateEntitiesWithExclusion() {
        // GIVEN: entities naming two stroke subtypes in an exclusion request
        String body = "{\"message\": \"door to needle excluding ICH and TIA\", \"entities\": ["
                + "{\"entity\": \"kpi\", \"value\": \"door to needle\"},"
                + "{\"entity\": \"stroke_type\", \"value\": \"ich\"},"
                + "{\"entity\": \"stroke_type\", \"value\": \"tia\"}]}";

        // WHEN
        ResponseEntity<QueryResponse> response = restTemplate.postForEntity(
                "/api/v1/metrics/entities", json(body), QueryResponse.class);

        // THEN: each subtype is negated on its own
        assertEquals(HttpStatus.OK, response.getStatusCode());
        String query = response.getBody().query();
        assertTrue(query.contains("children: [ { node: { logicalOperator: NOT, children: [ { leaf: { enumCaseFilter: { strokeType: { values: [INTRACEREBRAL_HEMORRHAGE]"));
        assertTrue(query.contains("{ node: { logicalOperator: NOT, children: [ { leaf: { enumCaseFilter: { strokeType: { values: [TRANSIENT_ISCHEMIC]"));
    }

    @Test
    void unknownKpiShouldReturnBadRequestWithHint() {
        ResponseEntity<ErrorResponse> response = restTemplate.postForEntity(
                "/api/v1/metrics/command", new CommandRequest("/query HAPPINESS"), ErrorResponse.class);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Unknown KPI/metric 'HAPPINESS'", response.getBody().error());
        assertTrue(response.getBody().hint().contains("DTN (aliases: DTN, door to needle"));
    }

    @Test
    void syntaxErrorShouldReturnBadRequest() {
        ResponseEntity<ErrorResponse> response = restTemplate.postForEntity(
                "/api/v1/metrics/command", new CommandRequest("/query DTN -filter AND()"), ErrorResponse.class);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Expected token IDENT, got RPAREN ')' at position 2", response.getBody().error());
    }

    @Test
    void notWithTwoOperandsShouldReturnBadRequest() {
        ResponseEntity<ErrorResponse> response = restTemplate.postForEntity(
                "/api/v1/metrics/command", new CommandRequest("/query DTN -filter AND(NOT(SEX==MALE, AGE>=50))"),
                ErrorResponse.class);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Expected token RPAREN, got COMMA ',' at position 7", response.getBody().error());
    }

    @Test
    void invalidDistributionShouldReturnBadRequest() {
        ResponseEntity<ErrorResponse> response = restTemplate.postForEntity(
                "/api/v1/metrics/command", new CommandRequest("/query DTN -distribution DTN:10:50:10"), ErrorResponse.class);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertTrue(response.getBody().error().startsWith("Invalid distribution spec 'DTN:10:50:10'"));
    }

    @Test
    void shouldDescribeAliasFamilies() {
        ResponseEntity<String> found = restTemplate.getForEntity("/api/v1/metrics/aliases/sex", String.class);
        ResponseEntity<String> missing = restTemplate.getForEntity("/api/v1/metrics/aliases/colour", String.class);

        assertEquals(HttpStatus.OK, found.getStatusCode());
        assertTrue(found.getBody().startsWith("MALE (aliases: MALE, m, man)"));
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
    }
}
