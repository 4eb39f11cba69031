package com.spreadsheet.engine.controllers;

import com.spreadsheet.engine.EngineApplication;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = EngineApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class WorkbookControllerIntegrationTest {

    @LocalServerPort
    int port;

    private final RestTemplate restTemplate = new RestTemplate();

    private String baseUrl() {
        return "http://localhost:" + port + "/workbook";
    }

    private long createWorkbook(String jsonBody) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<Long> response =
                restTemplate.postForEntity(baseUrl(), new HttpEntity<>(jsonBody, headers), Long.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertNotNull(response.getBody());
        return response.getBody();
    }

    private ResponseEntity<List> putCell(long workbookId, String sheet, String ref, String raw) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        String url = baseUrl() + "/" + workbookId + "/sheet/" + sheet + "/cell/" + ref;
        return restTemplate.exchange(url, HttpMethod.PUT, new HttpEntity<>(raw, headers), List.class);
    }

    @SuppressWarnings("unchecked")
    private Map<String, String> getSheet(long workbookId, String sheet) {
        return restTemplate.getForObject(baseUrl() + "/" + workbookId + "/sheet/" + sheet, Map.class);
    }

    /**
     * Creates a workbook, builds a small chain of formulas,
     * then reads back values and the dependency graphs.
     */
    @Test
    void testCreateWorkbookAndRecalculate() {
        long workbookId = createWorkbook("{\"sheets\": [\"Data\"]}");

        putCell(workbookId, "Data", "A1", "10");
        putCell(workbookId, "Data", "B1", "=A1+5");
        ResponseEntity<List> response = putCell(workbookId, "Data", "C1", "=B1*2");
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(List.of("C1"), response.getBody());

        Map<String, String> data = getSheet(workbookId, "Data");
        assertEquals("15", data.get("B1"));
        assertEquals("30", data.get("C1"));

        response = putCell(workbookId, "Data", "A1", "20");
        assertEquals(List.of("B1", "C1"), response.getBody());
        assertEquals("50", getSheet(workbookId, "Data").get("C1"));

        Map<?, ?> forward = restTemplate.getForObject(
                baseUrl() + "/" + workbookId + "/sheet/Data/forwardDependencies", Map.class);
        assertEquals(List.of("A1"), forward.get("B1"));
        Map<?, ?> reverse = restTemplate.getForObject(
                baseUrl() + "/" + workbookId + "/sheet/Data/reverseDependencies", Map.class);
        assertEquals(List.of("C1"), reverse.get("B1"));

        restTemplate.delete(baseUrl() + "/" + workbookId + "/sheet/Data/cell/C1");
        assertFalse(getSheet(workbookId, "Data").containsKey("C1"));
    }

    @Test
    void testErrorsMapToHttpStatus() {
        long workbookId = createWorkbook("{}");

        try {
            restTemplate.getForObject(baseUrl() + "/999999/sheet/Sheet1", Map.class);
            fail("Should have thrown for an unknown workbook!");
        } catch (HttpClientErrorException e) {
            assertEquals(HttpStatus.NOT_FOUND, e.getStatusCode());
            assertTrue(e.getResponseBodyAsString().contains("WORKBOOK_NOT_FOUND"));
        }

        try {
            putCell(workbookId, "Sheet1", "1A", "5");
            fail("Should have thrown for a malformed cell reference!");
        } catch (HttpClientErrorException e) {
            assertEquals(HttpStatus.BAD_REQUEST, e.getStatusCode());
            assertTrue(e.getResponseBodyAsString().contains("INVALID_CELL_REFERENCE"));
        }

        try {
            getSheet(workbookId, "Missing");
            fail("Should have thrown for an unknown sheet!");
        } catch (HttpClientErrorException e) {
            assertEquals(HttpStatus.NOT_FOUND, e.getStatusCode());
        }
    }

    @Test
    void testFormulaErrorsAreValuesNotFailures() {
        long workbookId = createWorkbook("{}");

        ResponseEntity<List> response = putCell(workbookId, "Sheet1", "A1", "=1/0");
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("#DIV/0!", getSheet(workbookId, "Sheet1").get("A1"));
    }

    @Test
    void testArrayFormulaSpills() {
        long workbookId = createWorkbook("{}");
        putCell(workbookId, "Sheet1", "A1", "{=SEQUENCE(2,2)}");

        Map<String, String> data = getSheet(workbookId, "Sheet1");
        assertEquals("1", data.get("A1"));
        assertEquals("2", data.get("B1"));
        assertEquals("3", data.get("A2"));
        assertEquals("4", data.get("B2"));

        List<?> spills = restTemplate.getForObject(
                baseUrl() + "/" + workbookId + "/sheet/Sheet1/spills", List.class);
        assertEquals(1, spills.size());
        assertEquals("A1", ((Map<?, ?>) spills.get(0)).get("sourceCell"));
    }

    @Test
    void testNamedRangeOverHttp() {
        long workbookId = createWorkbook("{}");
        putCell(workbookId, "Sheet1", "B1", "4");
        putCell(workbookId, "Sheet1", "B2", "6");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        restTemplate.exchange(baseUrl() + "/" + workbookId + "/namedRange/Totals",
                HttpMethod.PUT, new HttpEntity<>("B1:B2", headers), Void.class);
        putCell(workbookId, "Sheet1", "C1", "=SUM(Totals)");

        assertEquals("10", getSheet(workbookId, "Sheet1").get("C1"));
        Map<?, ?> names = restTemplate.getForObject(baseUrl() + "/" + workbookId + "/namedRange", Map.class);
        assertEquals("B1:B2", names.get("Totals"));

        try {
            restTemplate.exchange(baseUrl() + "/" + workbookId + "/namedRange/SUM",
                    HttpMethod.PUT, new HttpEntity<>("B1:B2", headers), Void.class);
            fail("Should have rejected a function name!");
        } catch (HttpClientErrorException e) {
            assertEquals(HttpStatus.BAD_REQUEST, e.getStatusCode());
        }
    }

    @Test
    void testPivotEndpoint() {
        long workbookId = createWorkbook("{}");
        String[][] rows = {
                {"Region", "Sales"},
                {"East", "100"},
                {"West", "150"},
                {"East", "200"}
        };
        for (int r = 0; r < rows.length; r++) {
            putCell(workbookId, "Sheet1", "A" + (r + 1), rows[r][0]);
            putCell(workbookId, "Sheet1", "B" + (r + 1), rows[r][1]);
        }

        String body = "{\n" +
                "  \"id\": \"byRegion\",\n" +
                "  \"sourceRange\": \"A1:B4\",\n" +
                "  \"rowFields\": [\"Region\"],\n" +
                "  \"valueFields\": [{\"field\": \"Sales\", \"aggregation\": \"sum\"}],\n" +
                "  \"showGrandTotals\": true\n" +
                "}";
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        Map<?, ?> result = restTemplate.postForObject(baseUrl() + "/" + workbookId + "/pivot",
                new HttpEntity<>(body, headers), Map.class);

        assertEquals(List.of("Region", "Sales (SUM)"), result.get("headers"));
        assertEquals(List.of(
                List.of("East", "300"),
                List.of("West", "150"),
                List.of("Grand Total", "450")
        ), result.get("rows"));

        String badBody = "{\"sourceRange\": \"A1:B4\", \"rowFields\": [\"Country\"], "
                + "\"valueFields\": [{\"field\": \"Sales\"}]}";
        try {
            restTemplate.postForObject(baseUrl() + "/" + workbookId + "/pivot",
                    new HttpEntity<>(badBody, headers), Map.class);
            fail("Should have rejected an unknown field!");
        } catch (HttpClientErrorException e) {
            assertEquals(HttpStatus.BAD_REQUEST, e.getStatusCode());
            assertTrue(e.getResponseBodyAsString().contains("INVALID_PIVOT_CONFIG"));
        }
    }

    @Test
    void testExportAndImport() {
        long workbookId = createWorkbook("{\"sheets\": [\"Data\", \"Summary\"]}");
        putCell(workbookId, "Data", "A1", "7");
        putCell(workbookId, "Summary", "A1", "=Data!A1*3");

        String text = restTemplate.getForObject(baseUrl() + "/" + workbookId + "/export", String.class);
        assertNotNull(text);
        assertTrue(text.startsWith("---\n"));
        assertTrue(text.contains("sheet1Name: \"Summary\""));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        Long copyId = restTemplate.postForObject(baseUrl() + "/import", new HttpEntity<>(text, headers), Long.class);
        assertNotNull(copyId);
        assertNotEquals(workbookId, copyId.longValue());
        assertEquals("21", getSheet(copyId, "Summary").get("A1"));
    }
}
