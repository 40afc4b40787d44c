package com.pos.anomaly.contract;

import com.aerospike.client.AerospikeClient;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract test that validates the OpenAPI document structure.
 * Ensures all endpoints and critical schemas are present,
 * protecting consumers from accidental schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    // Replaces the real client, which connects to the cluster on construction
    @MockBean
    private AerospikeClient aerospikeClient;

    @Test
    void openApiDocs_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiDocs_containsAllEndpointPaths() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> paths = json.read("$.paths");

        // Analysis endpoints
        assertThat(paths).containsKey("/api/v1/analysis");
        assertThat(paths).containsKey("/api/v1/analysis/latest");
        assertThat(paths).containsKey("/api/v1/analysis/run");

        // Shift endpoints
        assertThat(paths).containsKey("/api/v1/shifts");
        assertThat(paths).containsKey("/api/v1/shifts/{shiftId}");
        assertThat(paths).containsKey("/api/v1/shifts/store/{storeId}");

        // Config endpoint
        assertThat(paths).containsKey("/api/v1/config/detection");
    }

    @Test
    void openApiDocs_containsCriticalSchemas() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKey("ShiftRecord");
        assertThat(schemas).containsKey("AnalysisRequest");
        assertThat(schemas).containsKey("AnalysisReport");
        assertThat(schemas).containsKey("ShiftAnalysis");
        assertThat(schemas).containsKey("AnomalyVerdict");
        assertThat(schemas).containsKey("StorePerformanceSummary");
    }

    @Test
    void openApiDocs_shiftAndReportSchemas_haveRequiredFields() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());

        Map<String, Object> shiftProps = json.read("$.components.schemas.ShiftRecord.properties");
        assertThat(shiftProps).containsKey("shiftId");
        assertThat(shiftProps).containsKey("storeId");
        assertThat(shiftProps).containsKey("openedAt");
        assertThat(shiftProps).containsKey("totalSales");

        Map<String, Object> reportProps = json.read("$.components.schemas.AnalysisReport.properties");
        assertThat(reportProps).containsKey("shifts");
        assertThat(reportProps).containsKey("storeSummaries");
        assertThat(reportProps).containsKey("ratioAnalyses");
        assertThat(reportProps).containsKey("rejectedRows");

        Map<String, Object> verdictProps = json.read("$.components.schemas.AnomalyVerdict.properties");
        assertThat(verdictProps).containsKey("statisticalAnomaly");
        assertThat(verdictProps).containsKey("hardRuleAnomaly");
        assertThat(verdictProps).containsKey("reasons");
    }
}
