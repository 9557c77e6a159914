package com.pharmacy.fraud.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Validates the published OpenAPI document so consumers notice endpoint or schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        DocumentContext json = apiDocs();
        Map<String, Object> paths = json.read("$.paths");

        // Ranking endpoints
        assertThat(paths).containsKey("/api/v1/rankings/run");
        assertThat(paths).containsKey("/api/v1/rankings/aggregate");
        assertThat(paths).containsKey("/api/v1/rankings/detectors");

        // Config endpoints
        assertThat(paths).containsKey("/api/v1/config/weights");
        assertThat(paths).containsKey("/api/v1/config/thresholds");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        DocumentContext json = apiDocs();
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKeys("RankingRun", "AggregateResult", "RunSummary", "Finding",
                "ClaimRecord", "RankingRequest", "AggregationRequest");
    }

    @Test
    void aggregateResultSchema_hasScoreFields() {
        DocumentContext json = apiDocs();
        Map<String, Object> properties = json.read("$.components.schemas.AggregateResult.properties");

        assertThat(properties).containsKeys("entityId", "weightedScore", "consistencyScore", "outlierScore",
                "finalScore", "riskLevel", "rank", "explanation", "contributingDetectors");
    }

    @Test
    void riskLevelEnum_listsAllBuckets() {
        DocumentContext json = apiDocs();
        List<String> levels = json.read("$.components.schemas.AggregateResult.properties.riskLevel.enum");

        assertThat(levels).containsExactly("HIGH", "MEDIUM", "LOW", "VERY_LOW");
    }

    private DocumentContext apiDocs() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        return JsonPath.parse(response.getBody());
    }
}
