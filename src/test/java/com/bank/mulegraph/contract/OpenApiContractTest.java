package com.bank.mulegraph.contract;

import com.bank.mulegraph.config.TestAerospikeConfig;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Validates the published OpenAPI document so consumers notice schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
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
        DocumentContext json = JsonPath.parse(restTemplate.getForEntity("/v3/api-docs", String.class).getBody());
        Map<String, Object> paths = json.read("$.paths");

        assertThat(paths).containsKeys(
                "/api/v1/graph/status",
                "/api/v1/graph/batch",
                "/api/v1/graph/batch/cancel",
                "/api/v1/graph/accounts/{accountNumber}",
                "/api/v1/graph/accounts/{accountNumber}/proximity",
                "/api/v1/graph/communities/{communityId}/network",
                "/api/v1/evaluations");
    }

    @Test
    void openApiSpec_featureSchemas_haveRequiredFields() {
        DocumentContext json = JsonPath.parse(restTemplate.getForEntity("/v3/api-docs", String.class).getBody());

        Map<String, Object> featureProps = json.read("$.components.schemas.AccountFeatures.properties");
        assertThat(featureProps).containsKeys("communityId", "muleDensity", "distanceToMule",
                "nearestMuleId", "diversityRatio", "topCounterpartyShare");

        Map<String, Object> evalProps = json.read("$.components.schemas.TransactionRiskEvaluation.properties");
        assertThat(evalProps).containsKeys("snapshotGeneration", "source", "target", "riskSignals", "riskLevel");
    }

    @Test
    void unknownAccount_returns404WhileSnapshotEmpty() {
        ResponseEntity<String> response = restTemplate.getForEntity("/api/v1/graph/accounts/NOPE", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).contains("UNKNOWN_ACCOUNT");
    }
}
