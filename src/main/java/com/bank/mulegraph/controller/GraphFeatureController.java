package com.bank.mulegraph.controller;

import com.bank.mulegraph.model.AccountFeatures;
import com.bank.mulegraph.model.BatchRunResult;
import com.bank.mulegraph.model.CommunityNetwork;
import com.bank.mulegraph.model.ProximityResult;
import com.bank.mulegraph.service.FeatureSnapshot;
import com.bank.mulegraph.service.FeatureStore;
import com.bank.mulegraph.service.GraphFeatureBatchService;
import com.bank.mulegraph.service.TransactionRiskQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/graph")
@Tag(name = "Graph Features", description = "Batch-computed community, proximity and diversity features per account")
public class GraphFeatureController {

    private final FeatureStore featureStore;
    private final GraphFeatureBatchService batchService;
    private final TransactionRiskQueryService queryService;

    public GraphFeatureController(FeatureStore featureStore,
                                  GraphFeatureBatchService batchService,
                                  TransactionRiskQueryService queryService) {
        this.featureStore = featureStore;
        this.batchService = batchService;
        this.queryService = queryService;
    }

    @GetMapping("/status")
    @Operation(summary = "Get feature snapshot status",
               description = "Returns the live snapshot generation, its size and warnings, and the last batch run result")
    public ResponseEntity<Map<String, Object>> getStatus() {
        FeatureSnapshot snapshot = featureStore.current();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("isReady", !snapshot.isEmpty());
        response.put("generation", snapshot.getGeneration());
        response.put("createdAt", snapshot.getCreatedAt().toString());
        response.put("accountCount", snapshot.accountCount());
        response.put("warnings", snapshot.getWarnings());
        response.put("batchRunning", batchService.isRunning());
        response.put("lastBatchResult", batchService.getLastResult());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/batch")
    @Operation(summary = "Run the feature batch now",
               description = "Recomputes all features synchronously and returns the run result. 409 if a run is in progress.")
    public ResponseEntity<BatchRunResult> runBatch() {
        return ResponseEntity.ok(batchService.runBatch());
    }

    @PostMapping("/batch/cancel")
    @Operation(summary = "Cancel the running batch",
               description = "Asks the in-flight run to stop at its next checkpoint; the live snapshot is kept")
    public ResponseEntity<Map<String, Object>> cancelBatch() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("cancellationRequested", batchService.cancel());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/accounts/{accountNumber}")
    @Operation(summary = "Get cached account features",
               description = "Returns the account's features from the live snapshot. 404 if the account is not in it.")
    public ResponseEntity<AccountFeatures> getAccountFeatures(@PathVariable String accountNumber) {
        return ResponseEntity.ok(queryService.getAccountFeatures(accountNumber));
    }

    @GetMapping("/accounts/{accountNumber}/proximity")
    @Operation(summary = "Compute proximity to mules on demand",
               description = "Searches outward from the account for the nearest confirmed mules and returns one path")
    public ResponseEntity<ProximityResult> getProximity(@PathVariable String accountNumber) {
        return ResponseEntity.ok(queryService.computeProximityForAccount(accountNumber));
    }

    @GetMapping("/communities/{communityId}/network")
    @Operation(summary = "Get community network",
               description = "Returns community members and the projected edges among them for visualization")
    public ResponseEntity<CommunityNetwork> getCommunityNetwork(@PathVariable int communityId) {
        CommunityNetwork network = queryService.getCommunityNetwork(communityId);
        if (network == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(network);
    }
}
