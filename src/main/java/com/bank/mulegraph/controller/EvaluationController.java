package com.bank.mulegraph.controller;

import com.bank.mulegraph.model.TransactionRiskEvaluation;
import com.bank.mulegraph.service.TransactionRiskQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/evaluations")
@Tag(name = "Evaluations", description = "Graph-feature risk evaluation of a transfer between two accounts")
public class EvaluationController {

    private final TransactionRiskQueryService queryService;

    public EvaluationController(TransactionRiskQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping
    @Operation(summary = "Evaluate a transfer",
               description = "Returns graph features of both parties and the risk signals they raise. "
                       + "Accounts missing from the snapshot are reported with null features.")
    public ResponseEntity<TransactionRiskEvaluation> evaluate(@RequestParam String sourceAccount,
                                                              @RequestParam String targetAccount) {
        return ResponseEntity.ok(queryService.evaluateTransaction(sourceAccount, targetAccount));
    }
}
