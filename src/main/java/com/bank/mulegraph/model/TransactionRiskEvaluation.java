package com.bank.mulegraph.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Graph features of both parties to a transfer, with derived risk signals")
public class TransactionRiskEvaluation {

    @Schema(description = "Feature snapshot generation the cached features were read from", example = "7")
    private long snapshotGeneration;

    private PartyFeatures source;

    private PartyFeatures target;

    @Schema(description = "Human-readable signals that raised the risk level")
    private List<String> riskSignals;

    @Schema(description = "Highest risk level among the signals", example = "HIGH")
    private RiskLevel riskLevel;

    @Schema(description = "Evaluation timestamp in epoch milliseconds", example = "1739886764000")
    private long evaluatedAt;
}
