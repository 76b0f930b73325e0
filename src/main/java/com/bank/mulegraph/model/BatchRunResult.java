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
@Schema(description = "Outcome of one batch feature computation run")
public class BatchRunResult {

    @Schema(description = "Generation committed by this run; null unless COMPLETED", example = "7")
    private Long generation;

    private BatchStatus status;

    private int accountCount;

    private int transactionEdgeCount;

    private int projectedEdgeCount;

    private int communityCount;

    @Schema(description = "False when community detection hit its pass or level limit")
    private boolean convergenceReached;

    private List<String> warnings;

    private String errorMessage;

    private long startedAt;

    private long durationMs;
}
