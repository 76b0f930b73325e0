package com.bank.mulegraph.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-account graph features of one snapshot generation. Every feature is null until computed.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Graph-derived features of one account")
public class AccountFeatures {

    @Schema(description = "Stable internal account identifier", example = "835")
    private Long accountId;

    @Schema(description = "Account number", example = "ACC_CUST_835")
    private String accountNumber;

    @Schema(description = "Community id assigned by modularity optimization", example = "12")
    private Integer communityId;

    @Schema(description = "Number of accounts in the community", example = "40")
    private Integer communitySize;

    @Schema(description = "Number of confirmed mules in the community", example = "6")
    private Integer muleCount;

    @Schema(description = "muleCount / communitySize rounded to 4 decimals", example = "0.15")
    private Double muleDensity;

    @Schema(description = "Hops to the nearest confirmed mule; null when none within max depth", example = "2")
    private Integer distanceToMule;

    @Schema(description = "Account id of the nearest confirmed mule", example = "55937")
    private Long nearestMuleId;

    @Schema(description = "Account number of the nearest confirmed mule", example = "ACC_MULE_55937")
    private String nearestMuleAccountNumber;

    @Schema(description = "All confirmed mules tied at the minimal distance, by account number")
    private List<String> tiedMuleAccountNumbers;

    @Schema(description = "Distinct accounts transacted with", example = "4")
    private Integer uniqueCounterparties;

    @Schema(description = "Transactions sent or received with other accounts", example = "60")
    private Integer totalTransactions;

    @Schema(description = "uniqueCounterparties / totalTransactions (0 when no transactions)", example = "0.0667")
    private Double diversityRatio;

    @Schema(description = "Share of transactions with the most frequent counterparty", example = "0.8")
    private Double topCounterpartyShare;
}
