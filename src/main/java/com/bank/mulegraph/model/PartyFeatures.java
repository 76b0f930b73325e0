package com.bank.mulegraph.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Features of one side of an evaluated transaction")
public class PartyFeatures {

    @Schema(description = "Account number as requested", example = "ACC_CUST_835")
    private String accountNumber;

    @Schema(description = "False when the account is absent from the current snapshot")
    private boolean known;

    @Schema(description = "Whether the account is a confirmed mule")
    private boolean confirmedMule;

    @Schema(description = "Feature values; every field is null when the account is unknown")
    private AccountFeatures features;

    @Schema(description = "Where the diversity fields came from")
    private DiversitySource diversitySource;
}
