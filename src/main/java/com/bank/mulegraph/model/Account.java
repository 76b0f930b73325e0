package com.bank.mulegraph.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "An account node as read from the graph store")
public class Account {

    @Schema(description = "Stable internal account identifier", example = "835")
    private long accountId;

    @Schema(description = "Externally visible, unique account number", example = "ACC_CUST_835")
    private String accountNumber;

    @Builder.Default
    @Schema(description = "Labels attached to the account")
    private Set<AccountLabel> labels = EnumSet.noneOf(AccountLabel.class);

    public boolean isConfirmedMule() {
        return labels != null && labels.contains(AccountLabel.CONFIRMED_MULE);
    }
}
