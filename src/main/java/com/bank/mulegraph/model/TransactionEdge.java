package com.bank.mulegraph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Directed transaction: performer sends {@code amount} to beneficiary.
 * Several edges may connect the same pair.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionEdge {

    private String txnId;

    private long performerId;

    @Builder.Default
    private ParticipantType performerType = ParticipantType.ACCOUNT;

    private long beneficiaryId;

    @Builder.Default
    private ParticipantType beneficiaryType = ParticipantType.ACCOUNT;

    private double amount;

    private long timestamp;

    /** True when both ends are accounts. */
    public boolean isAccountToAccount() {
        return performerType == ParticipantType.ACCOUNT && beneficiaryType == ParticipantType.ACCOUNT;
    }

    public boolean touches(long accountId) {
        return (performerType == ParticipantType.ACCOUNT && performerId == accountId)
                || (beneficiaryType == ParticipantType.ACCOUNT && beneficiaryId == accountId);
    }
}
