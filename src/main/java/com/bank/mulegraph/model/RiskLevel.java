package com.bank.mulegraph.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public RiskLevel max(RiskLevel other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
