package com.bank.mulegraph.model;

public enum BatchStatus {
    COMPLETED,
    FAILED,
    CANCELLED,
    CONFLICT
}
