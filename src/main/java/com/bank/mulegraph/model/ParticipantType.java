package com.bank.mulegraph.model;

/** Kind of entity at either end of a transaction edge. Only ACCOUNT endpoints join the projection. */
public enum ParticipantType {
    ACCOUNT,
    MERCHANT,
    CASH
}
