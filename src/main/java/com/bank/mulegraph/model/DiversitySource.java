package com.bank.mulegraph.model;

public enum DiversitySource {
    SNAPSHOT,
    REALTIME
}
