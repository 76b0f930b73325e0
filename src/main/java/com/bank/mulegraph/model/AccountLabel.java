package com.bank.mulegraph.model;

import java.util.Locale;

public enum AccountLabel {
    INTERNAL,
    EXTERNAL,
    HIGH_RISK_JURISDICTION,
    FLAGGED,
    CONFIRMED_MULE;

    /**
     * Parses store labels such as "confirmed-mule", "ConfirmedMule" or "CONFIRMED_MULE".
     * Returns null for labels this service does not track.
     */
    public static AccountLabel fromStoreLabel(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String normalized = raw.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .replace(' ', '_')
                .toUpperCase(Locale.ROOT);
        for (AccountLabel label : values()) {
            if (label.name().equals(normalized)) {
                return label;
            }
        }
        return null;
    }
}
