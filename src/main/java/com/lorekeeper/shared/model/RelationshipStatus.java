package com.lorekeeper.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RelationshipStatus {
    FRIENDLY,
    ACQUAINTANCE,
    NEUTRAL,
    WARY,
    HOSTILE;

    /** Thresholds are strict: exactly 0.4 is still an acquaintance. */
    public static RelationshipStatus fromSentiment(double sentiment) {
        if (sentiment > 0.4) return FRIENDLY;
        if (sentiment > 0.1) return ACQUAINTANCE;
        if (sentiment < -0.4) return HOSTILE;
        if (sentiment < -0.1) return WARY;
        return NEUTRAL;
    }

    @JsonValue
    public String label() { return name().toLowerCase(Locale.ROOT); }

    @JsonCreator
    public static RelationshipStatus fromLabel(String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
