package com.lorekeeper.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MemoryKind {
    PERSONA("persona"),
    FIRST_MESSAGE("firstMessage"),
    JOURNAL("journal");

    private final String wireName;

    MemoryKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() { return wireName; }

    public boolean isSeed() { return this != JOURNAL; }

    @JsonCreator
    public static MemoryKind fromWireName(String value) {
        for (var kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) return kind;
        }
        throw new IllegalArgumentException("Unknown memory kind: " + value);
    }
}
