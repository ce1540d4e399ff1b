package com.lorekeeper.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One retrievable unit of long-term memory. The embedding is kept beside the
 * record by the vector store, keyed by {@link #id()}.
 *
 * <p>Seed kinds ({@code persona}, {@code firstMessage}) leave the journal fields empty.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemoryRecord(
    String id,
    String owner,
    String summary,
    long timestamp,
    double importance,
    MemoryKind kind,
    Emotions emotions,
    List<String> decisions,
    List<String> topics,
    List<String> participants,
    List<String> plotElements,
    List<String> conversationDrivers,
    double relationshipDelta,
    RelationshipState relationship
) {
    public static final double MIN_IMPORTANCE = 0.1;
    public static final double MAX_IMPORTANCE = 1.0;

    public MemoryRecord {
        Objects.requireNonNull(id, "id");
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner must not be blank");
        }
        if (!(importance >= MIN_IMPORTANCE && importance <= MAX_IMPORTANCE)) {
            throw new IllegalArgumentException("importance out of range [0.1, 1.0]: " + importance);
        }
        summary = summary != null ? summary : "";
        kind = kind != null ? kind : MemoryKind.JOURNAL;
        emotions = emotions != null ? emotions : Emotions.NONE;
        decisions = decisions != null ? List.copyOf(decisions) : List.of();
        topics = topics != null ? List.copyOf(topics) : List.of();
        participants = participants != null ? List.copyOf(participants) : List.of();
        plotElements = plotElements != null ? List.copyOf(plotElements) : List.of();
        conversationDrivers = conversationDrivers != null ? List.copyOf(conversationDrivers) : List.of();
    }

    public static MemoryRecord seed(String owner, MemoryKind kind, String summary, long timestamp) {
        return new MemoryRecord(UUID.randomUUID().toString(), owner, summary, timestamp,
                MAX_IMPORTANCE, kind, null, null, null, null, null, null, 0.0, null);
    }

    /** Maps a 1-10 analysis score onto [0.1, 1.0]. */
    public static double normalizeImportance(double rawScore) {
        if (!Double.isFinite(rawScore)) return 0.5;
        return Math.max(MIN_IMPORTANCE, Math.min(MAX_IMPORTANCE, rawScore / 10.0));
    }

    public boolean hasDecisions() {
        return !decisions.isEmpty();
    }
}
