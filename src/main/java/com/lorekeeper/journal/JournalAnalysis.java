package com.lorekeeper.journal;

import com.fasterxml.jackson.databind.JsonNode;
import com.lorekeeper.shared.model.Emotions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Structured result of analysing one conversation chunk. {@code importance} is
 * the raw 1-10 score; normalization happens when the record is built.
 */
public record JournalAnalysis(
    String summary,
    Emotions emotions,
    List<String> decisions,
    List<String> topics,
    double importance,
    double relationshipDelta,
    List<String> conversationDrivers,
    List<String> participants,
    List<String> plotElements
) {
    private static final Logger log = LoggerFactory.getLogger(JournalAnalysis.class);

    public static final List<String> REQUIRED_KEYS = List.of(
            "summary", "emotions", "decisions", "topics", "importance", "relationshipDelta");

    /**
     * Accepts the node only when every required field has the right shape.
     * Missing optional lists default to empty, participants to both speakers.
     */
    public static Optional<JournalAnalysis> fromJson(JsonNode node, String userName, String ownerName) {
        if (node == null || !node.isObject()) return reject("not an object");
        var summary = node.path("summary");
        if (!summary.isTextual() || summary.asText().isBlank()) return reject("summary");
        var emotions = node.path("emotions");
        if (!emotions.isObject()) return reject("emotions");
        if (!node.path("decisions").isArray()) return reject("decisions");
        if (!node.path("topics").isArray()) return reject("topics");
        if (!node.path("importance").isNumber()) return reject("importance");
        if (!node.path("relationshipDelta").isNumber()) return reject("relationshipDelta");

        var participants = node.path("participants").isArray()
                ? strings(node.path("participants"))
                : List.of(userName, ownerName);
        return Optional.of(new JournalAnalysis(
            summary.asText().trim(),
            new Emotions(
                emotions.path("positive").asDouble(0.0),
                emotions.path("negative").asDouble(0.0),
                emotions.path("neutral").asDouble(0.0)),
            strings(node.path("decisions")),
            strings(node.path("topics")),
            node.path("importance").asDouble(),
            node.path("relationshipDelta").asDouble(),
            strings(node.path("conversationDrivers")),
            participants,
            strings(node.path("plotElements"))
        ));
    }

    private static Optional<JournalAnalysis> reject(String field) {
        log.warn("Analysis rejected: missing or invalid '{}'", field);
        return Optional.empty();
    }

    private static List<String> strings(JsonNode array) {
        if (!array.isArray()) return List.of();
        var out = new ArrayList<String>();
        for (var item : array) {
            var text = item.isValueNode() ? item.asText() : item.toString();
            if (!text.isBlank()) out.add(text.trim());
        }
        return List.copyOf(out);
    }
}
