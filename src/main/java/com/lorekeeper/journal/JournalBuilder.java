package com.lorekeeper.journal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lorekeeper.memory.EmbeddingGateway;
import com.lorekeeper.memory.VectorStore;
import com.lorekeeper.memory.VectorStoreException;
import com.lorekeeper.observability.MemoryMetrics;
import com.lorekeeper.providers.ChatRequest;
import com.lorekeeper.providers.ModelProvider;
import com.lorekeeper.shared.config.MemoryConfig;
import com.lorekeeper.shared.model.CharacterState;
import com.lorekeeper.shared.model.ChatTurn;
import com.lorekeeper.shared.model.MemoryKind;
import com.lorekeeper.shared.model.MemoryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns a chunk of conversation into a stored journal record. Never throws for
 * provider or store trouble: every failure ends in an empty result.
 */
public class JournalBuilder {

    private static final Logger log = LoggerFactory.getLogger(JournalBuilder.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final double ANALYSIS_TEMPERATURE = 0.3;

    private final ModelProvider generator;
    private final EmbeddingGateway embeddings;
    private final VectorStore store;
    private final MemoryMetrics metrics;
    private final Clock clock;

    public JournalBuilder(ModelProvider generator, EmbeddingGateway embeddings, VectorStore store,
                          MemoryMetrics metrics, Clock clock) {
        this.generator = generator;
        this.embeddings = embeddings;
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Optional<JournalEntry> createEntry(List<ChatTurn> chunk, CharacterState owner, MemoryConfig config) {
        if (chunk == null || chunk.size() < config.journalFrequency()) {
            log.debug("Chunk of {} turns below journal frequency {}", chunk == null ? 0 : chunk.size(),
                    config.journalFrequency());
            return Optional.empty();
        }

        var analysis = analyze(chunk, owner.name(), config);
        if (analysis.isEmpty()) {
            log.warn("Skipping journal entry for {}: analysis failed", owner.name());
            metrics.journalSkipped().increment();
            return Optional.empty();
        }
        var result = analysis.get();
        var updated = owner.relationship().apply(result.relationshipDelta());

        var vector = embeddings.embed(result.summary(), config.embeddingProvider());
        if (vector.length == 0) {
            log.error("Skipping journal entry for {}: summary could not be embedded", owner.name());
            metrics.journalSkipped().increment();
            return Optional.empty();
        }

        var record = new MemoryRecord(
            UUID.randomUUID().toString(),
            owner.name(),
            result.summary(),
            clock.millis(),
            MemoryRecord.normalizeImportance(result.importance()),
            MemoryKind.JOURNAL,
            result.emotions(),
            result.decisions(),
            result.topics(),
            result.participants(),
            result.plotElements(),
            result.conversationDrivers(),
            result.relationshipDelta(),
            updated
        );
        try {
            var handle = store.insert(vector, record);
            metrics.journalCreated().increment();
            log.info("Journal entry created for {}. Importance: {}, relationship: {} ({})",
                    owner.name(), record.importance(), updated.sentiment(), updated.status().label());
            return Optional.of(new JournalEntry(record, updated, handle));
        } catch (VectorStoreException e) {
            log.error("Skipping journal entry for {}: store write failed", owner.name(), e);
            metrics.journalSkipped().increment();
            return Optional.empty();
        }
    }

    /** Generation, cleaning, extraction, repair, validation, then heuristics. */
    Optional<JournalAnalysis> analyze(List<ChatTurn> chunk, String ownerName, MemoryConfig config) {
        String raw;
        try {
            var prompt = AnalysisPrompt.build(chunk, ownerName, config.userName());
            raw = generator.chat(ChatRequest.ofPrompt(config.analysisModel(), prompt, ANALYSIS_TEMPERATURE))
                    .content();
        } catch (RuntimeException e) {
            log.error("Analysis call failed for {}: {}", ownerName, e.getMessage());
            return Optional.empty();
        }
        return interpret(raw, config.userName(), ownerName);
    }

    Optional<JournalAnalysis> interpret(String raw, String userName, String ownerName) {
        var cleaned = ResponseCleaner.clean(raw);
        var parsed = JsonCandidates.best(cleaned, JournalAnalysis.REQUIRED_KEYS)
                .flatMap(json -> JsonRepair.parse(json, MAPPER))
                .flatMap(node -> JournalAnalysis.fromJson(node, userName, ownerName));
        if (parsed.isPresent()) return parsed;

        log.warn("No valid analysis JSON for {}, falling back to heuristics", ownerName);
        metrics.heuristicFallbacks().increment();
        return HeuristicExtractor.extract(cleaned, userName, ownerName);
    }
}
