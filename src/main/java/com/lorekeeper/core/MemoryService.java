package com.lorekeeper.core;

import com.lorekeeper.context.ContextAssembler;
import com.lorekeeper.context.PromptContext;
import com.lorekeeper.journal.JournalBuilder;
import com.lorekeeper.journal.JournalEntry;
import com.lorekeeper.memory.EmbeddingGateway;
import com.lorekeeper.memory.VectorStore;
import com.lorekeeper.memory.VectorStoreException;
import com.lorekeeper.retrieval.MemoryFilter;
import com.lorekeeper.retrieval.MemoryRetriever;
import com.lorekeeper.shared.config.MemoryConfig;
import com.lorekeeper.shared.model.CharacterState;
import com.lorekeeper.shared.model.ChatTurn;
import com.lorekeeper.shared.model.MemoryKind;
import com.lorekeeper.shared.model.MemoryRecord;
import com.lorekeeper.shared.model.SeedProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Entry point for the rest of the application: journal, recall, prompt
 * assembly, and owner-level maintenance.
 */
public class MemoryService {

    private static final Logger log = LoggerFactory.getLogger(MemoryService.class);

    static final int SEED_SUMMARY_LENGTH = 200;

    private final EmbeddingGateway embeddings;
    private final VectorStore store;
    private final JournalBuilder journal;
    private final MemoryRetriever retriever;
    private final ContextAssembler assembler;
    private final Pacer pacer;
    private final Clock clock;

    public MemoryService(EmbeddingGateway embeddings, VectorStore store, JournalBuilder journal,
                         MemoryRetriever retriever, ContextAssembler assembler, Pacer pacer, Clock clock) {
        this.embeddings = embeddings;
        this.store = store;
        this.journal = journal;
        this.retriever = retriever;
        this.assembler = assembler;
        this.pacer = pacer;
        this.clock = clock;
    }

    public Optional<JournalEntry> createJournalEntry(List<ChatTurn> chunk, CharacterState owner, MemoryConfig config) {
        return journal.createEntry(chunk, owner, config);
    }

    public List<MemoryRecord> retrieveRelevantMemories(String query, String owner, int limit, MemoryConfig config,
                                                       List<ChatTurn> recentHistory) {
        return retriever.retrieve(query, owner, limit, recentHistory, config);
    }

    public PromptContext buildPromptContext(String persona, String scenario, String query,
                                            List<MemoryRecord> memories, List<ChatTurn> history, int tokenBudget) {
        return assembler.buildContext(persona, scenario, query, memories, history, tokenBudget);
    }

    /** Number of records removed; 0 when the store could not be rewritten. */
    public int clearMemoriesForOwner(String owner) {
        try {
            return store.deleteByOwner(owner);
        } catch (VectorStoreException e) {
            log.error("Failed to clear memories of {}", owner, e);
            return 0;
        }
    }

    public List<MemoryRecord> listMemories(String owner, MemoryFilter filter) {
        try {
            return filter.apply(store.listByOwner(owner));
        } catch (VectorStoreException e) {
            log.error("Failed to list memories of {}", owner, e);
            return List.of();
        }
    }

    /** True once {@code journalFrequency} conversational turns have passed since the last entry. */
    public boolean shouldJournal(int effectiveMessageCount, int lastJournalIndex, MemoryConfig config) {
        return effectiveMessageCount - lastJournalIndex >= config.journalFrequency();
    }

    /** The last {@code journalFrequency} user/assistant turns. */
    public List<ChatTurn> journalChunk(List<ChatTurn> history, MemoryConfig config) {
        var turns = history.stream().filter(ChatTurn::isConversational).toList();
        return turns.subList(Math.max(0, turns.size() - config.journalFrequency()), turns.size());
    }

    /** Stores the persona and first message as top-importance memories. */
    public List<MemoryKind> seedInitialMemories(SeedProfile profile, MemoryConfig config) {
        var seeded = new ArrayList<MemoryKind>();
        if (profile == null || profile.name() == null || profile.name().isBlank()) return seeded;
        seed(profile.name(), MemoryKind.PERSONA, profile.persona(), config).ifPresent(seeded::add);
        seed(profile.name(), MemoryKind.FIRST_MESSAGE, profile.firstMessage(), config).ifPresent(seeded::add);
        log.info("Seeded {} for {}", seeded, profile.name());
        return seeded;
    }

    private Optional<MemoryKind> seed(String owner, MemoryKind kind, String text, MemoryConfig config) {
        if (text == null || text.isBlank()) return Optional.empty();
        var vector = embeddings.embed(text, config.embeddingProvider());
        if (vector.length == 0) {
            log.error("Failed to embed {} seed for {}", kind.wireName(), owner);
            return Optional.empty();
        }
        var summary = text.substring(0, Math.min(SEED_SUMMARY_LENGTH, text.length()));
        try {
            store.insert(vector, MemoryRecord.seed(owner, kind, summary, clock.millis()));
            return Optional.of(kind);
        } catch (VectorStoreException e) {
            log.error("Failed to store {} seed for {}", kind.wireName(), owner, e);
            return Optional.empty();
        }
    }

    /**
     * Rebuilds an owner's memories from a full transcript: clear, reseed, then one
     * journal entry per complete chunk of {@code journalFrequency} turns. A failed
     * chunk is counted and skipped.
     */
    public RecycleResult recycleMemories(CharacterState owner, List<ChatTurn> history, SeedProfile seed,
                                         MemoryConfig config, Consumer<RecycleProgress> progress) {
        Consumer<RecycleProgress> listener = progress != null ? progress : p -> { };
        var turns = history.stream().filter(ChatTurn::isConversational).toList();
        int frequency = Math.max(1, config.journalFrequency());
        int total = turns.size() / frequency;

        listener.accept(new RecycleProgress(RecycleProgress.Step.CLEARING, "Clearing memories", 0, total));
        try {
            store.deleteByOwner(owner.name());
        } catch (VectorStoreException e) {
            log.error("Recycle aborted for {}: could not clear memories", owner.name(), e);
            listener.accept(new RecycleProgress(RecycleProgress.Step.FAILED, e.getMessage(), 0, total));
            return RecycleResult.failed(e.getMessage(), owner.relationship());
        }

        listener.accept(new RecycleProgress(RecycleProgress.Step.SEEDING, "Storing initial memories", 0, total));
        var seeded = seed != null ? seedInitialMemories(seed, config) : List.<MemoryKind>of();

        var state = owner;
        int created = 0;
        int failed = 0;
        for (int i = 0; i < total; i++) {
            listener.accept(new RecycleProgress(RecycleProgress.Step.JOURNALING,
                    "Creating memory " + (i + 1) + " of " + total, i + 1, total));
            var chunk = turns.subList(i * frequency, (i + 1) * frequency);
            var entry = journal.createEntry(chunk, state, config);
            if (entry.isPresent()) {
                state = state.withRelationship(entry.get().updatedRelationship());
                created++;
            } else {
                failed++;
            }
            if (i < total - 1 && !pause(config.recycleDelayMs())) {
                log.warn("Recycle of {} interrupted after {} chunks", owner.name(), i + 1);
                listener.accept(new RecycleProgress(RecycleProgress.Step.FAILED, "Interrupted", i + 1, total));
                return new RecycleResult(false, created, failed, seeded, state.relationship(), "interrupted");
            }
        }

        log.info("Recycled memories for {}: {} created, {} failed, seeds {}", owner.name(), created, failed, seeded);
        listener.accept(new RecycleProgress(RecycleProgress.Step.COMPLETE,
                "Created " + created + " new memories", total, total));
        return new RecycleResult(true, created, failed, seeded, state.relationship(), null);
    }

    private boolean pause(long delayMs) {
        if (delayMs <= 0) return true;
        try {
            pacer.pause(Duration.ofMillis(delayMs));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public VectorStore store() {
        return store;
    }
}
