package com.lorekeeper.retrieval;

import com.lorekeeper.memory.ScoredRecord;
import com.lorekeeper.memory.VectorStore;
import com.lorekeeper.memory.VectorStoreException;
import com.lorekeeper.observability.MemoryMetrics;
import com.lorekeeper.shared.config.MemoryConfig;
import com.lorekeeper.shared.model.ChatTurn;
import com.lorekeeper.shared.model.MemoryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class MemoryRetriever {

    private static final Logger log = LoggerFactory.getLogger(MemoryRetriever.class);

    private final QueryFormulator formulator;
    private final VectorStore store;
    private final RerankGateway reranker;
    private final MemoryMetrics metrics;

    public MemoryRetriever(QueryFormulator formulator, VectorStore store, RerankGateway reranker,
                           MemoryMetrics metrics) {
        this.formulator = formulator;
        this.store = store;
        this.reranker = reranker;
        this.metrics = metrics;
    }

    /**
     * Records of {@code owner} most relevant to the message, best first. An empty
     * list is a normal outcome: retrieval disabled, nothing stored, or no embedding.
     */
    public List<MemoryRecord> retrieve(String currentMessage, String owner, int limit,
                                       List<ChatTurn> recentHistory, MemoryConfig config) {
        if (!config.enabled() || limit <= 0) return List.of();
        return metrics.retrievalLatency().record(() -> doRetrieve(currentMessage, owner, limit, recentHistory, config));
    }

    private List<MemoryRecord> doRetrieve(String message, String owner, int limit,
                                          List<ChatTurn> history, MemoryConfig config) {
        var vector = formulator.queryVector(message, owner, history, config);
        if (vector.length == 0) {
            log.warn("No query embedding for {}, returning no memories", owner);
            return List.of();
        }

        List<MemoryRecord> candidates;
        try {
            candidates = store.query(vector, 2 * limit).stream()
                    .map(ScoredRecord::record)
                    .filter(r -> r.owner().equals(owner))
                    .toList();
        } catch (VectorStoreException e) {
            log.error("Memory query failed for {}", owner, e);
            return List.of();
        }

        if (config.rerankingEnabled() && candidates.size() > 1) {
            candidates = reranker.rerank(message, candidates, config.rerankingProvider());
        }
        var result = candidates.size() > limit ? List.copyOf(candidates.subList(0, limit)) : candidates;
        log.info("Retrieved {} memories for {}", result.size(), owner);
        return result;
    }
}
