package com.lorekeeper.retrieval;

import com.lorekeeper.observability.MemoryMetrics;
import com.lorekeeper.providers.ProviderChain;
import com.lorekeeper.providers.RerankProvider;
import com.lorekeeper.shared.model.MemoryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Reorders candidates through the rerank provider chain. On total failure the
 * incoming similarity order is returned unchanged.
 */
public class RerankGateway {

    private static final Logger log = LoggerFactory.getLogger(RerankGateway.class);

    private final ProviderChain<RerankProvider> chain;
    private final MemoryMetrics metrics;

    public RerankGateway(List<RerankProvider> providers, MemoryMetrics metrics) {
        this.chain = new ProviderChain<>("rerank", providers, RerankProvider::id);
        this.metrics = metrics;
    }

    public List<MemoryRecord> rerank(String query, List<MemoryRecord> candidates, String preferredProvider) {
        if (candidates.size() < 2) return candidates;
        var documents = candidates.stream().map(MemoryRecord::summary).toList();

        var order = chain.firstSuccess(preferredProvider, provider -> {
            var indices = provider.rerank(query, documents);
            return indices == null || indices.isEmpty() ? Optional.<List<Integer>>empty() : Optional.of(indices);
        });
        if (order.isEmpty()) {
            metrics.rerankFallbacks().increment();
            log.warn("Reranking unavailable, keeping similarity order for {} candidates", candidates.size());
            return candidates;
        }
        return applyOrder(candidates, order.get());
    }

    /** Valid, first-seen indices lead; anything the provider left out follows in its original order. */
    static List<MemoryRecord> applyOrder(List<MemoryRecord> candidates, List<Integer> indices) {
        var seen = new LinkedHashSet<Integer>();
        for (var index : indices) {
            if (index != null && index >= 0 && index < candidates.size()) seen.add(index);
        }
        for (int i = 0; i < candidates.size(); i++) {
            seen.add(i);
        }
        var out = new ArrayList<MemoryRecord>(candidates.size());
        for (var index : seen) {
            out.add(candidates.get(index));
        }
        return out;
    }
}
