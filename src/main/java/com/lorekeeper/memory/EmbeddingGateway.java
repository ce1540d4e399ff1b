package com.lorekeeper.memory;

import com.lorekeeper.observability.MemoryMetrics;
import com.lorekeeper.providers.EmbeddingProvider;
import com.lorekeeper.providers.ProviderChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Embeds text through an ordered list of providers. Never throws: total
 * failure yields an empty vector.
 */
public class EmbeddingGateway {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingGateway.class);
    private static final float[] EMPTY = new float[0];

    private final ProviderChain<EmbeddingProvider> chain;
    private final MemoryMetrics metrics;

    public EmbeddingGateway(List<EmbeddingProvider> providers, MemoryMetrics metrics) {
        this.chain = new ProviderChain<>("embedding", providers, EmbeddingProvider::id);
        this.metrics = metrics;
    }

    public List<String> providerIds() {
        return chain.ids();
    }

    public float[] embed(String text, String preferredProvider) {
        if (text == null || text.isBlank()) return EMPTY;

        var result = chain.firstSuccess(preferredProvider, provider -> {
            try {
                var vector = provider.embed(text);
                if (vector == null || vector.length == 0) {
                    metrics.embeddingFailures().increment();
                    return Optional.empty();
                }
                log.debug("Embedded {} chars via {} ({} dims)", text.length(), provider.id(), vector.length);
                return Optional.of(vector);
            } catch (RuntimeException e) {
                metrics.embeddingFailures().increment();
                throw e;
            }
        });
        if (result.isEmpty()) {
            metrics.embeddingExhausted().increment();
            return EMPTY;
        }
        return result.get();
    }
}
