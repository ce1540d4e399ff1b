package com.lorekeeper.gateway;

import com.lorekeeper.context.ContextAssembler;
import com.lorekeeper.context.TokenEstimator;
import com.lorekeeper.core.MemoryService;
import com.lorekeeper.core.Pacer;
import com.lorekeeper.journal.JournalBuilder;
import com.lorekeeper.memory.EmbeddingGateway;
import com.lorekeeper.memory.JournalVectorStore;
import com.lorekeeper.observability.MemoryMetrics;
import com.lorekeeper.providers.ApiKeyRing;
import com.lorekeeper.providers.EmbeddingProvider;
import com.lorekeeper.providers.HttpRerankProvider;
import com.lorekeeper.providers.ModelProvider;
import com.lorekeeper.providers.OpenAiCompatibleEmbeddingProvider;
import com.lorekeeper.providers.OpenAiCompatibleProvider;
import com.lorekeeper.providers.RerankProvider;
import com.lorekeeper.providers.ReliableProvider;
import com.lorekeeper.retrieval.MemoryRetriever;
import com.lorekeeper.retrieval.QueryFormulator;
import com.lorekeeper.retrieval.RerankGateway;
import com.lorekeeper.shared.config.LoreKeeperConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/** Builds the HTTP-backed object graph from a loaded configuration. */
public final class MemoryServiceFactory {

    private static final Logger log = LoggerFactory.getLogger(MemoryServiceFactory.class);

    private MemoryServiceFactory() {}

    public static JournalVectorStore store(LoreKeeperConfig config, MemoryMetrics metrics) {
        return new JournalVectorStore(config.storePath(), config.acceleratedIndex(), metrics);
    }

    public static MemoryService create(LoreKeeperConfig config, JournalVectorStore store, MemoryMetrics metrics) {
        var keys = new ApiKeyRing(config.apiKeys());
        var clock = Clock.systemUTC();
        var generator = generator(config, keys);
        var embeddings = new EmbeddingGateway(embeddingProviders(config, keys), metrics);
        var reranker = new RerankGateway(rerankProviders(config, keys), metrics);

        var journal = new JournalBuilder(generator, embeddings, store, metrics, clock);
        var retriever = new MemoryRetriever(new QueryFormulator(generator, embeddings), store, reranker, metrics);
        var assembler = new ContextAssembler(TokenEstimator.r50k(), metrics, clock,
                config.memory().userName(), config.memory().historyMessageCount());
        return new MemoryService(embeddings, store, journal, retriever, assembler, Pacer.sleeping(), clock);
    }

    static ModelProvider generator(LoreKeeperConfig config, ApiKeyRing keys) {
        var gen = config.generation();
        var ids = new ArrayList<String>();
        ids.add(gen.primary());
        ids.addAll(gen.fallback());
        var providers = new ArrayList<ModelProvider>();
        for (var id : ids) {
            var endpoint = gen.endpoints().stream().filter(e -> e.id().equals(id)).findFirst();
            if (endpoint.isEmpty()) {
                log.warn("No endpoint configured for generation provider '{}', skipping", id);
                continue;
            }
            var model = id.equals(gen.primary()) ? gen.model() : endpoint.get().model();
            providers.add(new OpenAiCompatibleProvider(id, endpoint.get().baseUrl(), model, keys));
        }
        if (providers.isEmpty()) {
            throw new IllegalStateException("No usable generation provider among " + ids);
        }
        return new ReliableProvider(providers, gen.maxRetries(), 500);
    }

    static List<EmbeddingProvider> embeddingProviders(LoreKeeperConfig config, ApiKeyRing keys) {
        var out = new ArrayList<EmbeddingProvider>();
        for (var id : config.embedding().order()) {
            var endpoint = config.embedding().endpoint(id);
            if (endpoint == null) {
                log.warn("No endpoint configured for embedding provider '{}', skipping", id);
                continue;
            }
            out.add(new OpenAiCompatibleEmbeddingProvider(id, endpoint.baseUrl(), endpoint.model(), keys));
        }
        return out;
    }

    static List<RerankProvider> rerankProviders(LoreKeeperConfig config, ApiKeyRing keys) {
        var out = new ArrayList<RerankProvider>();
        for (var id : config.reranking().order()) {
            var endpoint = config.reranking().endpoint(id);
            if (endpoint == null) {
                log.warn("No endpoint configured for rerank provider '{}', skipping", id);
                continue;
            }
            out.add(new HttpRerankProvider(id, endpoint.baseUrl(), endpoint.model(),
                    HttpRerankProvider.Style.from(endpoint.style()), keys));
        }
        return out;
    }
}
