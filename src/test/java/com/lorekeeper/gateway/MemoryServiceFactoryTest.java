package com.lorekeeper.gateway;

import com.lorekeeper.providers.ApiKeyRing;
import com.lorekeeper.providers.EmbeddingProvider;
import com.lorekeeper.providers.RerankProvider;
import com.lorekeeper.providers.ReliableProvider;
import com.lorekeeper.shared.config.LoreKeeperConfig;
import com.lorekeeper.shared.config.MemoryConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MemoryServiceFactoryTest {

    private static LoreKeeperConfig config(LoreKeeperConfig.GenerationConfig generation,
                                           LoreKeeperConfig.CapabilityConfig embedding) {
        return new LoreKeeperConfig(Path.of("unused"), false, 4096, generation, embedding,
                LoreKeeperConfig.CapabilityConfig.rerankingDefaults(), Map.of(), MemoryConfig.defaults());
    }

    @Test
    void generatorChainsPrimaryThenFallbacks() {
        var gen = new LoreKeeperConfig.GenerationConfig("deepseek", List.of("openrouter", "ghost"), "deepseek-chat",
                null, 1, LoreKeeperConfig.GenerationConfig.defaults().endpoints());

        var generator = MemoryServiceFactory.generator(config(gen, LoreKeeperConfig.CapabilityConfig.embeddingDefaults()),
                ApiKeyRing.empty());

        assertInstanceOf(ReliableProvider.class, generator);
        assertEquals(List.of("deepseek", "openrouter"), ((ReliableProvider) generator).providerIds());
    }

    @Test
    void generatorNeedsAtLeastOneEndpoint() {
        var gen = new LoreKeeperConfig.GenerationConfig("ghost", List.of(), "m", null, 1, List.of());
        var cfg = config(gen, LoreKeeperConfig.CapabilityConfig.embeddingDefaults());
        assertThrows(IllegalStateException.class, () -> MemoryServiceFactory.generator(cfg, ApiKeyRing.empty()));
    }

    @Test
    void capabilityProvidersFollowConfiguredOrder() {
        var embedding = new LoreKeeperConfig.CapabilityConfig(List.of("mistral", "unknown", "gemini"),
                LoreKeeperConfig.CapabilityConfig.embeddingDefaults().endpoints());
        var cfg = config(LoreKeeperConfig.GenerationConfig.defaults(), embedding);

        var embedders = MemoryServiceFactory.embeddingProviders(cfg, ApiKeyRing.empty());
        var rerankers = MemoryServiceFactory.rerankProviders(cfg, ApiKeyRing.empty());

        assertEquals(List.of("mistral", "gemini"), embedders.stream().map(EmbeddingProvider::id).toList());
        assertEquals(List.of("jina", "cohere", "nvidia"), rerankers.stream().map(RerankProvider::id).toList());
    }
}
