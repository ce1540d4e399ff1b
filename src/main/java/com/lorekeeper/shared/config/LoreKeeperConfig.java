package com.lorekeeper.shared.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public record LoreKeeperConfig(
    Path storePath,
    boolean acceleratedIndex,
    int maxContextTokens,
    GenerationConfig generation,
    CapabilityConfig embedding,
    CapabilityConfig reranking,
    Map<String, List<String>> apiKeys,
    MemoryConfig memory
) {
    public record GenerationConfig(String primary, List<String> fallback, String model,
                                   String analysisModel, int maxRetries,
                                   List<ProviderEndpoint> endpoints) {
        public static GenerationConfig defaults() {
            return new GenerationConfig("deepseek", List.of(), "deepseek-chat", null, 2, List.of(
                new ProviderEndpoint("deepseek", "https://api.deepseek.com/v1", "deepseek-chat"),
                new ProviderEndpoint("openrouter", "https://openrouter.ai/api/v1",
                        "deepseek/deepseek-chat")
            ));
        }
    }

    /** Ordered providers of one capability (embedding or reranking). */
    public record CapabilityConfig(List<String> order, List<ProviderEndpoint> endpoints) {

        public static CapabilityConfig embeddingDefaults() {
            return new CapabilityConfig(List.of("gemini", "nvidia", "mistral", "cohere"), List.of(
                new ProviderEndpoint("gemini",
                        "https://generativelanguage.googleapis.com/v1beta/openai", "text-embedding-004"),
                new ProviderEndpoint("nvidia", "https://integrate.api.nvidia.com/v1", "nvidia/nv-embed-v1"),
                new ProviderEndpoint("mistral", "https://api.mistral.ai/v1", "mistral-embed"),
                new ProviderEndpoint("cohere", "https://api.cohere.com/compatibility/v1",
                        "embed-english-v3.0")
            ));
        }

        public static CapabilityConfig rerankingDefaults() {
            return new CapabilityConfig(List.of("jina", "cohere", "nvidia"), List.of(
                new ProviderEndpoint("jina", "https://api.jina.ai/v1/rerank",
                        "jina-reranker-v2-base-multilingual", "documents"),
                new ProviderEndpoint("cohere", "https://api.cohere.com/v2/rerank",
                        "rerank-v3.5", "documents"),
                new ProviderEndpoint("nvidia",
                        "https://ai.api.nvidia.com/v1/retrieval/nvidia/reranking",
                        "nvidia/nv-rerankqa-mistral-4b-v3", "passages")
            ));
        }

        public ProviderEndpoint endpoint(String id) {
            return endpoints.stream().filter(e -> e.id().equals(id)).findFirst().orElse(null);
        }
    }

    public List<String> keysFor(String providerId) {
        return apiKeys.getOrDefault(providerId, List.of());
    }
}
