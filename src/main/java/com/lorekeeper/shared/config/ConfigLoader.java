package com.lorekeeper.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_HOME = Path.of(System.getProperty("user.home"), ".lorekeeper");

    public static LoreKeeperConfig load() {
        return load(home().resolve("config.yaml"));
    }

    public static Path home() {
        var env = System.getenv("LOREKEEPER_HOME");
        return env != null && !env.isBlank() ? Path.of(env) : DEFAULT_HOME;
    }

    @SuppressWarnings("unchecked")
    public static LoreKeeperConfig load(Path path) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var store = (Map<String, Object>) raw.getOrDefault("store", Map.of());
        var user = (Map<String, Object>) raw.getOrDefault("user", Map.of());
        var context = (Map<String, Object>) raw.getOrDefault("context", Map.of());
        var generation = (Map<String, Object>) raw.getOrDefault("generation", Map.of());
        var embedding = (Map<String, Object>) raw.getOrDefault("embedding", Map.of());
        var reranking = (Map<String, Object>) raw.getOrDefault("reranking", Map.of());
        var keys = (Map<String, Object>) raw.getOrDefault("api-keys", Map.of());
        var memory = (Map<String, Object>) raw.getOrDefault("memory", Map.of());

        var storePath = store.containsKey("path")
                ? Path.of(String.valueOf(store.get("path")))
                : home().resolve("memory");

        var apiKeys = new LinkedHashMap<String, List<String>>();
        keys.forEach((k, v) -> apiKeys.put(k, stringList(v)));

        var userName = envOrDefault("LOREKEEPER_USER",
                String.valueOf(user.getOrDefault("name", MemoryConfig.defaults().userName())));
        var gen = parseGeneration(generation);

        return new LoreKeeperConfig(
            storePath,
            bool(store.getOrDefault("accelerated-index", true)),
            Integer.parseInt(String.valueOf(context.getOrDefault("max-tokens", 4096))),
            gen,
            parseCapability(embedding, LoreKeeperConfig.CapabilityConfig.embeddingDefaults()),
            parseCapability(reranking, LoreKeeperConfig.CapabilityConfig.rerankingDefaults()),
            apiKeys,
            parseMemory(memory, userName, gen.analysisModel())
        );
    }

    private static MemoryConfig parseMemory(Map<String, Object> memory, String userName,
                                            String analysisModel) {
        var d = MemoryConfig.defaults();
        return new MemoryConfig(
            bool(memory.getOrDefault("enabled", d.enabled())),
            Integer.parseInt(String.valueOf(memory.getOrDefault("journal-frequency", d.journalFrequency()))),
            Integer.parseInt(String.valueOf(memory.getOrDefault("retrieval-count", d.retrievalCount()))),
            Integer.parseInt(String.valueOf(memory.getOrDefault("history-message-count", d.historyMessageCount()))),
            envOrDefault("LOREKEEPER_EMBEDDING_PROVIDER",
                String.valueOf(memory.getOrDefault("embedding-provider", d.embeddingProvider()))),
            String.valueOf(memory.getOrDefault("query-method", d.queryMethod())),
            bool(memory.getOrDefault("hyde-enabled", d.hydeEnabled())),
            bool(memory.getOrDefault("reranking-enabled", d.rerankingEnabled())),
            String.valueOf(memory.getOrDefault("reranking-provider", d.rerankingProvider())),
            Long.parseLong(String.valueOf(memory.getOrDefault("recycle-delay-ms", d.recycleDelayMs()))),
            userName,
            analysisModel
        );
    }

    @SuppressWarnings("unchecked")
    private static LoreKeeperConfig.GenerationConfig parseGeneration(Map<String, Object> generation) {
        var d = LoreKeeperConfig.GenerationConfig.defaults();
        var model = String.valueOf(generation.getOrDefault("model", d.model()));
        var analysis = generation.get("analysis-model");
        return new LoreKeeperConfig.GenerationConfig(
            String.valueOf(generation.getOrDefault("primary", d.primary())),
            generation.containsKey("fallback") ? stringList(generation.get("fallback")) : d.fallback(),
            model,
            analysis != null ? String.valueOf(analysis) : model,
            Integer.parseInt(String.valueOf(generation.getOrDefault("max-retries", d.maxRetries()))),
            mergeEndpoints(d.endpoints(),
                (List<Map<String, Object>>) generation.getOrDefault("endpoints", List.of()))
        );
    }

    @SuppressWarnings("unchecked")
    private static LoreKeeperConfig.CapabilityConfig parseCapability(
            Map<String, Object> section, LoreKeeperConfig.CapabilityConfig defaults) {
        var order = section.containsKey("order") ? stringList(section.get("order")) : defaults.order();
        var endpoints = mergeEndpoints(defaults.endpoints(),
                (List<Map<String, Object>>) section.getOrDefault("endpoints", List.of()));
        return new LoreKeeperConfig.CapabilityConfig(order, endpoints);
    }

    /** Configured endpoints replace defaults with the same id; new ids are appended. */
    private static List<ProviderEndpoint> mergeEndpoints(List<ProviderEndpoint> defaults,
                                                         List<Map<String, Object>> configured) {
        var byId = new LinkedHashMap<String, ProviderEndpoint>();
        defaults.forEach(e -> byId.put(e.id(), e));
        for (var raw : configured) {
            var id = String.valueOf(raw.get("id"));
            var base = byId.get(id);
            byId.put(id, new ProviderEndpoint(
                id,
                stringOr(raw.get("base-url"), base != null ? base.baseUrl() : null),
                stringOr(raw.get("model"), base != null ? base.model() : null),
                stringOr(raw.get("style"), base != null ? base.style() : null)
            ));
        }
        return List.copyOf(byId.values());
    }

    private static List<String> stringList(Object value) {
        var out = new ArrayList<String>();
        if (value instanceof List<?> list) {
            list.forEach(v -> out.add(String.valueOf(v)));
        } else if (value != null && !String.valueOf(value).isBlank()) {
            out.add(String.valueOf(value));
        }
        return List.copyOf(out);
    }

    private static String stringOr(Object value, String fallback) {
        return value != null ? String.valueOf(value) : fallback;
    }

    private static boolean bool(Object value) {
        return Boolean.parseBoolean(String.valueOf(value));
    }

    private static String envOrDefault(String env, String fallback) {
        var val = System.getenv(env);
        return val != null ? val : fallback;
    }
}
