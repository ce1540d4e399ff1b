package com.lorekeeper.shared.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsWhenFileMissing() {
        var cfg = ConfigLoader.load(tempDir.resolve("missing.yaml"));
        var memory = cfg.memory();
        assertTrue(memory.enabled());
        assertEquals(10, memory.journalFrequency());
        assertEquals(15, memory.historyMessageCount());
        assertEquals("llm-summary", memory.queryMethod());
        assertFalse(memory.rerankingEnabled());
        assertEquals(5_000, memory.recycleDelayMs());
        assertTrue(cfg.acceleratedIndex());
        assertEquals(List.of("gemini", "nvidia", "mistral", "cohere"), cfg.embedding().order());
        assertEquals(List.of("jina", "cohere", "nvidia"), cfg.reranking().order());
        assertEquals("passages", cfg.reranking().endpoint("nvidia").style());
        assertEquals("deepseek-chat", cfg.generation().analysisModel());
    }

    @Test
    void parsesFullConfig() throws IOException {
        var yaml = """
            store:
              path: %s
              accelerated-index: false
            user:
              name: Alex
            context:
              max-tokens: 2048
            generation:
              primary: local
              model: llama3
              analysis-model: llama3-small
              endpoints:
                - id: local
                  base-url: http://localhost:11434/v1
                  model: llama3
            embedding:
              order: [mistral, gemini]
              endpoints:
                - id: mistral
                  model: mistral-embed-2
            api-keys:
              mistral: one
              gemini: [a, b, c]
            memory:
              journal-frequency: 6
              retrieval-count: 3
              query-method: hyde
              hyde-enabled: true
              reranking-enabled: true
              reranking-provider: cohere
              recycle-delay-ms: 0
            """.formatted(tempDir.resolve("mem"));
        var cfg = writeAndLoad(yaml);

        assertEquals(tempDir.resolve("mem"), cfg.storePath());
        assertFalse(cfg.acceleratedIndex());
        assertEquals(2048, cfg.maxContextTokens());
        assertEquals("local", cfg.generation().primary());
        assertEquals("llama3-small", cfg.memory().analysisModel());
        assertEquals(List.of("mistral", "gemini"), cfg.embedding().order());
        assertEquals("mistral-embed-2", cfg.embedding().endpoint("mistral").model());
        assertEquals("https://api.mistral.ai/v1", cfg.embedding().endpoint("mistral").baseUrl());
        assertEquals(List.of("one"), cfg.keysFor("mistral"));
        assertEquals(List.of("a", "b", "c"), cfg.keysFor("gemini"));
        assertEquals(6, cfg.memory().journalFrequency());
        assertEquals(3, cfg.memory().retrievalCount());
        assertEquals("hyde", cfg.memory().queryMethod());
        assertTrue(cfg.memory().hydeEnabled());
        assertTrue(cfg.memory().rerankingEnabled());
        assertEquals("cohere", cfg.memory().rerankingProvider());
        assertEquals(0, cfg.memory().recycleDelayMs());
    }

    @Test
    void partialMemorySectionKeepsDefaults() throws IOException {
        var cfg = writeAndLoad("""
            memory:
              journal-frequency: 4
            """);
        assertEquals(4, cfg.memory().journalFrequency());
        assertEquals(5, cfg.memory().retrievalCount());
        assertEquals("jina", cfg.memory().rerankingProvider());
        assertTrue(cfg.keysFor("gemini").isEmpty());
    }

    @Test
    void emptyFileLoadsDefaults() throws IOException {
        var cfg = writeAndLoad("");
        assertEquals(4096, cfg.maxContextTokens());
    }

    private LoreKeeperConfig writeAndLoad(String yaml) throws IOException {
        var file = tempDir.resolve("config.yaml");
        Files.writeString(file, yaml);
        return ConfigLoader.load(file);
    }
}
