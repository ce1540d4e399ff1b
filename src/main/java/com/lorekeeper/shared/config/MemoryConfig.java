package com.lorekeeper.shared.config;

/**
 * Per-call memory settings. Mirrors the {@code memory} section of config.yaml
 * plus the user and analysis-model values the journal and context code need.
 */
public record MemoryConfig(
    boolean enabled,
    int journalFrequency,
    int retrievalCount,
    int historyMessageCount,
    String embeddingProvider,
    String queryMethod,
    boolean hydeEnabled,
    boolean rerankingEnabled,
    String rerankingProvider,
    long recycleDelayMs,
    String userName,
    String analysisModel
) {
    public static MemoryConfig defaults() {
        return new MemoryConfig(true, 10, 5, 15, "gemini", "llm-summary",
                false, false, "jina", 5_000, "User", null);
    }

    public MemoryConfig withUserName(String name) {
        return new MemoryConfig(enabled, journalFrequency, retrievalCount, historyMessageCount,
                embeddingProvider, queryMethod, hydeEnabled, rerankingEnabled, rerankingProvider,
                recycleDelayMs, name, analysisModel);
    }

    public MemoryConfig withQueryMethod(String method, boolean hyde) {
        return new MemoryConfig(enabled, journalFrequency, retrievalCount, historyMessageCount,
                embeddingProvider, method, hyde, rerankingEnabled, rerankingProvider,
                recycleDelayMs, userName, analysisModel);
    }

    public MemoryConfig withReranking(boolean on, String provider) {
        return new MemoryConfig(enabled, journalFrequency, retrievalCount, historyMessageCount,
                embeddingProvider, queryMethod, hydeEnabled, on, provider,
                recycleDelayMs, userName, analysisModel);
    }

    public MemoryConfig withEnabled(boolean on) {
        return new MemoryConfig(on, journalFrequency, retrievalCount, historyMessageCount,
                embeddingProvider, queryMethod, hydeEnabled, rerankingEnabled, rerankingProvider,
                recycleDelayMs, userName, analysisModel);
    }

    public MemoryConfig withJournalFrequency(int frequency) {
        return new MemoryConfig(enabled, frequency, retrievalCount, historyMessageCount,
                embeddingProvider, queryMethod, hydeEnabled, rerankingEnabled, rerankingProvider,
                recycleDelayMs, userName, analysisModel);
    }
}
