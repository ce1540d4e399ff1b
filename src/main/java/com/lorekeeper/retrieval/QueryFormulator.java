package com.lorekeeper.retrieval;

import com.lorekeeper.memory.EmbeddingGateway;
import com.lorekeeper.providers.ChatRequest;
import com.lorekeeper.providers.ModelProvider;
import com.lorekeeper.shared.config.MemoryConfig;
import com.lorekeeper.shared.model.ChatTurn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the query embedding for a retrieval. Text methods (summary, hyde)
 * rewrite the query text before embedding; {@code average} blends the last
 * exchange in vector space.
 */
public class QueryFormulator {

    private static final Logger log = LoggerFactory.getLogger(QueryFormulator.class);

    static final int SUMMARY_TURNS = 4;
    static final double SUMMARY_TEMPERATURE = 0.2;
    static final double HYDE_TEMPERATURE = 0.5;

    private final ModelProvider generator;
    private final EmbeddingGateway embeddings;

    public QueryFormulator(ModelProvider generator, EmbeddingGateway embeddings) {
        this.generator = generator;
        this.embeddings = embeddings;
    }

    /** Empty when every embedding provider failed. */
    public float[] queryVector(String message, String ownerName, List<ChatTurn> history, MemoryConfig config) {
        var method = QueryMethod.fromConfig(config.queryMethod());
        var turns = history != null ? history : List.<ChatTurn>of();

        if (method == QueryMethod.AVERAGE) {
            var averaged = averageOfLastExchange(turns, config);
            if (averaged != null) return averaged;
            log.debug("Average query unavailable, embedding message");
            return embeddings.embed(message, config.embeddingProvider());
        }
        return embeddings.embed(queryText(method, message, ownerName, turns, config), config.embeddingProvider());
    }

    String queryText(QueryMethod method, String message, String ownerName, List<ChatTurn> turns,
                     MemoryConfig config) {
        var text = message;
        if (method == QueryMethod.LLM_SUMMARY && turns.size() > 1) {
            text = generate(summaryPrompt(message, turns), SUMMARY_TEMPERATURE, config, "summary", text);
        }
        if (method == QueryMethod.HYDE || config.hydeEnabled()) {
            text = generate(hydePrompt(message, ownerName), HYDE_TEMPERATURE, config, "hyde", text);
        }
        return text;
    }

    private String generate(String prompt, double temperature, MemoryConfig config, String step, String fallback) {
        try {
            var content = generator.chat(ChatRequest.ofPrompt(config.analysisModel(), prompt, temperature)).content();
            if (content != null && !content.isBlank()) return content.trim();
            log.warn("Query {} returned nothing, keeping previous query text", step);
        } catch (RuntimeException e) {
            log.warn("Query {} failed, keeping previous query text: {}", step, e.getMessage());
        }
        return fallback;
    }

    private float[] averageOfLastExchange(List<ChatTurn> turns, MemoryConfig config) {
        ChatTurn lastUser = null;
        ChatTurn lastAssistant = null;
        for (int i = turns.size() - 1; i >= 0 && (lastUser == null || lastAssistant == null); i--) {
            var t = turns.get(i);
            if (lastUser == null && t.isUser()) lastUser = t;
            else if (lastAssistant == null && t.isAssistant()) lastAssistant = t;
        }
        if (lastUser == null || lastAssistant == null) return null;

        var u = embeddings.embed(lastUser.content(), config.embeddingProvider());
        var a = embeddings.embed(lastAssistant.content(), config.embeddingProvider());
        if (u.length == 0 || a.length == 0 || u.length != a.length) return null;
        var mean = new float[u.length];
        for (int i = 0; i < u.length; i++) {
            mean[i] = (u[i] + a[i]) / 2f;
        }
        return mean;
    }

    static String summaryPrompt(String message, List<ChatTurn> turns) {
        var recent = turns.subList(Math.max(0, turns.size() - SUMMARY_TURNS), turns.size()).stream()
                .map(t -> t.role() + ": " + t.content())
                .collect(Collectors.joining("\n"));
        return "Summarize the following recent conversation context in 1-2 sentences, focusing on what "
                + "is most relevant for memory retrieval for the user's last message (\"" + message + "\"):\n"
                + recent;
    }

    static String hydePrompt(String message, String ownerName) {
        return "Given the user's message: \"" + message + "\", and the character " + ownerName
                + ", write a brief, hypothetical journal entry summary that would be perfectly relevant "
                + "to this message.";
    }
}
