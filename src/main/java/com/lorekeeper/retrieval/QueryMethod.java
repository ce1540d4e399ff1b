package com.lorekeeper.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

public enum QueryMethod {
    PLAIN("plain"),
    LLM_SUMMARY("llm-summary"),
    HYDE("hyde"),
    AVERAGE("average");

    private static final Logger log = LoggerFactory.getLogger(QueryMethod.class);

    private final String configName;

    QueryMethod(String configName) {
        this.configName = configName;
    }

    public String configName() { return configName; }

    /** Unknown or missing names fall back to {@link #LLM_SUMMARY}. */
    public static QueryMethod fromConfig(String name) {
        if (name == null || name.isBlank()) return LLM_SUMMARY;
        var normalized = name.trim().toLowerCase(Locale.ROOT);
        for (var method : values()) {
            if (method.configName.equals(normalized)) return method;
        }
        log.warn("Unknown query method '{}', using {}", name, LLM_SUMMARY.configName);
        return LLM_SUMMARY;
    }
}
