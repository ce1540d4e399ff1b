package com.lorekeeper.providers;

import java.util.Map;

public record ChatResponse(
    String model,
    String content,
    Map<String, Integer> usage
) {
    public ChatResponse(String content) {
        this(null, content, Map.of());
    }
}
