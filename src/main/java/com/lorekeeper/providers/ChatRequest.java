package com.lorekeeper.providers;

import java.util.List;
import java.util.Map;

public record ChatRequest(
    String model,
    List<Map<String, Object>> messages,
    double temperature
) {
    public static ChatRequest ofPrompt(String model, String prompt, double temperature) {
        return new ChatRequest(model, List.of(Map.of("role", "user", "content", prompt)), temperature);
    }

    public ChatRequest withModel(String other) {
        return new ChatRequest(other, messages, temperature);
    }
}
