package com.lorekeeper.providers;

/** Text generation capability. */
public interface ModelProvider {
    String id();
    ChatResponse chat(ChatRequest request);
}
