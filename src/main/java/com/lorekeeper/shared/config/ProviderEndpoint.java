package com.lorekeeper.shared.config;

/**
 * Where a capability provider lives. {@code style} only matters for rerankers
 * ({@code documents} or {@code passages}).
 */
public record ProviderEndpoint(String id, String baseUrl, String model, String style) {

    public ProviderEndpoint(String id, String baseUrl, String model) {
        this(id, baseUrl, model, null);
    }
}
