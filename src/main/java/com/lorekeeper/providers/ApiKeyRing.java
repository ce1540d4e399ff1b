package com.lorekeeper.providers;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin API keys per provider. One ring per loaded configuration.
 */
public class ApiKeyRing {

    private final Map<String, List<String>> keys;
    private final Map<String, AtomicInteger> cursors = new ConcurrentHashMap<>();

    public ApiKeyRing(Map<String, List<String>> keys) {
        this.keys = Map.copyOf(keys);
    }

    public static ApiKeyRing empty() {
        return new ApiKeyRing(Map.of());
    }

    public boolean hasKey(String providerId) {
        return !keys.getOrDefault(providerId, List.of()).isEmpty();
    }

    public int count(String providerId) {
        return keys.getOrDefault(providerId, List.of()).size();
    }

    /** Next key for the provider; throws {@link ProviderException} when none is configured. */
    public String next(String providerId) {
        var list = keys.getOrDefault(providerId, List.of());
        if (list.isEmpty()) {
            throw new ProviderException(providerId, "no API key configured");
        }
        var cursor = cursors.computeIfAbsent(providerId, k -> new AtomicInteger());
        return list.get(Math.floorMod(cursor.getAndIncrement(), list.size()));
    }
}
