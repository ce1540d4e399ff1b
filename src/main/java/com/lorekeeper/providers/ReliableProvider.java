package com.lorekeeper.providers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Decorator: retry per provider, then fall back to the next provider.
 * Skips retries on non-retryable errors (4xx except 429/408, missing key).
 */
public class ReliableProvider implements ModelProvider {

    private static final Logger log = LoggerFactory.getLogger(ReliableProvider.class);

    private final List<ModelProvider> providers;
    private final ResilientCall retry;

    public ReliableProvider(List<ModelProvider> providers, int maxRetries, long baseDelayMs) {
        this(providers, new ResilientCall(maxRetries, baseDelayMs));
    }

    ReliableProvider(List<ModelProvider> providers, ResilientCall retry) {
        if (providers.isEmpty()) throw new IllegalArgumentException("at least one provider required");
        this.providers = List.copyOf(providers);
        this.retry = retry;
    }

    @Override
    public String id() { return "reliable"; }

    @Override
    public ChatResponse chat(ChatRequest request) {
        var failures = new ArrayList<String>();
        for (int i = 0; i < providers.size(); i++) {
            var provider = providers.get(i);
            try {
                var resp = retry.call(provider.id(), () -> provider.chat(request));
                if (i > 0) log.info("Recovered via provider={}", provider.id());
                return resp;
            } catch (RuntimeException e) {
                failures.add(provider.id() + ": " + ProviderChain.rootMessage(e));
                log.warn("Provider {} failed, trying next", provider.id());
            }
        }
        log.error("All generation providers failed: {}", failures);
        throw new ProviderException(id(), "all providers failed:\n" + String.join("\n", failures));
    }

    public List<String> providerIds() {
        return providers.stream().map(ModelProvider::id).toList();
    }
}
