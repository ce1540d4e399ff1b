package com.lorekeeper.providers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Fixed provider order, rotated to start at a preferred id. Each provider is
 * tried at most once per call; failures are logged and accumulated.
 */
public class ProviderChain<P> {

    private static final Logger log = LoggerFactory.getLogger(ProviderChain.class);

    private final String capability;
    private final List<P> providers;
    private final Function<P, String> idOf;

    public ProviderChain(String capability, List<P> providers, Function<P, String> idOf) {
        this.capability = capability;
        this.providers = List.copyOf(providers);
        this.idOf = idOf;
    }

    public List<P> providers() {
        return providers;
    }

    public List<String> ids() {
        return providers.stream().map(idOf).toList();
    }

    /** The provider list rotated so that {@code preferredId} comes first. */
    public List<P> rotation(String preferredId) {
        int start = 0;
        if (preferredId != null) {
            start = ids().indexOf(preferredId);
            if (start < 0) {
                log.warn("Unknown {} provider '{}', starting at {}", capability, preferredId,
                        providers.isEmpty() ? "-" : idOf.apply(providers.get(0)));
                start = 0;
            }
        }
        var rotated = new ArrayList<P>(providers.size());
        for (int i = 0; i < providers.size(); i++) {
            rotated.add(providers.get((start + i) % providers.size()));
        }
        return rotated;
    }

    /**
     * Returns the first result accepted by {@code call}. A thrown exception or an
     * empty Optional counts as a failure and moves to the next provider.
     */
    public <T> Optional<T> firstSuccess(String preferredId, Function<P, Optional<T>> call) {
        var failures = new ArrayList<String>();
        for (var provider : rotation(preferredId)) {
            var id = idOf.apply(provider);
            try {
                var result = call.apply(provider);
                if (result.isPresent()) {
                    if (!failures.isEmpty()) {
                        log.info("{} recovered via provider={}", capability, id);
                    }
                    return result;
                }
                failures.add(id + ": empty result");
                log.warn("{} provider {} returned nothing, trying next", capability, id);
            } catch (RuntimeException e) {
                failures.add(id + ": " + rootMessage(e));
                log.warn("{} provider {} failed, trying next: {}", capability, id, rootMessage(e));
            }
        }
        log.error("All {} providers failed:\n{}", capability, String.join("\n", failures));
        return Optional.empty();
    }

    static String rootMessage(Throwable t) {
        while (t.getCause() != null) t = t.getCause();
        return t.getMessage();
    }
}
