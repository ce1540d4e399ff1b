package com.lorekeeper.providers;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderChainTest {

    private final ProviderChain<String> chain =
            new ProviderChain<>("test", List.of("gemini", "nvidia", "mistral", "cohere"), Function.identity());

    @Test
    void rotatesFromPreferredProvider() {
        assertThat(chain.rotation("mistral")).containsExactly("mistral", "cohere", "gemini", "nvidia");
        assertThat(chain.rotation("gemini")).containsExactly("gemini", "nvidia", "mistral", "cohere");
    }

    @Test
    void unknownPreferredStartsAtFirst() {
        assertThat(chain.rotation("openai")).containsExactly("gemini", "nvidia", "mistral", "cohere");
        assertThat(chain.rotation(null)).containsExactly("gemini", "nvidia", "mistral", "cohere");
    }

    @Test
    void triesEachProviderOnceInRotationOrder() {
        var tried = new ArrayList<String>();
        Optional<String> result = chain.firstSuccess("nvidia", id -> {
            tried.add(id);
            if (id.equals("cohere")) return Optional.of("vector from " + id);
            if (id.equals("mistral")) return Optional.empty();
            throw new ProviderException(id, 500, "down");
        });
        assertThat(result).contains("vector from cohere");
        assertThat(tried).containsExactly("nvidia", "mistral", "cohere");
    }

    @Test
    void exhaustionReturnsEmptyAfterOneAttemptEach() {
        var tried = new ArrayList<String>();
        Optional<String> result = chain.firstSuccess("cohere", id -> {
            tried.add(id);
            throw new IllegalStateException("nope");
        });
        assertThat(result).isEmpty();
        assertThat(tried).containsExactly("cohere", "gemini", "nvidia", "mistral");
    }

    @Test
    void sameInputsGiveSameOrder() {
        var first = new ArrayList<String>();
        var second = new ArrayList<String>();
        chain.firstSuccess("mistral", id -> { first.add(id); return Optional.empty(); });
        chain.firstSuccess("mistral", id -> { second.add(id); return Optional.empty(); });
        assertThat(first).isEqualTo(second);
    }
}
