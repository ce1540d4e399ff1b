package com.lorekeeper.providers;

/** Turns text into a dense vector. Implementations throw on failure instead of returning null. */
public interface EmbeddingProvider {
    String id();
    float[] embed(String text);
}
