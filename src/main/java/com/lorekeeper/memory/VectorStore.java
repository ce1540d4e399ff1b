package com.lorekeeper.memory;

import com.lorekeeper.shared.model.MemoryRecord;

import java.util.List;

/**
 * Durable store of (embedding, record) pairs with nearest-neighbour lookup.
 * Every operation calls {@link #ensureReady()} itself.
 */
public interface VectorStore extends AutoCloseable {

    void ensureReady();

    /**
     * @throws IllegalArgumentException for an empty or non-finite embedding
     * @throws VectorStoreException when the entry could not be made durable
     */
    RecordHandle insert(float[] embedding, MemoryRecord record);

    /** Nearest records of the same dimension as {@code vector}, best first. */
    List<ScoredRecord> query(float[] vector, int k);

    int deleteByOwner(String owner);

    /** Newest first. */
    List<MemoryRecord> listByOwner(String owner);

    int size();

    /** Rebuilds the accelerated index from the log; returns the number of vectors indexed. */
    int reindex();

    boolean acceleratedAvailable();

    @Override
    void close();
}
