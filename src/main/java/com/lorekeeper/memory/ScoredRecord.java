package com.lorekeeper.memory;

import com.lorekeeper.shared.model.MemoryRecord;

/** A query hit. {@code distance} is {@code 1 - cosine}; lower is closer. */
public record ScoredRecord(MemoryRecord record, double distance, SearchPath path) {}
