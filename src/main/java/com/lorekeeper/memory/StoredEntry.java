package com.lorekeeper.memory;

import com.lorekeeper.shared.model.MemoryRecord;

/** One line of {@code records.jsonl}. */
public record StoredEntry(String id, float[] vector, MemoryRecord record) {}
