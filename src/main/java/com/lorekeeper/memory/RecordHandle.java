package com.lorekeeper.memory;

/** Result of an insert. {@code indexed} is false when only the log holds the entry. */
public record RecordHandle(String id, boolean indexed) {}
