package com.lorekeeper.context;

/**
 * The formatted memory block. {@code starved} marks a section that had memories
 * and budget but still ended up without a single memory line.
 */
public record MemorySection(String text, int includedCount, int tokens, boolean truncatedFirst, boolean starved) {}
