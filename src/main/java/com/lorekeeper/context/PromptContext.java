package com.lorekeeper.context;

import java.util.List;
import java.util.Map;

public record PromptContext(List<Map<String, Object>> messages, MemorySection memorySection, int estimatedTokens) {}
