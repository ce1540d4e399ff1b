package com.lorekeeper.retrieval;

import com.lorekeeper.shared.model.MemoryRecord;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/** Browsing views over an owner's memories. */
public enum MemoryFilter {
    ALL,
    IMPORTANT,
    RECENT;

    static final double IMPORTANT_THRESHOLD = 0.7;
    static final int RECENT_COUNT = 3;

    public List<MemoryRecord> apply(List<MemoryRecord> records) {
        return switch (this) {
            case ALL -> List.copyOf(records);
            case IMPORTANT -> records.stream()
                    .filter(r -> r.importance() > IMPORTANT_THRESHOLD)
                    .toList();
            case RECENT -> records.stream()
                    .sorted(Comparator.comparingLong(MemoryRecord::timestamp).reversed())
                    .limit(RECENT_COUNT)
                    .toList();
        };
    }

    public static MemoryFilter fromName(String name) {
        return name == null ? ALL : valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
