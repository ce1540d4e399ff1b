package com.lorekeeper.core;

import com.lorekeeper.shared.model.MemoryKind;
import com.lorekeeper.shared.model.RelationshipState;

import java.util.List;

public record RecycleResult(
    boolean success,
    int memoriesCreated,
    int chunksFailed,
    List<MemoryKind> seeded,
    RelationshipState relationship,
    String error
) {
    static RecycleResult failed(String error, RelationshipState relationship) {
        return new RecycleResult(false, 0, 0, List.of(), relationship, error);
    }
}
