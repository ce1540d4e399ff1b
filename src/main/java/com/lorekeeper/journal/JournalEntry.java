package com.lorekeeper.journal;

import com.lorekeeper.memory.RecordHandle;
import com.lorekeeper.shared.model.MemoryRecord;
import com.lorekeeper.shared.model.RelationshipState;

/** A stored journal record plus the relationship state the caller should persist. */
public record JournalEntry(MemoryRecord record, RelationshipState updatedRelationship, RecordHandle handle) {}
