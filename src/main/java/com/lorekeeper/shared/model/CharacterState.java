package com.lorekeeper.shared.model;

/** Caller-owned state of the persona a memory belongs to. */
public record CharacterState(String name, RelationshipState relationship) {

    public CharacterState {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name must not be blank");
        if (relationship == null) relationship = RelationshipState.NEUTRAL;
    }

    public CharacterState(String name) {
        this(name, RelationshipState.NEUTRAL);
    }

    public CharacterState withRelationship(RelationshipState updated) {
        return new CharacterState(name, updated);
    }
}
