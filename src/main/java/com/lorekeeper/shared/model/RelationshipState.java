package com.lorekeeper.shared.model;

/**
 * Sentiment of a character towards the user. Produced by journal building,
 * persisted by the caller.
 */
public record RelationshipState(double sentiment, RelationshipStatus status) {

    public static final RelationshipState NEUTRAL = new RelationshipState(0.0, RelationshipStatus.NEUTRAL);

    public RelationshipState {
        if (status == null) status = RelationshipStatus.fromSentiment(sentiment);
    }

    public static RelationshipState of(double sentiment) {
        var normalized = round2(clamp(sentiment));
        return new RelationshipState(normalized, RelationshipStatus.fromSentiment(normalized));
    }

    public RelationshipState apply(double delta) {
        if (!Double.isFinite(delta)) delta = 0.0;
        return of(sentiment + delta);
    }

    private static double clamp(double value) {
        return Math.max(-1.0, Math.min(1.0, value));
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
