package com.lorekeeper.journal;

import com.lorekeeper.shared.model.ChatTurn;

import java.util.List;
import java.util.stream.Collectors;

final class AnalysisPrompt {

    private AnalysisPrompt() {}

    static String render(List<ChatTurn> turns, String ownerName, String userName) {
        return turns.stream()
                .map(t -> (t.isUser() ? userName : ownerName) + ": " + t.content())
                .collect(Collectors.joining("\n"));
    }

    static String build(List<ChatTurn> turns, String ownerName, String userName) {
        return """
            Analyze the following conversation chunk involving %1$s. Focus specifically on decisive \
            actions, strong opinions, and how the character drove the conversation.

            Respond STRICTLY in JSON format with the following keys:
            - "summary": A brief 1-2 sentence summary emphasizing decisive moments and actions.
            - "emotions": An object with the character's emotions (e.g., {"positive": 0.7, "negative": 0.1, "neutral": 0.2})
            - "decisions": An array of definitive stances, clear choices, or bold actions taken by %1$s
            - "topics": An array of main topics discussed, especially those %1$s feels strongly about
            - "importance": A score from 1 (low) to 10 (high) indicating the memory's significance
            - "relationshipDelta": Estimated change in sentiment towards %2$s (-1.0 to +1.0) based ONLY on this chunk
            - "conversationDrivers": An array of statements, questions or challenges that moved the interaction forward
            - "participants": An array of the names of everyone taking part
            - "plotElements": An array of story events, places or objects introduced in this chunk

            Rate the importance highest (8-10) when the character made unambiguous decisions \
            or took control of the conversation direction.

            Conversation Chunk:
            ---
            %3$s
            ---
            JSON Response:""".formatted(ownerName, userName, render(turns, ownerName, userName));
    }
}
