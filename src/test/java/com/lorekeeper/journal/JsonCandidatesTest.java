package com.lorekeeper.journal;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonCandidatesTest {

    private static final List<String> KEYS = JournalAnalysis.REQUIRED_KEYS;

    @Test
    void picksCandidateNamingMostRequiredKeys() {
        var text = """
            Example format: {"note": "ignore me"}
            Answer: {"summary": "They met.", "topics": [], "importance": 3}
            """;
        assertEquals("{\"summary\": \"They met.\", \"topics\": [], \"importance\": 3}",
                JsonCandidates.best(text, KEYS).orElseThrow());
    }

    @Test
    void outerObjectBeatsItsNestedParts() {
        var text = "{\"summary\": \"s\", \"emotions\": {\"positive\": 0.5}}";
        assertEquals(text, JsonCandidates.best(text, KEYS).orElseThrow());
        assertEquals(2, JsonCandidates.balancedObjects(text).size());
    }

    @Test
    void longerSpanBreaksTies() {
        assertEquals("{\"x\": 12345}", JsonCandidates.best("{\"x\": 1} then {\"x\": 12345}", KEYS).orElseThrow());
    }

    @Test
    void bracesInsideStringsDoNotCloseTheObject() {
        var json = "{\"summary\": \"a } b { c\", \"topics\": []}";
        assertEquals(json, JsonCandidates.best("prefix " + json + " suffix", KEYS).orElseThrow());
    }

    @Test
    void fallsBackToWidestSpanWhenNothingBalances() {
        var unterminated = "say {\"summary\": \"open } end";
        assertEquals("{\"summary\": \"open }", JsonCandidates.best(unterminated, KEYS).orElseThrow());
        assertTrue(JsonCandidates.best("no json here", KEYS).isEmpty());
        assertTrue(JsonCandidates.best("{\"summary\": \"open", KEYS).isEmpty());
        assertTrue(JsonCandidates.best(null, KEYS).isEmpty());
    }

    @Test
    void keyScoreCountsQuotedKeys() {
        assertEquals(2, JsonCandidates.keyScore("{\"summary\": 1, \"topics\": 2, topics: 3}", KEYS));
    }
}
