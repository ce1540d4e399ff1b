package com.lorekeeper.journal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lorekeeper.shared.model.Emotions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class JournalAnalysisTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private Optional<JournalAnalysis> parse(String json) throws Exception {
        return JournalAnalysis.fromJson(mapper.readTree(json), "Alex", "Aria");
    }

    @Test
    void acceptsCompleteAnalysis() throws Exception {
        var analysis = parse("""
            {"summary": " Aria met Alex at the tavern. ",
             "emotions": {"positive": 0.6, "negative": 0.1, "neutral": 0.3},
             "decisions": ["Aria offered a room"],
             "topics": ["tavern", "travel"],
             "importance": 4,
             "relationshipDelta": 0.2,
             "conversationDrivers": ["Alex asked for shelter"],
             "participants": ["Alex", "Aria", "Innkeeper"],
             "plotElements": ["the storm"]}
            """).orElseThrow();

        assertThat(analysis.summary()).isEqualTo("Aria met Alex at the tavern.");
        assertThat(analysis.emotions()).isEqualTo(new Emotions(0.6, 0.1, 0.3));
        assertThat(analysis.decisions()).containsExactly("Aria offered a room");
        assertThat(analysis.importance()).isEqualTo(4.0);
        assertThat(analysis.relationshipDelta()).isEqualTo(0.2);
        assertThat(analysis.participants()).containsExactly("Alex", "Aria", "Innkeeper");
        assertThat(analysis.plotElements()).containsExactly("the storm");
        assertThat(analysis.conversationDrivers()).containsExactly("Alex asked for shelter");
    }

    @Test
    void optionalListsDefault() throws Exception {
        var analysis = parse("""
            {"summary": "s", "emotions": {}, "decisions": [], "topics": [], "importance": 5, "relationshipDelta": 0}
            """).orElseThrow();

        assertThat(analysis.participants()).isEqualTo(List.of("Alex", "Aria"));
        assertThat(analysis.plotElements()).isEmpty();
        assertThat(analysis.conversationDrivers()).isEmpty();
        assertThat(analysis.emotions()).isEqualTo(Emotions.NONE);
    }

    @Test
    void rejectsWrongShapes() throws Exception {
        var valid = "\"emotions\": {}, \"decisions\": [], \"topics\": [], \"relationshipDelta\": 0";
        assertThat(parse("{\"summary\": \"\", " + valid + ", \"importance\": 5}")).isEmpty();
        assertThat(parse("{\"summary\": \"s\", " + valid + ", \"importance\": \"high\"}")).isEmpty();
        assertThat(parse("{\"summary\": \"s\", " + valid + "}")).isEmpty();
        assertThat(parse("{\"summary\": \"s\", \"emotions\": [], \"decisions\": [], \"topics\": [],"
                + " \"importance\": 5, \"relationshipDelta\": 0}")).isEmpty();
        assertThat(parse("[1, 2]")).isEmpty();
    }
}
