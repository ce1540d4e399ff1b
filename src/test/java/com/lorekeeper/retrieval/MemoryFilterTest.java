package com.lorekeeper.retrieval;

import com.lorekeeper.shared.model.MemoryRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.lorekeeper.memory.MemoryFixtures.journal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemoryFilterTest {

    private final MemoryRecord old = journal("Aria", "old", 0.9, 100L);
    private final MemoryRecord mid = journal("Aria", "mid", 0.7, 200L);
    private final MemoryRecord recent = journal("Aria", "recent", 0.3, 300L);
    private final MemoryRecord newest = journal("Aria", "newest", 0.8, 400L);
    private final List<MemoryRecord> all = List.of(old, mid, recent, newest);

    @Test
    void importantIsStrictlyAboveThreshold() {
        assertThat(MemoryFilter.IMPORTANT.apply(all)).containsExactly(old, newest);
    }

    @Test
    void recentKeepsNewestThree() {
        assertThat(MemoryFilter.RECENT.apply(all)).containsExactly(newest, recent, mid);
    }

    @Test
    void allKeepsEverything() {
        assertThat(MemoryFilter.ALL.apply(all)).isEqualTo(all);
    }

    @Test
    void namesAreCaseInsensitive() {
        assertThat(MemoryFilter.fromName("important")).isEqualTo(MemoryFilter.IMPORTANT);
        assertThat(MemoryFilter.fromName(null)).isEqualTo(MemoryFilter.ALL);
        assertThatThrownBy(() -> MemoryFilter.fromName("loud")).isInstanceOf(IllegalArgumentException.class);
    }
}
