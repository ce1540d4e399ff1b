package com.lorekeeper.memory;

import com.lorekeeper.observability.MemoryMetrics;
import com.lorekeeper.shared.model.MemoryRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.lorekeeper.memory.MemoryFixtures.journal;
import static com.lorekeeper.memory.MemoryFixtures.vec;
import static com.lorekeeper.memory.MemoryFixtures.wide;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class JournalVectorStoreTest {

    @TempDir Path tempDir;
    private MemoryMetrics metrics;
    private JournalVectorStore store;

    @BeforeEach
    void setUp() {
        metrics = new MemoryMetrics();
        store = new JournalVectorStore(tempDir.resolve("store"), true, metrics);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void ensureReadyIsIdempotentAndCreatesLayout() {
        store.ensureReady();
        store.ensureReady();
        assertThat(tempDir.resolve("store")).isDirectory();
        assertThat(store.acceleratedAvailable()).isTrue();
        assertThat(store.size()).isZero();
    }

    @Test
    void queryUsesAcceleratedIndexWhenComplete() {
        store.insert(vec(1, 0, 0), journal("Aria", "east"));
        store.insert(vec(0, 1, 0), journal("Aria", "north"));
        var handle = store.insert(vec(0.9f, 0.1f, 0), journal("Aria", "mostly east"));
        assertThat(handle.indexed()).isTrue();

        var hits = store.query(vec(1, 0, 0), 2);
        assertThat(hits).hasSize(2);
        assertThat(hits).allMatch(h -> h.path() == SearchPath.ACCELERATED);
        assertThat(hits.get(0).record().summary()).isEqualTo("east");
        assertThat(hits.get(0).distance()).isCloseTo(0.0, within(1e-5));
        assertThat(hits.get(1).record().summary()).isEqualTo("mostly east");
        assertThat(metrics.bruteForceQueries().count()).isZero();
    }

    @Test
    void bothPathsAgreeOnOrderAndDistance() {
        var plain = new JournalVectorStore(tempDir.resolve("plain"), false, metrics);
        try {
            float[][] vectors = {vec(1, 0, 0), vec(0, 1, 0), vec(0.7f, 0.7f, 0), vec(-1, 0.2f, 0), vec(0.2f, 0.1f, 1)};
            for (int i = 0; i < vectors.length; i++) {
                var record = journal("Aria", "m" + i);
                store.insert(vectors[i], record);
                plain.insert(vectors[i], record);
            }
            var query = vec(0.8f, 0.5f, 0.1f);
            var fast = store.query(query, 5);
            var slow = plain.query(query, 5);

            assertThat(fast).allMatch(h -> h.path() == SearchPath.ACCELERATED);
            assertThat(slow).allMatch(h -> h.path() == SearchPath.BRUTE_FORCE);
            assertThat(fast.stream().map(h -> h.record().summary()).toList())
                    .isEqualTo(slow.stream().map(h -> h.record().summary()).toList());
            for (int i = 0; i < fast.size(); i++) {
                assertThat(fast.get(i).distance()).isCloseTo(slow.get(i).distance(), within(1e-4));
            }
        } finally {
            plain.close();
        }
    }

    @Test
    void dimensionIsolationOnBothPaths() {
        var plain = new JournalVectorStore(tempDir.resolve("plain"), false, metrics);
        try {
            for (var s : List.of(store, plain)) {
                s.insert(vec(1, 0, 0), journal("Aria", "three"));
                s.insert(vec(1, 0, 0, 0), journal("Aria", "four"));
                s.insert(vec(0, 1, 0, 0), journal("Aria", "four-b"));
            }
            for (var s : List.of(store, plain)) {
                var hits = s.query(vec(1, 0, 0, 0), 10);
                assertThat(hits).extracting(h -> h.record().summary()).containsExactly("four", "four-b");
                assertThat(s.query(vec(1, 0), 10)).isEmpty();
            }
        } finally {
            plain.close();
        }
    }

    @Test
    void vectorsWiderThanIndexLimitFallBackToBruteForce() {
        var handle = store.insert(wide(1100, 0.1f), journal("Aria", "wide"));
        store.insert(wide(1100, 2.0f), journal("Aria", "other wide"));
        assertThat(handle.indexed()).isFalse();

        var hits = store.query(wide(1100, 0.1f), 1);
        assertThat(hits).hasSize(1);
        assertThat(hits.get(0).record().summary()).isEqualTo("wide");
        assertThat(hits.get(0).path()).isEqualTo(SearchPath.BRUTE_FORCE);
        assertThat(metrics.bruteForceQueries().count()).isEqualTo(1.0);
    }

    @Test
    void insertRejectsEmptyOrNonFiniteEmbeddings() {
        var record = journal("Aria", "x");
        assertThatThrownBy(() -> store.insert(new float[0], record)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.insert(null, record)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.insert(vec(Float.NaN, 1), record)).isInstanceOf(IllegalArgumentException.class);
        assertThat(store.size()).isZero();
    }

    @Test
    void degenerateQueriesReturnNothing() {
        store.insert(vec(1, 0), journal("Aria", "x"));
        assertThat(store.query(new float[0], 3)).isEmpty();
        assertThat(store.query(null, 3)).isEmpty();
        assertThat(store.query(vec(1, 0), 0)).isEmpty();
    }

    @Test
    void deleteByOwnerRemovesOnlyThatOwner() {
        for (int i = 0; i < 3; i++) store.insert(vec(1, i, 0), journal("Aria", "aria " + i));
        for (int i = 0; i < 2; i++) store.insert(vec(0, 1, i), journal("Bob", "bob " + i));

        assertThat(store.deleteByOwner("Aria")).isEqualTo(3);
        assertThat(store.size()).isEqualTo(2);
        var hits = store.query(vec(1, 1, 1), 10);
        assertThat(hits).hasSize(2).allMatch(h -> h.record().owner().equals("Bob"));
        assertThat(hits).allMatch(h -> h.path() == SearchPath.ACCELERATED);
        assertThat(store.deleteByOwner("Nobody")).isZero();
    }

    @Test
    void recordsSurviveReopen() {
        var record = journal("Aria", "remember me", 0.9, 42L);
        store.insert(vec(0.3f, 0.4f, 0.5f), record);
        store.insert(vec(0.5f, 0.4f, 0.3f), journal("Bob", "bob"));
        store.deleteByOwner("Bob");
        store.close();

        var reopened = new JournalVectorStore(tempDir.resolve("store"), true, metrics);
        try {
            assertThat(reopened.size()).isEqualTo(1);
            var hits = reopened.query(vec(0.3f, 0.4f, 0.5f), 5);
            assertThat(hits).extracting(ScoredRecord::record).containsExactly(record);
            assertThat(hits.get(0).path()).isEqualTo(SearchPath.ACCELERATED);
        } finally {
            reopened.close();
        }
    }

    @Test
    void logOnlyModeStillAnswers() {
        var plain = new JournalVectorStore(tempDir.resolve("plain"), false, metrics);
        try {
            var handle = plain.insert(vec(1, 0), journal("Aria", "x"));
            assertThat(handle.indexed()).isFalse();
            assertThat(plain.acceleratedAvailable()).isFalse();
            assertThat(plain.query(vec(1, 0), 1)).singleElement()
                    .satisfies(h -> assertThat(h.path()).isEqualTo(SearchPath.BRUTE_FORCE));
            assertThat(plain.reindex()).isZero();
        } finally {
            plain.close();
        }
    }

    @Test
    void unreadableLogLinesAreSkipped() throws Exception {
        store.insert(vec(1, 0), journal("Aria", "good"));
        store.close();
        Files.writeString(tempDir.resolve("store/records.jsonl"), "{\"id\":\"broken\",\"vec",
                java.nio.file.StandardOpenOption.APPEND);

        var reopened = new JournalVectorStore(tempDir.resolve("store"), true, metrics);
        try {
            assertThat(reopened.size()).isEqualTo(1);
        } finally {
            reopened.close();
        }
    }

    @Test
    void tornMultiByteTailIsSkipped() throws Exception {
        store.insert(vec(1, 0), journal("Aria", "good"));
        store.close();
        var log = tempDir.resolve("store/records.jsonl");
        var partial = "{\"id\":\"x\",\"summary\":\"caf".getBytes(java.nio.charset.StandardCharsets.UTF_8);
        var torn = java.util.Arrays.copyOf(partial, partial.length + 1);
        torn[partial.length] = (byte) 0xC3;
        Files.write(log, torn, java.nio.file.StandardOpenOption.APPEND);

        var reopened = new JournalVectorStore(tempDir.resolve("store"), true, metrics);
        try {
            assertThat(reopened.size()).isEqualTo(1);
            assertThat(reopened.listByOwner("Aria")).extracting(MemoryRecord::summary).containsExactly("good");
            reopened.insert(vec(0, 1), journal("Aria", "after"));
        } finally {
            reopened.close();
        }

        var again = new JournalVectorStore(tempDir.resolve("store"), true, metrics);
        try {
            assertThat(again.listByOwner("Aria")).extracting(MemoryRecord::summary)
                    .containsExactlyInAnyOrder("good", "after");
        } finally {
            again.close();
        }
    }

    @Test
    void listByOwnerIsNewestFirst() {
        store.insert(vec(1, 0), journal("Aria", "old", 0.5, 100L));
        store.insert(vec(0, 1), journal("Aria", "new", 0.5, 300L));
        store.insert(vec(1, 1), journal("Aria", "mid", 0.5, 200L));
        store.insert(vec(1, 1), journal("Bob", "other", 0.5, 400L));

        assertThat(store.listByOwner("Aria")).extracting(MemoryRecord::summary).containsExactly("new", "mid", "old");
    }

    @Test
    void reindexRebuildsMirror() {
        var records = new ArrayList<MemoryRecord>();
        for (int i = 1; i <= 4; i++) {
            var r = journal("Aria", "r" + i);
            records.add(r);
            store.insert(vec(i, 1, 0), r);
        }
        assertThat(store.reindex()).isEqualTo(4);
        assertThat(store.query(vec(4, 1, 0), 1).get(0).record()).isEqualTo(records.get(3));
    }
}
