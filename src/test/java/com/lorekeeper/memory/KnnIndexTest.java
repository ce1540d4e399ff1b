package com.lorekeeper.memory;

import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FilterDirectory;
import org.apache.lucene.store.LockObtainFailedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static com.lorekeeper.memory.MemoryFixtures.vec;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KnnIndexTest {

    @TempDir Path tempDir;

    static class CloseTrackingDirectory extends FilterDirectory {
        boolean closed;

        CloseTrackingDirectory(Directory in) {
            super(in);
        }

        @Override
        public void close() throws IOException {
            closed = true;
            super.close();
        }
    }

    @Test
    void directoryIsReleasedWhenWriteLockIsTaken() throws Exception {
        var shared = new ByteBuffersDirectory();
        var tracking = new CloseTrackingDirectory(shared);
        try (var held = shared.obtainLock(IndexWriter.WRITE_LOCK_NAME)) {
            assertThatThrownBy(() -> new KnnIndex(tracking)).isInstanceOf(LockObtainFailedException.class);
        }
        assertThat(tracking.closed).isTrue();
    }

    @Test
    void secondWriterOnSamePathFailsUntilFirstCloses() throws Exception {
        var path = tempDir.resolve("knn");
        var first = new KnnIndex(path);
        first.add("a", "Aria", vec(1, 0));
        assertThatThrownBy(() -> new KnnIndex(path)).isInstanceOf(LockObtainFailedException.class);
        first.close();

        try (var reopened = new KnnIndex(path)) {
            assertThat(reopened.liveDocs()).isEqualTo(1);
            assertThat(reopened.search(vec(1, 0), 1)).extracting(KnnIndex.Hit::id).containsExactly("a");
        }
    }
}
