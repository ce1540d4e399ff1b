package com.lorekeeper.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lorekeeper.observability.MemoryMetrics;
import com.lorekeeper.shared.model.MemoryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * File-backed {@link VectorStore}: {@code records.jsonl} holds every entry,
 * {@code knn/} holds a Lucene mirror used when it is complete for the query's
 * dimension. Anything else is answered by brute-force cosine over the cache.
 */
public class JournalVectorStore implements VectorStore {

    private static final Logger log = LoggerFactory.getLogger(JournalVectorStore.class);

    private final Path directory;
    private final boolean acceleratedEnabled;
    private final MemoryMetrics metrics;
    private final RecordLog recordLog;
    private final Map<String, StoredEntry> cache = new LinkedHashMap<>();
    private KnnIndex index;
    private volatile boolean ready;

    public JournalVectorStore(Path directory) {
        this(directory, true, new MemoryMetrics());
    }

    public JournalVectorStore(Path directory, boolean acceleratedEnabled, MemoryMetrics metrics) {
        this.directory = directory;
        this.acceleratedEnabled = acceleratedEnabled;
        this.metrics = metrics;
        this.recordLog = new RecordLog(directory.resolve("records.jsonl"), new ObjectMapper());
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void ensureReady() {
        if (ready) return;
        synchronized (this) {
            if (ready) return;
            try {
                Files.createDirectories(directory);
                for (var entry : recordLog.readAll()) {
                    cache.put(entry.id(), entry);
                }
            } catch (IOException e) {
                log.error("Failed to open memory store at {}", directory, e);
                throw new VectorStoreException("Failed to open memory store: " + directory, e);
            }
            if (acceleratedEnabled) {
                openIndex();
            } else {
                log.info("Accelerated index disabled, running log-only");
            }
            ready = true;
            log.info("Memory store ready: {} records, accelerated={}", cache.size(), index != null);
        }
    }

    private void openIndex() {
        try {
            index = new KnnIndex(directory.resolve("knn"));
            int indexable = (int) cache.values().stream()
                    .filter(e -> e.vector().length <= KnnIndex.MAX_DIMENSIONS)
                    .count();
            int live = index.liveDocs();
            if (live != indexable) {
                log.warn("Accelerated index out of sync ({} docs, {} records), rebuilding", live, indexable);
                rebuildIndex();
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Accelerated index unavailable, running log-only: {}", e.getMessage());
            closeIndexQuietly();
        }
    }

    @Override
    public RecordHandle insert(float[] embedding, MemoryRecord record) {
        if (embedding == null || embedding.length == 0) {
            throw new IllegalArgumentException("embedding must not be empty");
        }
        if (!VectorMath.isFinite(embedding)) {
            throw new IllegalArgumentException("embedding contains non-finite values");
        }
        if (record == null) throw new IllegalArgumentException("record must not be null");
        ensureReady();

        synchronized (this) {
            var entry = new StoredEntry(record.id(), embedding.clone(), record);
            try {
                recordLog.append(entry);
            } catch (IOException e) {
                log.error("Failed to append record {} to {}", record.id(), recordLog.file(), e);
                throw new VectorStoreException("Failed to persist record " + record.id(), e);
            }
            cache.put(entry.id(), entry);

            boolean indexed = false;
            if (index != null) {
                try {
                    index.add(entry.id(), record.owner(), entry.vector());
                    indexed = true;
                } catch (IOException | RuntimeException e) {
                    log.warn("Record {} ({} dims) stored but not indexed: {}",
                            record.id(), embedding.length, e.getMessage());
                }
            }
            log.debug("Inserted {} kind={} owner={} indexed={}", record.id(), record.kind(), record.owner(), indexed);
            return new RecordHandle(entry.id(), indexed);
        }
    }

    @Override
    public List<ScoredRecord> query(float[] vector, int k) {
        if (vector == null || vector.length == 0 || k <= 0) return List.of();
        ensureReady();

        synchronized (this) {
            int dimension = vector.length;
            int expected = (int) cache.values().stream()
                    .filter(e -> e.vector().length == dimension)
                    .count();
            if (expected == 0) return List.of();

            var accelerated = queryAccelerated(vector, k, expected);
            if (accelerated != null) return accelerated;

            metrics.bruteForceQueries().increment();
            var scored = new ArrayList<ScoredRecord>(expected);
            for (var entry : cache.values()) {
                if (entry.vector().length != dimension) continue;
                scored.add(new ScoredRecord(entry.record(),
                        VectorMath.cosineDistance(vector, entry.vector()), SearchPath.BRUTE_FORCE));
            }
            scored.sort(Comparator.comparingDouble(ScoredRecord::distance));
            return List.copyOf(scored.subList(0, Math.min(k, scored.size())));
        }
    }

    /** Returns null when the mirror cannot answer exactly for this dimension. */
    private List<ScoredRecord> queryAccelerated(float[] vector, int k, int expected) {
        if (index == null || VectorMath.isZero(vector) || !VectorMath.isFinite(vector)) return null;
        try {
            if (index.count(vector.length) != expected) {
                log.debug("Index incomplete for {} dims, using brute force", vector.length);
                return null;
            }
            var results = new ArrayList<ScoredRecord>();
            for (var hit : index.search(vector, Math.min(k, expected))) {
                var entry = cache.get(hit.id());
                if (entry == null) {
                    log.warn("Index returned unknown id {}, using brute force", hit.id());
                    return null;
                }
                results.add(new ScoredRecord(entry.record(), hit.distance(), SearchPath.ACCELERATED));
            }
            return results;
        } catch (IOException | RuntimeException e) {
            log.warn("Accelerated query failed, using brute force: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public int deleteByOwner(String owner) {
        ensureReady();
        synchronized (this) {
            var remaining = new ArrayList<StoredEntry>();
            int removed = 0;
            for (var entry : cache.values()) {
                if (entry.record().owner().equals(owner)) removed++;
                else remaining.add(entry);
            }
            if (removed == 0) return 0;

            try {
                recordLog.rewrite(remaining);
            } catch (IOException e) {
                log.error("Failed to rewrite {} while deleting owner {}", recordLog.file(), owner, e);
                throw new VectorStoreException("Failed to delete records of " + owner, e);
            }
            cache.values().removeIf(e -> e.record().owner().equals(owner));

            if (index != null) {
                try {
                    index.deleteOwner(owner);
                } catch (IOException | RuntimeException e) {
                    log.warn("Failed to remove {} from accelerated index: {}", owner, e.getMessage());
                }
            }
            log.info("Deleted {} records of {}", removed, owner);
            return removed;
        }
    }

    @Override
    public List<MemoryRecord> listByOwner(String owner) {
        ensureReady();
        synchronized (this) {
            return cache.values().stream()
                    .map(StoredEntry::record)
                    .filter(r -> r.owner().equals(owner))
                    .sorted(Comparator.comparingLong(MemoryRecord::timestamp).reversed())
                    .toList();
        }
    }

    @Override
    public int size() {
        ensureReady();
        synchronized (this) {
            return cache.size();
        }
    }

    @Override
    public int reindex() {
        ensureReady();
        synchronized (this) {
            if (index == null) {
                if (!acceleratedEnabled) return 0;
                openIndex();
                return index != null ? countIndexed() : 0;
            }
            try {
                return rebuildIndex();
            } catch (IOException e) {
                log.error("Reindex failed", e);
                throw new VectorStoreException("Failed to rebuild accelerated index", e);
            }
        }
    }

    private int countIndexed() {
        try {
            return index.liveDocs();
        } catch (IOException e) {
            log.warn("Could not count indexed documents: {}", e.getMessage());
            return 0;
        }
    }

    private int rebuildIndex() throws IOException {
        index.clear();
        int indexed = 0;
        for (var entry : cache.values()) {
            try {
                index.add(entry.id(), entry.record().owner(), entry.vector());
                indexed++;
            } catch (IOException | RuntimeException e) {
                log.warn("Record {} not indexed: {}", entry.id(), e.getMessage());
            }
        }
        log.info("Rebuilt accelerated index: {}/{} vectors", indexed, cache.size());
        return indexed;
    }

    @Override
    public boolean acceleratedAvailable() {
        ensureReady();
        return index != null;
    }

    @Override
    public synchronized void close() {
        closeIndexQuietly();
        cache.clear();
        ready = false;
    }

    private void closeIndexQuietly() {
        if (index == null) return;
        try {
            index.close();
        } catch (IOException e) {
            log.warn("Failed to close accelerated index: {}", e.getMessage());
        }
        index = null;
    }
}
