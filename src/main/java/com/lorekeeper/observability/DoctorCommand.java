package com.lorekeeper.observability;

import com.lorekeeper.memory.VectorStore;
import com.lorekeeper.memory.VectorStoreException;
import com.lorekeeper.providers.ApiKeyRing;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class DoctorCommand {

    private final Path storeDirectory;
    private final VectorStore store;
    private final ApiKeyRing keys;
    private final List<String> embeddingOrder;

    public DoctorCommand(Path storeDirectory, VectorStore store, ApiKeyRing keys, List<String> embeddingOrder) {
        this.storeDirectory = storeDirectory;
        this.store = store;
        this.keys = keys;
        this.embeddingOrder = List.copyOf(embeddingOrder);
    }

    public String run() {
        var results = new ArrayList<String>();
        results.add(checkStoreDirectory());
        results.addAll(checkStore());
        results.add(checkEmbeddingKeys());
        results.add(checkJavaVersion());
        return String.join("\n", results);
    }

    private String checkStoreDirectory() {
        return Files.isDirectory(storeDirectory)
                ? "[OK] Memory store directory " + storeDirectory
                : "[WARN] Memory store directory not found (will be created on first use): " + storeDirectory;
    }

    private List<String> checkStore() {
        try {
            int size = store.size();
            var accelerated = store.acceleratedAvailable()
                    ? "[OK] Accelerated index available"
                    : "[WARN] Accelerated index unavailable, queries use brute force";
            return List.of("[OK] " + size + " memory records", accelerated);
        } catch (VectorStoreException e) {
            return List.of("[FAIL] Memory store: " + e.getMessage());
        }
    }

    private String checkEmbeddingKeys() {
        var configured = embeddingOrder.stream().filter(keys::hasKey).toList();
        if (configured.isEmpty()) {
            return "[FAIL] No embedding provider has an API key (order: " + String.join(", ", embeddingOrder) + ")";
        }
        return "[OK] Embedding keys: " + String.join(", ", configured);
    }

    private String checkJavaVersion() {
        var ver = Runtime.version().feature();
        return ver >= 17
                ? "[OK] Java " + ver
                : "[WARN] Java " + ver + " (17+ required)";
    }
}
