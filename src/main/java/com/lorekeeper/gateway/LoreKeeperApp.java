package com.lorekeeper.gateway;

import com.lorekeeper.observability.DoctorCommand;
import com.lorekeeper.observability.MemoryMetrics;
import com.lorekeeper.providers.ApiKeyRing;
import com.lorekeeper.retrieval.MemoryFilter;
import com.lorekeeper.shared.config.ConfigLoader;
import com.lorekeeper.shared.config.LoreKeeperConfig;
import com.lorekeeper.shared.model.MemoryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Maintenance CLI over the memory store.
 * <pre>
 *   doctor
 *   reindex
 *   clear &lt;owner&gt;
 *   recall &lt;owner&gt; &lt;message...&gt;
 *   list &lt;owner&gt; [all|important|recent]
 * </pre>
 */
public class LoreKeeperApp {

    private static final Logger log = LoggerFactory.getLogger(LoreKeeperApp.class);

    private final LoreKeeperConfig config;
    private final PrintStream out;

    public LoreKeeperApp(LoreKeeperConfig config, PrintStream out) {
        this.config = config;
        this.out = out;
    }

    public static void main(String[] args) {
        var app = new LoreKeeperApp(ConfigLoader.load(), System.out);
        System.exit(app.run(args));
    }

    public int run(String[] args) {
        if (args.length == 0) {
            usage();
            return 2;
        }
        var metrics = new MemoryMetrics();
        try (var store = MemoryServiceFactory.store(config, metrics)) {
            switch (args[0]) {
                case "doctor" -> out.println(new DoctorCommand(config.storePath(), store,
                        new ApiKeyRing(config.apiKeys()), config.embedding().order()).run());
                case "reindex" -> out.println("Indexed " + store.reindex() + " of " + store.size() + " records");
                case "clear" -> {
                    if (args.length < 2) return usage();
                    out.println("Deleted " + store.deleteByOwner(args[1]) + " records of " + args[1]);
                }
                case "list" -> {
                    if (args.length < 2) return usage();
                    var filter = MemoryFilter.fromName(args.length > 2 ? args[2] : "all");
                    print(filter.apply(store.listByOwner(args[1])));
                }
                case "recall" -> {
                    if (args.length < 3) return usage();
                    var service = MemoryServiceFactory.create(config, store, metrics);
                    var message = String.join(" ", Arrays.copyOfRange(args, 2, args.length));
                    print(service.retrieveRelevantMemories(message, args[1],
                            config.memory().retrievalCount(), config.memory(), List.of()));
                }
                default -> {
                    return usage();
                }
            }
            return 0;
        } catch (RuntimeException e) {
            log.error("Command '{}' failed", args[0], e);
            out.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private void print(List<MemoryRecord> records) {
        if (records.isEmpty()) {
            out.println("(no memories)");
            return;
        }
        for (var r : records) {
            out.printf("%s  %-12s %.2f  %s%n", Instant.ofEpochMilli(r.timestamp()), r.kind().wireName(),
                    r.importance(), r.summary());
        }
    }

    private int usage() {
        out.println("usage: lorekeeper doctor | reindex | clear <owner> | recall <owner> <message...>"
                + " | list <owner> [all|important|recent]");
        return 2;
    }
}
