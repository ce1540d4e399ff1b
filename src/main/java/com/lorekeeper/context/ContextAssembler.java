package com.lorekeeper.context;

import com.lorekeeper.observability.MemoryMetrics;
import com.lorekeeper.shared.model.ChatTurn;
import com.lorekeeper.shared.model.MemoryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Packs persona, scenario, memories, recent history and the user query into
 * chat messages that fit a token budget.
 */
public class ContextAssembler {

    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    static final int SAFETY_MARGIN = 100;
    static final double MEMORY_SHARE = 0.7;
    static final int MIN_MEMORY_BUDGET = 50;
    static final int RAISED_MEMORY_BUDGET = 100;
    static final String MEMORY_HEADER = "MEMORIES (Important decisions and opinions you've expressed):\n";
    static final String NO_MEMORIES = "MEMORIES: No previous memories relevant to current conversation.";

    private static final Pattern USER_PLACEHOLDER = Pattern.compile("(?i)\\{\\{user\\}\\}");
    private static final long DAY_MS = 24L * 60 * 60 * 1000;

    private final TokenEstimator tokens;
    private final MemoryMetrics metrics;
    private final Clock clock;
    private final String userName;
    private final int historyMessageCount;

    public ContextAssembler(TokenEstimator tokens, MemoryMetrics metrics, Clock clock,
                            String userName, int historyMessageCount) {
        this.tokens = tokens;
        this.metrics = metrics;
        this.clock = clock;
        this.userName = userName;
        this.historyMessageCount = historyMessageCount;
    }

    public PromptContext buildContext(String persona, String scenario, String query,
                                      List<MemoryRecord> memories, List<ChatTurn> history, int tokenBudget) {
        var turns = history != null ? history : List.<ChatTurn>of();
        var messages = new ArrayList<Map<String, Object>>();

        var personaText = "PERSONA:\n" + replaceUser(persona);
        messages.add(message("system", personaText));
        int baseTokens = tokens.estimate(personaText);

        if (turns.isEmpty() && scenario != null && !scenario.isBlank()) {
            var scenarioText = "CURRENT SITUATION:\n" + replaceUser(scenario);
            messages.add(message("system", scenarioText));
            baseTokens += tokens.estimate(scenarioText);
        }

        int queryTokens = tokens.estimate(query);
        int remaining = tokenBudget - baseTokens - queryTokens - SAFETY_MARGIN;
        int memoryBudget = (int) Math.floor(remaining * MEMORY_SHARE);

        var section = formatMemories(memories, memoryBudget);
        messages.add(message("system", section.text()));
        baseTokens += section.tokens();
        log.debug("Memory context: {} memories offered, {} included, {} tokens",
                memories == null ? 0 : memories.size(), section.includedCount(), section.tokens());

        var packed = packHistory(turns, tokenBudget - baseTokens - queryTokens - SAFETY_MARGIN);
        for (var turn : packed) {
            messages.add(turn.toMessage());
        }
        messages.add(message("user", query != null ? query : ""));

        int estimated = messages.stream()
                .mapToInt(m -> tokens.estimate(String.valueOf(m.get("content"))))
                .sum();
        return new PromptContext(List.copyOf(messages), section, estimated);
    }

    /**
     * Bulleted memory block, decisions first and then by importance. When the
     * first memory does not fit it is cut to the remaining budget; any later
     * memory that does not fit ends the block.
     */
    public MemorySection formatMemories(List<MemoryRecord> memories, int maxTokens) {
        if (memories == null || memories.isEmpty()) {
            return new MemorySection(NO_MEMORIES, 0, tokens.estimate(NO_MEMORIES), false, false);
        }
        int requested = maxTokens;
        if (maxTokens < MIN_MEMORY_BUDGET) {
            log.warn("Memory token budget too small ({}), raising to {}", maxTokens, RAISED_MEMORY_BUDGET);
            maxTokens = RAISED_MEMORY_BUDGET;
        }

        var sorted = new ArrayList<>(memories);
        sorted.sort(Comparator.comparing((MemoryRecord m) -> !m.hasDecisions())
                .thenComparing(Comparator.comparingDouble(MemoryRecord::importance).reversed()));

        var text = new StringBuilder(MEMORY_HEADER);
        int used = tokens.estimate(MEMORY_HEADER);
        int included = 0;
        boolean truncated = false;

        for (var memory : sorted) {
            var timeAgo = timeAgo(memory.timestamp());
            var marker = memory.importance() > 0.7 ? "★ " : "";
            var line = "• " + marker + timeAgo + ": " + memory.summary() + "\n";
            int lineTokens = tokens.estimate(line);

            if (used + lineTokens > maxTokens) {
                if (included == 0 && used < maxTokens) {
                    int chars = Math.max(0, (maxTokens - used - 10) * 4);
                    var summary = memory.summary();
                    var cut = summary.substring(0, Math.min(chars, summary.length()));
                    var cutLine = "• " + timeAgo + ": " + cut + "...\n";
                    text.append(cutLine);
                    used += tokens.estimate(cutLine);
                    included++;
                    truncated = true;
                }
                break;
            }
            text.append(line);
            used += lineTokens;
            included++;

            used = appendIfFits(text, used, maxTokens, memory.decisions(), "  → Your decisions: ", "; ");
            used = appendIfFits(text, used, maxTokens, memory.participants(), "  → Participants: ", ", ");
            used = appendIfFits(text, used, maxTokens, memory.plotElements(), "  → Plot: ", "; ");
        }

        boolean starved = included == 0 && requested >= MIN_MEMORY_BUDGET;
        if (starved) {
            log.warn("{} memories available but none fit the memory section (budget {}), check token budget",
                    memories.size(), maxTokens);
            metrics.memoriesStarved().increment();
        }
        log.debug("Formatted {} memories using {} tokens (limit: {})", included, used, maxTokens);
        return new MemorySection(text.toString(), included, used, truncated, starved);
    }

    private int appendIfFits(StringBuilder text, int used, int maxTokens, List<String> items,
                             String prefix, String separator) {
        if (items.isEmpty()) return used;
        var line = prefix + String.join(separator, items) + "\n";
        int lineTokens = tokens.estimate(line);
        if (used + lineTokens > maxTokens) return used;
        text.append(line);
        return used + lineTokens;
    }

    /** Newest turns first until either budget runs out, returned in chronological order. */
    List<ChatTurn> packHistory(List<ChatTurn> history, int budget) {
        var picked = new ArrayList<ChatTurn>();
        int used = 0;
        for (int i = history.size() - 1; i >= 0 && picked.size() < historyMessageCount; i--) {
            var turn = history.get(i);
            if (!turn.isConversational()) continue;
            int cost = tokens.estimate(turn.content());
            if (used + cost > budget) break;
            picked.add(0, turn);
            used += cost;
        }
        return picked;
    }

    String timeAgo(long timestamp) {
        long days = Math.floorDiv(clock.millis() - timestamp, DAY_MS);
        if (days <= 0) return "Earlier today";
        if (days == 1) return "Yesterday";
        if (days < 7) return days + " days ago";
        if (days < 30) return (days / 7) + " weeks ago";
        return (days / 30) + " months ago";
    }

    private String replaceUser(String text) {
        return text == null ? "" : USER_PLACEHOLDER.matcher(text).replaceAll(Matcher.quoteReplacement(userName));
    }

    private static Map<String, Object> message(String role, String content) {
        var msg = new LinkedHashMap<String, Object>();
        msg.put("role", role);
        msg.put("content", content);
        return msg;
    }
}
