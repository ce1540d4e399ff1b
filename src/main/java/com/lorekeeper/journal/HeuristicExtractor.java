package com.lorekeeper.journal;

import com.lorekeeper.shared.model.Emotions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort analysis read straight from text when no usable JSON came back.
 * Every extractor reports which branch produced its value.
 */
public final class HeuristicExtractor {

    private static final Logger log = LoggerFactory.getLogger(HeuristicExtractor.class);

    public record Finding<T>(T value, String branch) {}

    static final int MIN_SENTENCE_LENGTH = 20;
    static final int MAX_ITEMS = 5;

    private static final Pattern SUMMARY_KEY = Pattern.compile("\"summary\"\\s*:\\s*\"((?:[^\"\\\\]|\\\\.)*)\"");
    private static final Pattern IMPORTANCE_KEY = Pattern.compile("\"importance\"\\s*:\\s*\\+?(\\d+(?:\\.\\d+)?)");
    private static final Pattern DELTA_KEY = Pattern.compile("\"relationshipDelta\"\\s*:\\s*([+-]?\\d*\\.?\\d+)");
    private static final Pattern TOPICS_KEY = Pattern.compile("\"topics\"\\s*:\\s*\\[([^\\]]*)\\]");
    private static final Pattern SENTENCE = Pattern.compile("[^.!?\\n]+[.!?]?");
    private static final Pattern MARKUP = Pattern.compile("[{}\\[\\]\"]");

    private static final Pattern HIGH_IMPORTANCE = Pattern.compile(
            "\\b(crucial|critical|important|significant|major|pivotal|life-changing|decisive|turning point)\\b");
    private static final Pattern LOW_IMPORTANCE = Pattern.compile(
            "\\b(trivial|minor|casual|small talk|mundane|unimportant|routine)\\b");
    private static final Pattern POSITIVE = Pattern.compile(
            "\\b(thank|thanks|grateful|happy|glad|love|loved|like|liked|enjoy|enjoyed|smile|smiled"
                    + "|laugh|laughed|friend|friendly|kind|trust|trusted|warm|pleased|delighted)\\b");
    private static final Pattern NEGATIVE = Pattern.compile(
            "\\b(angry|hate|hated|annoyed|upset|sad|afraid|fear|threat|threatened|insult|insulted"
                    + "|betray|betrayed|distrust|cold|rude|hostile|furious)\\b");
    private static final Pattern DECISION_VERB = Pattern.compile(
            "\\b(decided|decides|chose|chooses|agreed|agrees|refused|refuses|rejected|rejects"
                    + "|promised|promises|declared|declares|vowed|vows|confronted|accepted|accepts)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final List<String> TOPIC_VOCABULARY = List.of(
            "adventure", "family", "friendship", "love", "magic", "travel", "work", "danger",
            "trust", "music", "food", "history", "tavern", "quest", "battle", "secret",
            "home", "past", "future", "dream");

    private HeuristicExtractor() {}

    /** A quoted summary value, else the first sentence longer than 20 characters. */
    public static Finding<Optional<String>> summary(String text) {
        var key = SUMMARY_KEY.matcher(text);
        if (key.find() && !key.group(1).isBlank()) {
            return new Finding<>(Optional.of(unescape(key.group(1)).trim()), "summary-key");
        }
        var first = sentences(MARKUP.matcher(text).replaceAll(" ")).stream()
                .filter(s -> s.length() > MIN_SENTENCE_LENGTH)
                .findFirst();
        return new Finding<>(first, first.isPresent() ? "first-sentence" : "none");
    }

    /** Raw 1-10 score. */
    public static Finding<Double> importance(String text) {
        var key = IMPORTANCE_KEY.matcher(text);
        if (key.find()) {
            return new Finding<>(Math.max(1.0, Math.min(10.0, Double.parseDouble(key.group(1)))), "importance-key");
        }
        var lower = text.toLowerCase(Locale.ROOT);
        if (HIGH_IMPORTANCE.matcher(lower).find()) return new Finding<>(8.0, "high-keyword");
        if (LOW_IMPORTANCE.matcher(lower).find()) return new Finding<>(3.0, "low-keyword");
        return new Finding<>(5.0, "default");
    }

    public static Finding<Double> relationshipDelta(String text) {
        var key = DELTA_KEY.matcher(text);
        if (key.find()) {
            return new Finding<>(clamp(Double.parseDouble(key.group(1)), -1.0, 1.0), "delta-key");
        }
        var lower = text.toLowerCase(Locale.ROOT);
        int balance = count(POSITIVE.matcher(lower)) - count(NEGATIVE.matcher(lower));
        if (balance == 0) return new Finding<>(0.0, "neutral");
        return new Finding<>(clamp(balance * 0.1, -0.5, 0.5), "keyword-balance");
    }

    /** Each share is its keyword count over (positive + negative + 1); neutral takes the rest. */
    public static Finding<Emotions> emotions(String text) {
        var lower = text.toLowerCase(Locale.ROOT);
        int p = count(POSITIVE.matcher(lower));
        int n = count(NEGATIVE.matcher(lower));
        double total = p + n + 1.0;
        var emotions = new Emotions(round2(p / total), round2(n / total), round2(1.0 / total));
        return new Finding<>(emotions, p + n == 0 ? "neutral" : "keyword-ratio");
    }

    public static Finding<List<String>> decisions(String text) {
        var found = new LinkedHashSet<String>();
        for (var sentence : sentences(MARKUP.matcher(text).replaceAll(" "))) {
            if (found.size() >= MAX_ITEMS) break;
            if (DECISION_VERB.matcher(sentence).find()) found.add(sentence);
        }
        return new Finding<>(List.copyOf(found), found.isEmpty() ? "none" : "decision-verbs");
    }

    public static Finding<List<String>> topics(String text) {
        var key = TOPICS_KEY.matcher(text);
        if (key.find()) {
            var items = new ArrayList<String>();
            for (var token : key.group(1).split(",")) {
                var t = token.replace("\"", "").trim();
                if (!t.isEmpty() && items.size() < MAX_ITEMS) items.add(t);
            }
            if (!items.isEmpty()) return new Finding<>(List.copyOf(items), "topics-key");
        }
        var lower = text.toLowerCase(Locale.ROOT);
        var items = TOPIC_VOCABULARY.stream()
                .filter(w -> Pattern.compile("\\b" + w + "\\b").matcher(lower).find())
                .limit(MAX_ITEMS)
                .toList();
        return new Finding<>(items, items.isEmpty() ? "none" : "vocabulary");
    }

    /** Empty when not even a summary sentence can be found. */
    public static Optional<JournalAnalysis> extract(String text, String userName, String ownerName) {
        if (text == null || text.isBlank()) return Optional.empty();
        var summary = summary(text);
        if (summary.value().isEmpty()) {
            log.warn("Heuristic extraction found no summary sentence");
            return Optional.empty();
        }
        var importance = importance(text);
        var delta = relationshipDelta(text);
        var emotions = emotions(text);
        var decisions = decisions(text);
        var topics = topics(text);
        log.info("Heuristic analysis branches: summary={} importance={} delta={} emotions={} decisions={} topics={}",
                summary.branch(), importance.branch(), delta.branch(), emotions.branch(),
                decisions.branch(), topics.branch());
        return Optional.of(new JournalAnalysis(
            summary.value().get(),
            emotions.value(),
            decisions.value(),
            topics.value(),
            importance.value(),
            delta.value(),
            List.of(),
            List.of(userName, ownerName),
            List.of()
        ));
    }

    static List<String> sentences(String text) {
        var out = new ArrayList<String>();
        Matcher m = SENTENCE.matcher(text);
        while (m.find()) {
            var s = m.group().trim().replaceAll("\\s+", " ");
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }

    private static String unescape(String s) {
        return s.replace("\\\"", "\"").replace("\\n", " ").replace("\\\\", "\\");
    }

    private static int count(Matcher m) {
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
