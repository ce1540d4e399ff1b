package com.lorekeeper.journal;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Finds the JSON object inside free-form model output. Every balanced
 * {@code {...}} span is a candidate; the one naming the most required keys
 * wins, longer spans breaking ties.
 */
public final class JsonCandidates {

    private JsonCandidates() {}

    public static Optional<String> best(String text, Collection<String> requiredKeys) {
        if (text == null || text.isEmpty()) return Optional.empty();
        var candidates = balancedObjects(text);
        if (candidates.isEmpty()) return widestSpan(text);

        String best = null;
        int bestScore = -1;
        for (var candidate : candidates) {
            int score = keyScore(candidate, requiredKeys);
            if (score > bestScore || (score == bestScore && candidate.length() > best.length())) {
                best = candidate;
                bestScore = score;
            }
        }
        return Optional.of(best);
    }

    /** All substrings that open with '{' and close at matching depth, ignoring braces inside strings. */
    public static List<String> balancedObjects(String text) {
        var out = new ArrayList<String>();
        for (int start = text.indexOf('{'); start >= 0; start = text.indexOf('{', start + 1)) {
            int end = matchingBrace(text, start);
            if (end > start) out.add(text.substring(start, end + 1));
        }
        return out;
    }

    static int keyScore(String candidate, Collection<String> keys) {
        int score = 0;
        for (var key : keys) {
            if (candidate.contains("\"" + key + "\"")) score++;
        }
        return score;
    }

    private static int matchingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) escaped = false;
                else if (c == '\\') escaped = true;
                else if (c == '"') inString = false;
                continue;
            }
            if (c == '"') inString = true;
            else if (c == '{') depth++;
            else if (c == '}') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    private static Optional<String> widestSpan(String text) {
        int first = text.indexOf('{');
        int last = text.lastIndexOf('}');
        return first >= 0 && last > first ? Optional.of(text.substring(first, last + 1)) : Optional.empty();
    }
}
