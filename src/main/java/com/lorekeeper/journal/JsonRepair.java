package com.lorekeeper.journal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Syntax normalizations for almost-JSON. Each rule is a pure function and is
 * applied in the order of {@link #RULES}.
 */
public final class JsonRepair {

    private static final Logger log = LoggerFactory.getLogger(JsonRepair.class);

    private static final Pattern INVISIBLE = Pattern.compile("[\\uFEFF\\u200B\\u200C\\u200D\\u2060]");
    private static final Pattern SIGNED_POSITIVE = Pattern.compile("([:\\[,]\\s*)\\+(\\d)");
    private static final Pattern DUPLICATE_COMMAS = Pattern.compile(",(\\s*,)+");
    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*([}\\]])");
    private static final Pattern LEADING_COMMA = Pattern.compile("([\\[{]\\s*),");
    private static final Pattern LITERAL = Pattern.compile("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?|true|false|null");
    private static final Pattern RAW_WHITESPACE = Pattern.compile("[\\r\\n\\t]+");

    public static final Map<String, UnaryOperator<String>> RULES = rules();

    private JsonRepair() {}

    private static Map<String, UnaryOperator<String>> rules() {
        var rules = new LinkedHashMap<String, UnaryOperator<String>>();
        rules.put("strip-invisible", JsonRepair::stripInvisible);
        rules.put("unsign-positive-numbers", JsonRepair::unsignPositiveNumbers);
        rules.put("remove-extra-commas", JsonRepair::removeExtraCommas);
        rules.put("quote-bare-array-tokens", JsonRepair::quoteBareArrayTokens);
        rules.put("flatten-whitespace", JsonRepair::flattenWhitespace);
        return Collections.unmodifiableMap(rules);
    }

    public static String stripInvisible(String json) {
        return INVISIBLE.matcher(json).replaceAll("");
    }

    /** {@code +0.3} is not a JSON number. String values are left as written. */
    public static String unsignPositiveNumbers(String json) {
        return outsideStrings(json, text -> SIGNED_POSITIVE.matcher(text).replaceAll("$1$2"));
    }

    public static String removeExtraCommas(String json) {
        return outsideStrings(json, text -> {
            var out = DUPLICATE_COMMAS.matcher(text).replaceAll(",");
            out = TRAILING_COMMA.matcher(out).replaceAll("$1");
            return LEADING_COMMA.matcher(out).replaceAll("$1");
        });
    }

    /** Applies {@code edit} to each run of text between string literals; literals are copied verbatim. */
    private static String outsideStrings(String json, UnaryOperator<String> edit) {
        var out = new StringBuilder(json.length());
        var structural = new StringBuilder();
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < json.length(); i++) {
            char c = json.charAt(i);
            if (inString) {
                out.append(c);
                if (escaped) escaped = false;
                else if (c == '\\') escaped = true;
                else if (c == '"') inString = false;
            } else if (c == '"') {
                out.append(edit.apply(structural.toString()));
                structural.setLength(0);
                out.append(c);
                inString = true;
            } else {
                structural.append(c);
            }
        }
        return out.append(edit.apply(structural.toString())).toString();
    }

    /**
     * {@code [Authority, Trust]} becomes {@code ["Authority", "Trust"]}. Only flat
     * arrays outside strings that contain no quotes at all are touched; numbers and
     * literals stay bare.
     */
    public static String quoteBareArrayTokens(String json) {
        var out = new StringBuilder(json.length() + 16);
        boolean inString = false;
        boolean escaped = false;
        int i = 0;
        while (i < json.length()) {
            char c = json.charAt(i);
            if (inString) {
                out.append(c);
                if (escaped) escaped = false;
                else if (c == '\\') escaped = true;
                else if (c == '"') inString = false;
                i++;
                continue;
            }
            if (c == '"') {
                inString = true;
                out.append(c);
                i++;
                continue;
            }
            if (c == '[') {
                int close = flatArrayEnd(json, i);
                if (close > 0) {
                    out.append(quoteTokens(json.substring(i + 1, close)));
                    i = close + 1;
                    continue;
                }
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    private static int flatArrayEnd(String json, int open) {
        for (int j = open + 1; j < json.length(); j++) {
            char c = json.charAt(j);
            if (c == ']') return j;
            if (c == '"' || c == '[' || c == '{' || c == '}') return -1;
        }
        return -1;
    }

    private static String quoteTokens(String body) {
        if (body.isBlank()) return "[" + body + "]";
        var joined = new StringBuilder("[");
        boolean first = true;
        for (var token : body.split(",")) {
            var t = token.trim();
            if (t.isEmpty()) continue;
            if (!first) joined.append(", ");
            first = false;
            if (LITERAL.matcher(t).matches()) joined.append(t);
            else joined.append('"').append(t.replace("\\", "\\\\")).append('"');
        }
        return joined.append(']').toString();
    }

    /** Raw newlines and tabs are illegal inside JSON strings and harmless between tokens. */
    public static String flattenWhitespace(String json) {
        return RAW_WHITESPACE.matcher(json).replaceAll(" ");
    }

    public static String repair(String json) {
        var out = json;
        for (var rule : RULES.values()) {
            out = rule.apply(out);
        }
        return out;
    }

    /** Parses as-is, then once more after repair. */
    public static Optional<JsonNode> parse(String json, ObjectMapper mapper) {
        try {
            return Optional.of(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            log.debug("Raw analysis JSON did not parse: {}", e.getOriginalMessage());
        }
        var repaired = repair(json);
        try {
            var node = mapper.readTree(repaired);
            log.info("Analysis JSON parsed after repair");
            return Optional.of(node);
        } catch (JsonProcessingException e) {
            log.warn("Analysis JSON unparseable after repair: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
