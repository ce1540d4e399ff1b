package com.lorekeeper.providers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hosted rerank endpoint. Two request dialects exist:
 * <ul>
 *   <li>{@link Style#DOCUMENTS}: {@code {"model","query","documents":[...]}} answered with
 *       {@code results[{index, relevance_score}]} (Jina, Cohere)</li>
 *   <li>{@link Style#PASSAGES}: {@code {"model","query":{"text"},"passages":[{"text"}]}} answered
 *       with {@code rankings[{index, logit}]} (NVIDIA)</li>
 * </ul>
 */
public class HttpRerankProvider implements RerankProvider {

    public enum Style {
        DOCUMENTS, PASSAGES;

        public static Style from(String name) {
            return "passages".equalsIgnoreCase(name) ? PASSAGES : DOCUMENTS;
        }
    }

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String id;
    private final String url;
    private final String model;
    private final Style style;
    private final ApiKeyRing keys;
    private final HttpClient httpClient;

    public HttpRerankProvider(String id, String url, String model, Style style, ApiKeyRing keys) {
        this.id = id;
        this.url = url;
        this.model = model;
        this.style = style;
        this.keys = keys;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String id() { return id; }

    @Override
    public List<Integer> rerank(String query, List<String> documents) {
        var apiKey = keys.next(id);
        try {
            var req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .timeout(Duration.ofSeconds(30))
                    .POST(HttpRequest.BodyPublishers.ofString(
                            MAPPER.writeValueAsString(requestBody(query, documents))))
                    .build();
            var resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() != 200) {
                throw new ProviderException(id, resp.statusCode(),
                        "Rerank API error " + resp.statusCode() + ": " + resp.body());
            }
            return parse(style, MAPPER.readTree(resp.body()));
        } catch (IOException e) {
            throw new ProviderException(id, 0, "transport error", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(id, 0, "interrupted", e);
        }
    }

    private Map<String, Object> requestBody(String query, List<String> documents) {
        var body = new LinkedHashMap<String, Object>();
        body.put("model", model);
        if (style == Style.PASSAGES) {
            body.put("query", Map.of("text", query));
            body.put("passages", documents.stream().map(d -> Map.of("text", d)).toList());
        } else {
            body.put("query", query);
            body.put("documents", documents);
            body.put("top_n", documents.size());
        }
        return body;
    }

    /** Indices ordered by descending score. */
    static List<Integer> parse(Style style, JsonNode root) {
        var array = root.path(style == Style.PASSAGES ? "rankings" : "results");
        var scoreField = style == Style.PASSAGES ? "logit" : "relevance_score";
        var scored = new ArrayList<double[]>();
        for (var item : array) {
            if (!item.has("index")) continue;
            scored.add(new double[]{item.path("index").asInt(), item.path(scoreField).asDouble(0)});
        }
        scored.sort(Comparator.comparingDouble((double[] s) -> s[1]).reversed());
        return scored.stream().map(s -> (int) s[0]).toList();
    }
}
