package com.lorekeeper.providers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/** {@code POST <baseUrl>/embeddings} with {@code {"model", "input"}}. */
public class OpenAiCompatibleEmbeddingProvider implements EmbeddingProvider {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String id;
    private final String baseUrl;
    private final String model;
    private final ApiKeyRing keys;
    private final HttpClient httpClient;

    public OpenAiCompatibleEmbeddingProvider(String id, String baseUrl, String model, ApiKeyRing keys) {
        this.id = id;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.model = model;
        this.keys = keys;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String id() { return id; }

    @Override
    public float[] embed(String text) {
        var apiKey = keys.next(id);
        try {
            var body = MAPPER.writeValueAsString(Map.of("model", model, "input", text));
            var req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/embeddings"))
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .timeout(Duration.ofSeconds(30))
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            var resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() != 200) {
                throw new ProviderException(id, resp.statusCode(),
                        "Embedding API error " + resp.statusCode() + ": " + resp.body());
            }
            return parseEmbedding(MAPPER.readTree(resp.body()));
        } catch (IOException e) {
            throw new ProviderException(id, 0, "transport error", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(id, 0, "interrupted", e);
        }
    }

    static float[] parseEmbedding(JsonNode root) {
        var arr = root.path("data").path(0).path("embedding");
        var vec = new float[arr.size()];
        for (int i = 0; i < arr.size(); i++) {
            vec[i] = (float) arr.get(i).asDouble();
        }
        return vec;
    }
}
