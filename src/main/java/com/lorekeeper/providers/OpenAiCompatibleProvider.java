package com.lorekeeper.providers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/** Any backend speaking the OpenAI {@code /chat/completions} dialect. */
public class OpenAiCompatibleProvider implements ModelProvider {

    private final String id;
    private final String baseUrl;
    private final String defaultModel;
    private final ApiKeyRing keys;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public OpenAiCompatibleProvider(String id, String baseUrl, String defaultModel, ApiKeyRing keys) {
        this.id = id;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.defaultModel = defaultModel;
        this.keys = keys;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String id() { return id; }

    @Override
    public ChatResponse chat(ChatRequest request) {
        var apiKey = keys.next(id);
        try {
            var body = new LinkedHashMap<String, Object>();
            body.put("model", request.model() != null ? request.model() : defaultModel);
            body.put("messages", request.messages());
            body.put("temperature", request.temperature());

            var httpReq = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/chat/completions"))
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .timeout(Duration.ofSeconds(60))
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();

            var resp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() != 200) {
                throw new ProviderException(id, resp.statusCode(),
                        "LLM API error " + resp.statusCode() + ": " + resp.body());
            }
            return parseResponse(mapper.readTree(resp.body()));
        } catch (IOException e) {
            throw new ProviderException(id, 0, "transport error", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(id, 0, "interrupted", e);
        }
    }

    static ChatResponse parseResponse(JsonNode root) {
        var content = root.path("choices").path(0).path("message").path("content").asText("");
        var model = root.path("model").asText(null);
        var u = root.path("usage");
        Map<String, Integer> usage = Map.of(
                "promptTokens", u.path("prompt_tokens").asInt(0),
                "completionTokens", u.path("completion_tokens").asInt(0)
        );
        return new ChatResponse(model, content, usage);
    }
}
