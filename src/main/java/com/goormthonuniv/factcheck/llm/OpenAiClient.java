package com.goormthonuniv.factcheck.llm;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;

/**
 * OpenAI chat completions 호출 (JSON object 모드). content 문자열만 돌려준다.
 */
@Slf4j
@Component
public class OpenAiClient {

    private final RestClient rest;
    private final String endpoint;
    private final String apiKey;
    private final String model;

    public OpenAiClient(RestClient.Builder builder,
                        @Value("${factcheck.ai.openai.endpoint:https://api.openai.com/v1/chat/completions}") String endpoint,
                        @Value("${factcheck.ai.openai.apiKey:}") String apiKey,
                        @Value("${factcheck.ai.openai.model:gpt-4o-mini}") String model) {
        this.rest = builder.build();
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.model = model;
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String completeJson(String system, String user) {
        if (!isConfigured()) {
            throw new LlmUnavailableException("OPENAI_API_KEY 미설정");
        }
        Map<String, Object> body = Map.of(
                "model", model,
                "messages", List.of(
                        Map.of("role", "system", "content", system),
                        Map.of("role", "user", "content", user)
                ),
                "temperature", 0.1,
                "response_format", Map.of("type", "json_object")
        );

        JsonNode root;
        try {
            root = rest.post()
                    .uri(endpoint)
                    .header("Authorization", "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new LlmUnavailableException("OpenAI API error: " + e.getMessage(), e);
        }

        JsonNode choices = root == null ? null : root.path("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            throw new LlmUnavailableException("OpenAI 응답 비정상(choices empty)");
        }
        String content = choices.get(0).path("message").path("content").asText("");
        log.debug("openai model={} content chars={}", model, content.length());
        return content;
    }
}
