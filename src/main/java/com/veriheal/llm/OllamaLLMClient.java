package com.veriheal.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * LLMClient backed by a local Ollama server.
 */
@Component
@Profile("!mock")
public class OllamaLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaLLMClient.class);

    private final String       baseUrl;
    private final String       model;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OllamaLLMClient(
            RestTemplateBuilder restTemplateBuilder,
            @Value("${ollama.base-url:http://localhost:11434}") String baseUrl,
            @Value("${ollama.model:llama3:8b}") String model,
            @Value("${ollama.timeout-seconds:120}") long timeoutSeconds
    ) {
        this.baseUrl = baseUrl;
        this.model   = model;
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }

    @Override
    public String generateWithRole(CollaboratorRole role, String userPrompt, double temperature) {
        String fullPrompt = getSystemPromptForRole(role) + "\n\n" + userPrompt;
        log.debug("[Ollama] role={} temperature={} promptLen={}", role, temperature, fullPrompt.length());
        return callOllama(fullPrompt, temperature);
    }

    // =========================================================================
    // System prompts
    // =========================================================================

    private String getSystemPromptForRole(CollaboratorRole role) {
        return switch (role) {
            case GENERATOR -> """
                    You write small, focused unit tests for existing code.
                    One behaviour per test. No network, no sleeps, no randomness.
                    Output ONLY valid JSON with "code" and "confidence" fields.
                    """;

            case DIAGNOSER -> """
                    You classify why a test failed.
                    Categories: IMPORT_OR_NAME_ERROR, ENVIRONMENT_ERROR, ASSERTION_MISMATCH,
                    MOCK_OR_FIXTURE_ERROR, AMBIGUOUS_OR_COMPLEX.
                    Scopes: LOCAL, MULTI_LINE, FILE_WIDE.
                    Output ONLY valid JSON. Report low confidence when unsure.
                    """;

            case PATCHER -> """
                    You repair a failing test or the code it exercises with the smallest possible change.
                    Use exactly the patch form you are asked for. Copy old text EXACTLY from the file.
                    Output ONLY valid JSON. If no safe patch exists, output {"no_patch": true}.
                    """;
        };
    }

    // =========================================================================
    // HTTP client
    // =========================================================================

    private String callOllama(String prompt, double temperature) {
        String url = baseUrl + "/api/generate";

        Map<String, Object> body = new HashMap<>();
        body.put("model",  model);
        body.put("prompt", prompt);
        body.put("stream", false);
        body.put("options", Map.of("temperature", temperature));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<String> response =
                    restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);

            JsonNode root = objectMapper.readTree(response.getBody());
            String result = root != null && root.has("response") ? root.get("response").asText() : "";
            log.debug("[Ollama] responseLen={}", result.length());
            return result;

        } catch (RestClientException | IOException e) {
            log.error("[Ollama] Call failed: {}", e.getMessage());
            throw new LLMException("Ollama LLM call failed: " + e.getMessage(), e);
        }
    }
}
