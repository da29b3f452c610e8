package com.veriheal.core.collaborator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.veriheal.core.diagnosis.DiagnosisCategory;
import com.veriheal.core.diagnosis.FailureScope;
import com.veriheal.core.diagnosis.FailureSignature;
import com.veriheal.core.diagnosis.SemanticAnalyzer;
import com.veriheal.core.diagnosis.SemanticAssessment;
import com.veriheal.core.diagnosis.TestMetadata;
import com.veriheal.llm.CollaboratorRole;
import com.veriheal.llm.LLMClient;
import com.veriheal.llm.LLMException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

@Component
public class LlmSemanticAnalyzer implements SemanticAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(LlmSemanticAnalyzer.class);

    private final LLMClient    llmClient;
    private final ObjectMapper jsonMapper = new ObjectMapper();

    public LlmSemanticAnalyzer(LLMClient llmClient) {
        this.llmClient = llmClient;
    }

    @Override
    public Optional<SemanticAssessment> assess(String failureText, TestMetadata metadata,
                                               FailureSignature signature) {
        String prompt = """
                Classify this test failure.

                Test id      : %s
                Test file    : %s
                Code under test: %s
                Error type   : %s
                Deepest frame: %s:%d

                Failure output:
                %s

                Respond with JSON:
                {"category": "<category>", "scope": "<scope>", "confidence": <0.0-1.0>,
                 "target_file": "<file to patch>", "explanation": "<one sentence>"}
                """.formatted(metadata.getCaseId(), metadata.getTestFile(), metadata.getTargetFile(),
                              signature.getErrorType(), signature.getFailingFile(), signature.getFailingLine(),
                              tail(failureText));

        String response;
        try {
            response = llmClient.generateWithRole(CollaboratorRole.DIAGNOSER, prompt,
                    llmClient.getTemperatureForRole(CollaboratorRole.DIAGNOSER));
        } catch (LLMException e) {
            log.warn("[SemanticAnalyzer] Call failed for {}: {}", metadata.getCaseId(), e.getMessage());
            return Optional.empty();
        }

        try {
            JsonNode root = jsonMapper.readTree(JsonResponses.extractJson(response));
            if (root == null || !root.isObject()) return Optional.empty();

            DiagnosisCategory category = parseEnum(DiagnosisCategory.class, JsonResponses.textOrNull(root, "category"));
            if (category == null) {
                log.warn("[SemanticAnalyzer] Unknown category for {}: {}", metadata.getCaseId(), root.get("category"));
                return Optional.empty();
            }
            FailureScope scope = parseEnum(FailureScope.class, JsonResponses.textOrNull(root, "scope"));
            double confidence  = Math.max(0.0, Math.min(1.0, JsonResponses.doubleOr(root, "confidence", 0.0)));

            return Optional.of(new SemanticAssessment(category, scope, confidence,
                    JsonResponses.textOrNull(root, "target_file"),
                    JsonResponses.textOrNull(root, "explanation")));

        } catch (JsonProcessingException e) {
            log.warn("[SemanticAnalyzer] Unparseable response for {}: {}", metadata.getCaseId(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        if (value == null) return null;
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String tail(String text) {
        if (text == null) return "";
        return text.length() <= 4_000 ? text : "[truncated] ..." + text.substring(text.length() - 4_000);
    }
}
