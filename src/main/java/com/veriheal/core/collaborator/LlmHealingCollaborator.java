package com.veriheal.core.collaborator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.veriheal.core.checklist.FailureRecord;
import com.veriheal.core.checklist.TestCase;
import com.veriheal.core.patch.Patch;
import com.veriheal.llm.CollaboratorRole;
import com.veriheal.llm.LLMClient;
import com.veriheal.llm.LLMException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Drafts test code and patches by prompting the configured {@link LLMClient}.
 * Malformed or empty model output is treated as "nothing to offer".
 */
@Component
public class LlmHealingCollaborator implements HealingCollaborator {

    private static final Logger log = LoggerFactory.getLogger(LlmHealingCollaborator.class);

    private static final int MAX_FILE_CHARS = 12_000;

    private final LLMClient    llmClient;
    private final ObjectMapper jsonMapper = new ObjectMapper();

    public LlmHealingCollaborator(LLMClient llmClient) {
        this.llmClient = llmClient;
    }

    // ================================================================
    // Test generation
    // ================================================================

    @Override
    public Optional<GeneratedTest> generateTest(TestCase testCase) {
        String prompt = """
                Write a test for the following case.

                Test id     : %s
                Test file   : %s
                Code under test: %s
                Intent      : %s

                Respond with JSON: {"code": "<complete test file>", "confidence": <0.0-1.0>}
                """.formatted(testCase.getId(), testCase.getTestFile(),
                              testCase.getTargetFile(), nullToDash(testCase.getDescription()));

        JsonNode root = ask(CollaboratorRole.GENERATOR, prompt, testCase.getId());
        if (root == null) return Optional.empty();

        String code = JsonResponses.textOrNull(root, "code");
        if (code == null || code.isBlank()) {
            log.info("[Collaborator] No test code proposed for {}", testCase.getId());
            return Optional.empty();
        }
        return Optional.of(new GeneratedTest(code, JsonResponses.doubleOr(root, "confidence", 0.0)));
    }

    // ================================================================
    // Patch drafting
    // ================================================================

    @Override
    public Optional<Patch> draftPatch(PatchRequest request) {
        JsonNode root = ask(CollaboratorRole.PATCHER, buildPatchPrompt(request), request.getCaseId());
        if (root == null) return Optional.empty();

        if (root.path("no_patch").asBoolean(false)) {
            log.info("[Collaborator] Drafter declined {} for {}", request.getKind(), request.getCaseId());
            return Optional.empty();
        }

        double confidence = JsonResponses.doubleOr(root, "confidence", 0.5);
        String rationale  = JsonResponses.textOrNull(root, "rationale");
        String target     = request.getTargetFile();

        Patch patch;
        switch (request.getKind()) {
            case TARGETED_REPLACE: {
                String oldText = JsonResponses.textOrNull(root, "old_text");
                String newText = JsonResponses.textOrNull(root, "new_text");
                if (oldText == null || newText == null) return malformed(request);
                patch = Patch.targetedReplace(target, oldText, newText, confidence);
                break;
            }
            case UNIFIED_DIFF: {
                String diff = JsonResponses.textOrNull(root, "diff");
                if (diff == null) return malformed(request);
                patch = Patch.unifiedDiff(target, diff, confidence);
                break;
            }
            case FULL_REWRITE:
            default: {
                String content = JsonResponses.textOrNull(root, "content");
                if (content == null) return malformed(request);
                patch = Patch.fullRewrite(target, content, confidence);
                break;
            }
        }
        log.info("[Collaborator] Drafted {} for {} (confidence {})", request.getKind(), request.getCaseId(), confidence);
        return Optional.of(patch.withRationale(rationale));
    }

    private String buildPatchPrompt(PatchRequest request) {
        StringBuilder sb = new StringBuilder();
        FailureRecord failure = request.getFailure();

        sb.append("A test is failing. Propose a ").append(request.getKind()).append(" patch.\n\n");
        sb.append("Test id     : ").append(request.getCaseId()).append("\n");
        sb.append("Test file   : ").append(nullToDash(request.getTestFile())).append("\n");
        sb.append("Patch target: ").append(request.getTargetFile()).append("\n");
        if (request.getDescription() != null) {
            sb.append("Intent      : ").append(request.getDescription()).append("\n");
        }
        if (failure != null) {
            sb.append("Diagnosis   : ").append(failure.getCategory())
              .append(" (").append(failure.getScope()).append(")\n");
            if (failure.getFailingToken() != null) {
                sb.append("Failing name: ").append(failure.getFailingToken()).append("\n");
            }
            if (failure.getExplanation() != null) {
                sb.append("Explanation : ").append(failure.getExplanation()).append("\n");
            }
            sb.append("\nFailure output:\n").append(tail(failure.getErrorText(), 3_000)).append("\n");
        }
        if (request.getPreviousRejection() != null) {
            sb.append("\nA previous patch was rejected: ").append(request.getPreviousRejection()).append("\n");
        }

        sb.append("\nCurrent content of ").append(request.getTargetFile()).append(":\n");
        sb.append(request.getTargetContent() == null
                ? "(file does not exist)\n"
                : head(request.getTargetContent(), MAX_FILE_CHARS) + "\n");

        sb.append("\nRespond with JSON, one of:\n");
        switch (request.getKind()) {
            case TARGETED_REPLACE:
                sb.append("{\"old_text\": \"<exact text occurring once>\", \"new_text\": \"...\", ")
                  .append("\"confidence\": 0.0-1.0, \"rationale\": \"...\"}\n");
                break;
            case UNIFIED_DIFF:
                sb.append("{\"diff\": \"<unified diff with @@ hunks>\", \"confidence\": 0.0-1.0, ")
                  .append("\"rationale\": \"...\"}\n");
                break;
            case FULL_REWRITE:
            default:
                sb.append("{\"content\": \"<complete new file>\", \"confidence\": 0.0-1.0, ")
                  .append("\"rationale\": \"...\"}\n");
                break;
        }
        sb.append("{\"no_patch\": true}\n");
        return sb.toString();
    }

    // ================================================================
    // Helpers
    // ================================================================

    private JsonNode ask(CollaboratorRole role, String prompt, String caseId) {
        String response;
        try {
            response = llmClient.generateWithRole(role, prompt, llmClient.getTemperatureForRole(role));
        } catch (LLMException e) {
            log.warn("[Collaborator] {} call failed for {}: {}", role, caseId, e.getMessage());
            return null;
        }
        try {
            JsonNode root = jsonMapper.readTree(JsonResponses.extractJson(response));
            if (root == null || !root.isObject()) {
                log.warn("[Collaborator] {} returned no JSON object for {}", role, caseId);
                return null;
            }
            return root;
        } catch (JsonProcessingException e) {
            log.warn("[Collaborator] {} returned unparseable JSON for {}: {}", role, caseId, e.getOriginalMessage());
            return null;
        }
    }

    private Optional<Patch> malformed(PatchRequest request) {
        log.warn("[Collaborator] {} draft for {} is missing its payload", request.getKind(), request.getCaseId());
        return Optional.empty();
    }

    private static String head(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max) + "\n... [truncated]";
    }

    private static String tail(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : "[truncated] ..." + text.substring(text.length() - max);
    }

    private static String nullToDash(String s) {
        return s == null ? "-" : s;
    }
}
