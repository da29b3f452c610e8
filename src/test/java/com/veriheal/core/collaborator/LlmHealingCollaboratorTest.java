package com.veriheal.core.collaborator;

import com.veriheal.core.checklist.FailureRecord;
import com.veriheal.core.checklist.TestCase;
import com.veriheal.core.diagnosis.DiagnosisCategory;
import com.veriheal.core.diagnosis.FailureScope;
import com.veriheal.core.patch.Patch;
import com.veriheal.core.patch.PatchKind;
import com.veriheal.core.patch.PatchOrigin;
import com.veriheal.llm.CollaboratorRole;
import com.veriheal.llm.LLMClient;
import com.veriheal.llm.LLMException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LlmHealingCollaboratorTest {

    /** Replays one canned response and records every prompt. */
    private static final class CannedClient implements LLMClient {
        final List<String>           prompts = new ArrayList<>();
        final List<CollaboratorRole> roles   = new ArrayList<>();
        final String response;

        CannedClient(String response) {
            this.response = response;
        }

        @Override
        public String generateWithRole(CollaboratorRole role, String userPrompt, double temperature) {
            roles.add(role);
            prompts.add(userPrompt);
            if (response == null) throw new LLMException("model offline", null);
            return response;
        }
    }

    private static PatchRequest request(PatchKind kind) {
        FailureRecord failure = FailureRecord.undiagnosed("E   NameError: name 'totl' is not defined", 1, false)
                .withDiagnosis(DiagnosisCategory.IMPORT_OR_NAME_ERROR, FailureScope.LOCAL, 0.9,
                        PatchKind.TARGETED_REPLACE, "src/cart.py", "totl", "NameError: name 'totl'", "typo");
        return PatchRequest.builder("cart-1", kind, "src/cart.py")
                .targetContent("def total(xs):\n    return sum(totl)\n")
                .testFile("tests/test_cart.py")
                .failure(failure)
                .previousRejection("old text not found")
                .build();
    }

    @Test
    void testTargetedReplaceIsParsedFromFencedJson() {
        CannedClient client = new CannedClient(
                "```json\n{\"old_text\": \"sum(totl)\", \"new_text\": \"sum(xs)\", \"confidence\": 0.85, "
                        + "\"rationale\": \"typo\"}\n```");
        LlmHealingCollaborator collaborator = new LlmHealingCollaborator(client);

        Patch patch = collaborator.draftPatch(request(PatchKind.TARGETED_REPLACE)).orElseThrow();

        assertEquals(PatchKind.TARGETED_REPLACE, patch.getKind());
        assertEquals("src/cart.py", patch.getTargetFile());
        assertEquals("sum(totl)", patch.getOldText());
        assertEquals("sum(xs)", patch.getNewText());
        assertEquals(0.85, patch.getConfidence(), 1e-9);
        assertEquals(PatchOrigin.AUTOMATED, patch.getOrigin());
        assertEquals("typo", patch.getRationale());

        String prompt = client.prompts.get(0);
        assertEquals(CollaboratorRole.PATCHER, client.roles.get(0));
        assertTrue(prompt.contains("Failing name: totl"));
        assertTrue(prompt.contains("A previous patch was rejected: old text not found"));
        assertTrue(prompt.contains("return sum(totl)"));
    }

    @Test
    void testDiffAndRewritePayloads() {
        Patch diff = new LlmHealingCollaborator(new CannedClient("{\"diff\": \"@@ -1 +1 @@\\n-a\\n+b\\n\"}"))
                .draftPatch(request(PatchKind.UNIFIED_DIFF)).orElseThrow();
        assertEquals("@@ -1 +1 @@\n-a\n+b\n", diff.getDiffBody());
        assertEquals(0.5, diff.getConfidence(), 1e-9);

        Patch rewrite = new LlmHealingCollaborator(new CannedClient("{\"content\": \"x = 1\\n\", \"confidence\": 0.7}"))
                .draftPatch(request(PatchKind.FULL_REWRITE)).orElseThrow();
        assertEquals("x = 1\n", rewrite.getContent());
    }

    @Test
    void testDeclinedMalformedAndFailedCallsYieldNothing() {
        assertTrue(new LlmHealingCollaborator(new CannedClient("{\"no_patch\": true}"))
                .draftPatch(request(PatchKind.TARGETED_REPLACE)).isEmpty());
        assertTrue(new LlmHealingCollaborator(new CannedClient("{\"old_text\": \"only half\"}"))
                .draftPatch(request(PatchKind.TARGETED_REPLACE)).isEmpty());
        assertTrue(new LlmHealingCollaborator(new CannedClient("I cannot help with that."))
                .draftPatch(request(PatchKind.FULL_REWRITE)).isEmpty());
        assertTrue(new LlmHealingCollaborator(new CannedClient(null))
                .draftPatch(request(PatchKind.UNIFIED_DIFF)).isEmpty());
    }

    @Test
    void testGeneratedTestCarriesConfidence() {
        CannedClient client = new CannedClient("{\"code\": \"def test_x():\\n    assert True\\n\", \"confidence\": 0.8}");
        TestCase testCase = TestCase.builder("gen").testFile("tests/test_x.py").description("x is true").build();

        Optional<GeneratedTest> generated = new LlmHealingCollaborator(client).generateTest(testCase);

        assertTrue(generated.isPresent());
        assertEquals("def test_x():\n    assert True\n", generated.get().getCode());
        assertEquals(0.8, generated.get().getConfidence(), 1e-9);
        assertEquals(CollaboratorRole.GENERATOR, client.roles.get(0));
        assertTrue(client.prompts.get(0).contains("x is true"));
    }

    @Test
    void testBlankGeneratedCodeIsIgnored() {
        TestCase testCase = TestCase.builder("gen").testFile("tests/test_x.py").build();
        assertTrue(new LlmHealingCollaborator(new CannedClient("{\"code\": \"  \", \"confidence\": 0.9}"))
                .generateTest(testCase).isEmpty());
    }
}
