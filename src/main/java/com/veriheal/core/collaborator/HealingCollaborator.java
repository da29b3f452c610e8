package com.veriheal.core.collaborator;

import com.veriheal.core.checklist.TestCase;
import com.veriheal.core.patch.Patch;

import java.util.Optional;

/**
 * External drafter of test code and patches. Stateless; its output is
 * untrusted and always goes through the patch engine's validation.
 */
public interface HealingCollaborator {

    /**
     * Proposes test code for a case that has neither code nor an existing test file.
     */
    Optional<GeneratedTest> generateTest(TestCase testCase);

    /**
     * Drafts a patch of exactly {@code request.getKind()}, or empty when it
     * has none to offer.
     */
    Optional<Patch> draftPatch(PatchRequest request);
}
