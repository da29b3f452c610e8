package com.veriheal.core.knowledge;

import com.veriheal.core.diagnosis.DiagnosisCategory;
import com.veriheal.core.patch.PatchKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class KnowledgeBaseTest {

    @TempDir
    Path tempDir;

    private static FailurePattern pattern(String key, FailurePattern.Outcome outcome) {
        return new FailurePattern(key, DiagnosisCategory.IMPORT_OR_NAME_ERROR, PatchKind.TARGETED_REPLACE,
                outcome, "run-1", "c1", Instant.now());
    }

    @Test
    void testStartsEmptyWithoutFile() {
        KnowledgeBase kb = new KnowledgeBase(tempDir.resolve("kb.jsonl").toString());

        assertEquals(0, kb.size());
        assertTrue(kb.statsFor("anything").isEmpty());
        assertTrue(kb.statsFor(null).isEmpty());
    }

    @Test
    void testAppendedPatternsSurviveReload() throws Exception {
        Path file = tempDir.resolve("nested/kb.jsonl");
        KnowledgeBase kb = new KnowledgeBase(file.toString());

        kb.append(pattern("ImportError: x", FailurePattern.Outcome.HEALED));
        kb.append(pattern("ImportError: x", FailurePattern.Outcome.HEALED));
        kb.append(pattern("ImportError: x", FailurePattern.Outcome.ESCALATED));

        KnowledgeBase reloaded = new KnowledgeBase(file.toString());
        PatternStats stats = reloaded.statsFor("ImportError: x");
        assertEquals(2, stats.getHealed());
        assertEquals(1, stats.getEscalated());
        assertEquals(3, reloaded.size());
    }

    @Test
    void testTornLineIsSkipped() throws Exception {
        Path file = tempDir.resolve("kb.jsonl");
        KnowledgeBase kb = new KnowledgeBase(file.toString());
        kb.append(pattern("k", FailurePattern.Outcome.HEALED));
        Files.write(file, "{\"signatureKey\":\"k\",\"outc".getBytes(StandardCharsets.UTF_8),
                StandardOpenOption.APPEND);

        KnowledgeBase reloaded = new KnowledgeBase(file.toString());

        assertEquals(1, reloaded.statsFor("k").getHealed());
    }
}
