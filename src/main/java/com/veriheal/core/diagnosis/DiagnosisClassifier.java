package com.veriheal.core.diagnosis;

import com.veriheal.core.filesystem.FileSystemManager;
import com.veriheal.core.filesystem.FileSystemManager.FileSystemException;
import com.veriheal.core.gate.QualityGate;
import com.veriheal.core.knowledge.KnowledgeBase;
import com.veriheal.core.knowledge.PatternStats;
import com.veriheal.core.patch.PatchKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw failure output into a {@link Diagnosis}.
 *
 * Deterministic rules run first:
 *   quality gate rejection   -> AMBIGUOUS_OR_COMPLEX, confidence 0
 *   timeout / env / setup    -> ENVIRONMENT_ERROR (error lines only)
 *   missing import or name   -> IMPORT_OR_NAME_ERROR, LOCAL
 *   fixture or mock failure  -> MOCK_OR_FIXTURE_ERROR, MULTI_LINE
 * Assertion mismatches and anything unrecognised go to the
 * {@link SemanticAnalyzer}; if it has nothing usable, a low-confidence
 * diagnosis is returned so the case escalates.
 *
 * The knowledge base then nudges confidence for signatures seen before, and
 * {@link PatchKindSelector} picks the starting patch kind.
 */
@Component
public class DiagnosisClassifier {

    private static final Logger log = LoggerFactory.getLogger(DiagnosisClassifier.class);

    static final double ENVIRONMENT_CONFIDENCE = 0.9;
    static final double IMPORT_CONFIDENCE      = 0.9;
    static final double MOCK_CONFIDENCE        = 0.75;
    static final double FALLBACK_CONFIDENCE    = 0.3;
    static final double PRIOR_STEP             = 0.1;

    // matched against error lines only; runner headers such as "plugins: timeout-2.1.0" never count
    private static final List<Pattern> ENVIRONMENT_PATTERNS = List.of(
        Pattern.compile("^TIMEOUT after \\d+ seconds|^\\+{3,} Timeout \\+{3,}|Failed: Timeout >", Pattern.MULTILINE),
        Pattern.compile("^Sandbox error:", Pattern.MULTILINE),
        Pattern.compile("\\b(?:TimeoutError|TimeoutException|SocketTimeoutException|TimeoutExpired)\\b"),
        Pattern.compile("Connection refused|ConnectionRefusedError|ConnectException|ECONNREFUSED|ECONNRESET"),
        Pattern.compile("PermissionError|Permission denied|AccessDeniedException|EACCES"),
        Pattern.compile("command not found|No such file or directory: '(?:python3?|pytest|node|npx|mvn)'"),
        Pattern.compile("MemoryError|OutOfMemoryError|Address already in use|ENOSPC|No space left on device")
    );

    private static final List<Pattern> IMPORT_PATTERNS = List.of(
        Pattern.compile("ModuleNotFoundError|ImportError|NameError"),
        Pattern.compile("cannot find symbol|NoClassDefFoundError|ClassNotFoundException"),
        Pattern.compile("Cannot find module|ReferenceError: \\w+ is not defined")
    );

    private static final List<Pattern> MOCK_PATTERNS = List.of(
        Pattern.compile("fixture '\\w+' not found|ScopeMismatch|FixtureLookupError"),
        Pattern.compile("MagicMock|Mock object|unittest\\.mock|mock\\.patch|called_once_with|assert_called"),
        Pattern.compile("UnfinishedStubbingException|UnnecessaryStubbingException|WantedButNotInvoked|Mockito"),
        Pattern.compile("jest\\.mock|toHaveBeenCalled|mockReturnValue")
    );

    // pytest "E" lines, typed error lines and the sandbox's own markers
    private static final Pattern ERROR_LINE = Pattern.compile(
        "^(?:E\\s.*"
            + "|(?:Caused by:\\s+)?[A-Za-z_][\\w.$]*(?:Error|Exception|Failure)(?::.*)?"
            + "|TIMEOUT after \\d+ seconds.*"
            + "|Sandbox error:.*"
            + "|\\+{3,} Timeout \\+{3,}.*"
            + "|.*: command not found)$",
        Pattern.MULTILINE);

    private static final Pattern ASSERTION_PATTERN = Pattern.compile(
        "AssertionError|AssertionFailedError|ComparisonFailure|\\bassert\\b|expected:\\s*<|Expected:|toEqual|toBe\\(");

    private final FailureSignatureAnalyzer signatureAnalyzer;
    private final SemanticAnalyzer         semanticAnalyzer;
    private final KnowledgeBase            knowledgeBase;
    private final FileSystemManager        fileSystem;
    private final double                   confidenceFloor;

    public DiagnosisClassifier(
            FailureSignatureAnalyzer signatureAnalyzer,
            SemanticAnalyzer semanticAnalyzer,
            KnowledgeBase knowledgeBase,
            FileSystemManager fileSystem,
            @Value("${veriheal.diagnosis.confidence-floor:0.6}") double confidenceFloor
    ) {
        this.signatureAnalyzer = signatureAnalyzer;
        this.semanticAnalyzer  = semanticAnalyzer;
        this.knowledgeBase     = knowledgeBase;
        this.fileSystem        = fileSystem;
        this.confidenceFloor   = confidenceFloor;
    }

    public boolean isConfident(Diagnosis diagnosis) {
        return diagnosis.getConfidence() >= confidenceFloor;
    }

    public double getConfidenceFloor() {
        return confidenceFloor;
    }

    public Diagnosis classify(String failureText, TestMetadata metadata) {
        String text = failureText == null ? "" : failureText;
        FailureSignature signature = signatureAnalyzer.analyze(text);
        String target = resolveTarget(signature, metadata);

        if (text.isBlank()) {
            return finish(new Diagnosis(DiagnosisCategory.AMBIGUOUS_OR_COMPLEX, 0.0, FailureScope.FILE_WIDE,
                    null, target, null, signature.getSignatureKey(), "No failure output was captured."), false);
        }

        if (text.startsWith(QualityGate.FAILURE_PREFIX)) {
            // gate rejections always go to a human
            return finish(new Diagnosis(DiagnosisCategory.AMBIGUOUS_OR_COMPLEX, 0.0, FailureScope.FILE_WIDE,
                    null, target, null, "QualityGate", firstLine(text)), false);
        }

        Diagnosis rule = applyRules(text, signature, target);
        if (rule != null) {
            log.info("[Classifier] Rule match for {}: {}", metadata.getCaseId(), rule.getCategory());
            return finish(rule, true);
        }

        return finish(semantic(text, metadata, signature, target), true);
    }

    // ================================================================
    // Rule layer
    // ================================================================

    private Diagnosis applyRules(String text, FailureSignature signature, String target) {
        String key      = signature.getSignatureKey();
        String evidence = errorEvidence(text, signature);
        String scoped   = evidence.isEmpty() ? text : evidence;

        if (matchesAny(ENVIRONMENT_PATTERNS, evidence)) {
            return new Diagnosis(DiagnosisCategory.ENVIRONMENT_ERROR, ENVIRONMENT_CONFIDENCE,
                    FailureScope.FILE_WIDE, null, target, null, key,
                    "Environment or setup failure: " + firstLine(evidence));
        }

        if (matchesAny(IMPORT_PATTERNS, scoped)) {
            return new Diagnosis(DiagnosisCategory.IMPORT_OR_NAME_ERROR, IMPORT_CONFIDENCE,
                    FailureScope.LOCAL, null, target, signature.getFailingToken(), key,
                    "Unresolved import or name"
                            + (signature.getFailingToken() != null ? " '" + signature.getFailingToken() + "'" : "")
                            + ".");
        }

        if (matchesAny(MOCK_PATTERNS, scoped)) {
            return new Diagnosis(DiagnosisCategory.MOCK_OR_FIXTURE_ERROR, MOCK_CONFIDENCE,
                    FailureScope.MULTI_LINE, null, target, signature.getFailingToken(), key,
                    "Fixture or mock setup is wrong.");
        }
        return null;
    }

    private Diagnosis semantic(String text, TestMetadata metadata, FailureSignature signature, String target) {
        boolean assertion = ASSERTION_PATTERN.matcher(text).find();
        DiagnosisCategory defaultCategory = assertion
                ? DiagnosisCategory.ASSERTION_MISMATCH
                : DiagnosisCategory.AMBIGUOUS_OR_COMPLEX;

        Optional<SemanticAssessment> assessment;
        try {
            assessment = semanticAnalyzer.assess(text, metadata, signature);
        } catch (RuntimeException e) {
            log.warn("[Classifier] Semantic analyzer failed for {}: {}", metadata.getCaseId(), e.getMessage());
            assessment = Optional.empty();
        }

        if (assessment.isEmpty() || assessment.get().getCategory() == null) {
            log.info("[Classifier] No semantic assessment for {}, using fallback", metadata.getCaseId());
            return new Diagnosis(defaultCategory, FALLBACK_CONFIDENCE, FailureScope.FILE_WIDE, null,
                    target, signature.getFailingToken(), signature.getSignatureKey(),
                    "Could not determine the cause with confidence.");
        }

        SemanticAssessment a = assessment.get();
        String assessedTarget = a.getTargetFile() != null && fileSystem.fileExists(a.getTargetFile())
                ? a.getTargetFile()
                : target;
        return new Diagnosis(a.getCategory(), a.getConfidence(),
                a.getScope() != null ? a.getScope() : FailureScope.MULTI_LINE, null,
                assessedTarget, signature.getFailingToken(), signature.getSignatureKey(),
                a.getExplanation());
    }

    // ================================================================
    // Prior and patch kind
    // ================================================================

    private Diagnosis finish(Diagnosis diagnosis, boolean applyPrior) {
        Diagnosis adjusted = applyPrior ? applyPrior(diagnosis) : diagnosis;
        boolean unique = isUniqueInTarget(adjusted.getFailingToken(), adjusted.getTargetFile());
        Diagnosis result = adjusted.withPatchKind(
                adjusted.getConfidence() > 0.0
                        ? PatchKindSelector.select(adjusted.getCategory(), adjusted.getScope(), unique)
                        : null);
        log.info("[Classifier] {}", result);
        return result;
    }

    private Diagnosis applyPrior(Diagnosis diagnosis) {
        PatternStats stats = knowledgeBase.statsFor(diagnosis.getSignatureKey());
        if (stats.isEmpty()) return diagnosis;

        double confidence = diagnosis.getConfidence();
        String note;
        if (stats.getHealed() > stats.getEscalated()) {
            confidence += PRIOR_STEP;
            note = "(healed " + stats.getHealed() + "x before)";
        } else if (stats.getEscalated() > stats.getHealed()) {
            confidence -= PRIOR_STEP;
            note = "(escalated " + stats.getEscalated() + "x before)";
        } else {
            return diagnosis;
        }
        log.debug("[Classifier] Prior for '{}': {} -> {}", diagnosis.getSignatureKey(),
                diagnosis.getConfidence(), confidence);
        return diagnosis.withConfidence(confidence, note);
    }

    private boolean isUniqueInTarget(String token, String target) {
        if (token == null || token.isBlank() || target == null) return false;
        try {
            String content = fileSystem.readFile(target);
            int first = content.indexOf(token);
            return first >= 0 && content.indexOf(token, first + 1) < 0;
        } catch (FileSystemException e) {
            log.debug("[Classifier] Cannot read {} for uniqueness check: {}", target, e.getMessage());
            return false;
        }
    }

    /**
     * Deepest project frame if it names a file in the tree, otherwise the
     * case's declared target, otherwise its test file.
     */
    private String resolveTarget(FailureSignature signature, TestMetadata metadata) {
        String frame = signature.getFailingFile();
        if (frame != null && fileSystem.fileExists(frame)) return frame;
        if (metadata.getTargetFile() != null) return metadata.getTargetFile();
        return metadata.getTestFile();
    }

    /**
     * The parsed error type followed by every error line of {@code text}, one
     * per line. Empty when the output carries no recognisable error line.
     */
    static String errorEvidence(String text, FailureSignature signature) {
        StringBuilder evidence = new StringBuilder();
        if (signature.getErrorType() != null) {
            evidence.append(signature.getErrorType()).append('\n');
        }
        Matcher m = ERROR_LINE.matcher(text);
        while (m.find()) {
            evidence.append(m.group().strip()).append('\n');
        }
        return evidence.toString();
    }

    private static boolean matchesAny(List<Pattern> patterns, String text) {
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) return true;
        }
        return false;
    }

    private static String firstLine(String text) {
        String line = text.strip().split("\\R", 2)[0];
        return line.length() > 200 ? line.substring(0, 200) + "..." : line;
    }
}
