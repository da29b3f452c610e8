package com.veriheal.core.diagnosis;

import com.veriheal.core.patch.PatchKind;

/**
 * Classified root cause of a failure. {@code recommendedPatchKind} is null
 * for ENVIRONMENT_ERROR, which is retried without a patch.
 */
public final class Diagnosis {

    private final DiagnosisCategory category;
    private final double            confidence;
    private final FailureScope      scope;
    private final PatchKind         recommendedPatchKind;
    private final String            targetFile;
    private final String            failingToken;
    private final String            signatureKey;
    private final String            explanation;

    public Diagnosis(DiagnosisCategory category, double confidence, FailureScope scope,
                     PatchKind recommendedPatchKind, String targetFile, String failingToken,
                     String signatureKey, String explanation) {
        this.category             = category;
        this.confidence           = Math.max(0.0, Math.min(1.0, confidence));
        this.scope                = scope;
        this.recommendedPatchKind = recommendedPatchKind;
        this.targetFile           = targetFile;
        this.failingToken         = failingToken;
        this.signatureKey         = signatureKey;
        this.explanation          = explanation;
    }

    public Diagnosis withConfidence(double newConfidence, String note) {
        return new Diagnosis(category, newConfidence, scope, recommendedPatchKind, targetFile,
                failingToken, signatureKey, note == null ? explanation : explanation + " " + note);
    }

    public Diagnosis withPatchKind(PatchKind kind) {
        return new Diagnosis(category, confidence, scope, kind, targetFile,
                failingToken, signatureKey, explanation);
    }

    public DiagnosisCategory getCategory()             { return category; }
    public double            getConfidence()           { return confidence; }
    public FailureScope      getScope()                { return scope; }
    public PatchKind         getRecommendedPatchKind() { return recommendedPatchKind; }
    public String            getTargetFile()           { return targetFile; }
    public String            getFailingToken()         { return failingToken; }
    public String            getSignatureKey()         { return signatureKey; }
    public String            getExplanation()          { return explanation; }

    @Override
    public String toString() {
        return String.format("Diagnosis{%s, confidence=%.2f, scope=%s, kind=%s, target=%s}",
                category, confidence, scope, recommendedPatchKind, targetFile);
    }
}
