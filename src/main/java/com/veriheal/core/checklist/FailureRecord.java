package com.veriheal.core.checklist;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.veriheal.core.diagnosis.DiagnosisCategory;
import com.veriheal.core.diagnosis.FailureScope;
import com.veriheal.core.patch.PatchKind;

import java.time.Instant;

/**
 * The failure text of one verification attempt and the diagnosis it got.
 *
 * Created when a case enters FAILED, with no diagnosis fields; completed by
 * {@link #withDiagnosis} once the classifier has run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FailureRecord {

    /** Error text is stored up to this many characters. */
    public static final int MAX_ERROR_CHARS = 8_000;

    private final String            errorText;
    private final int               attempt;
    private final boolean           timedOut;
    private final Instant           recordedAt;
    private final DiagnosisCategory category;
    private final FailureScope      scope;
    private final Double            confidence;
    private final PatchKind         recommendedPatchKind;
    private final String            targetFile;
    private final String            failingToken;
    private final String            signatureKey;
    private final String            explanation;

    @JsonCreator
    public FailureRecord(
            @JsonProperty("errorText")            String            errorText,
            @JsonProperty("attempt")              int               attempt,
            @JsonProperty("timedOut")             boolean           timedOut,
            @JsonProperty("recordedAt")           Instant           recordedAt,
            @JsonProperty("category")             DiagnosisCategory category,
            @JsonProperty("scope")                FailureScope      scope,
            @JsonProperty("confidence")           Double            confidence,
            @JsonProperty("recommendedPatchKind") PatchKind         recommendedPatchKind,
            @JsonProperty("targetFile")           String            targetFile,
            @JsonProperty("failingToken")         String            failingToken,
            @JsonProperty("signatureKey")         String            signatureKey,
            @JsonProperty("explanation")          String            explanation
    ) {
        this.errorText            = truncate(errorText);
        this.attempt              = attempt;
        this.timedOut             = timedOut;
        this.recordedAt           = recordedAt;
        this.category             = category;
        this.scope                = scope;
        this.confidence           = confidence;
        this.recommendedPatchKind = recommendedPatchKind;
        this.targetFile           = targetFile;
        this.failingToken         = failingToken;
        this.signatureKey         = signatureKey;
        this.explanation          = explanation;
    }

    public static FailureRecord undiagnosed(String errorText, int attempt, boolean timedOut) {
        return new FailureRecord(errorText, attempt, timedOut, Instant.now(),
                null, null, null, null, null, null, null, null);
    }

    public FailureRecord withDiagnosis(DiagnosisCategory category, FailureScope scope, double confidence,
                                       PatchKind recommendedPatchKind, String targetFile,
                                       String failingToken, String signatureKey, String explanation) {
        return new FailureRecord(errorText, attempt, timedOut, recordedAt, category, scope, confidence,
                recommendedPatchKind, targetFile, failingToken, signatureKey, explanation);
    }

    public boolean isDiagnosed() {
        return category != null;
    }

    public String            getErrorText()            { return errorText; }
    public int               getAttempt()              { return attempt; }
    public boolean           isTimedOut()              { return timedOut; }
    public Instant           getRecordedAt()           { return recordedAt; }
    public DiagnosisCategory getCategory()             { return category; }
    public FailureScope      getScope()                { return scope; }
    public Double            getConfidence()           { return confidence; }
    public PatchKind         getRecommendedPatchKind() { return recommendedPatchKind; }
    public String            getTargetFile()           { return targetFile; }
    public String            getFailingToken()         { return failingToken; }
    public String            getSignatureKey()         { return signatureKey; }
    public String            getExplanation()          { return explanation; }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_ERROR_CHARS) return text;
        return text.substring(0, MAX_ERROR_CHARS) + "\n... [truncated]";
    }

    @Override
    public String toString() {
        return "FailureRecord{attempt=" + attempt + ", category=" + category
                + ", confidence=" + confidence + ", timedOut=" + timedOut + "}";
    }
}
