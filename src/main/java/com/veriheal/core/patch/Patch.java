package com.veriheal.core.patch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A proposed change to one file of the source tree.
 *
 * Payload fields are kind-specific: {@code oldText}/{@code newText} for
 * TARGETED_REPLACE, {@code diffBody} for UNIFIED_DIFF, {@code content} for
 * FULL_REWRITE. The id is assigned by the patch engine on apply when the
 * drafter leaves it empty.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Patch {

    private final String      id;
    private final PatchKind   kind;
    private final String      targetFile;
    private final String      oldText;
    private final String      newText;
    private final String      diffBody;
    private final String      content;
    private final double      confidence;
    private final PatchOrigin origin;
    private final String      rationale;

    @JsonCreator
    public Patch(
            @JsonProperty("id")         String      id,
            @JsonProperty("kind")       PatchKind   kind,
            @JsonProperty("targetFile") String      targetFile,
            @JsonProperty("oldText")    String      oldText,
            @JsonProperty("newText")    String      newText,
            @JsonProperty("diffBody")   String      diffBody,
            @JsonProperty("content")    String      content,
            @JsonProperty("confidence") double      confidence,
            @JsonProperty("origin")     PatchOrigin origin,
            @JsonProperty("rationale")  String      rationale
    ) {
        if (kind == null)       throw new IllegalArgumentException("Patch kind is required");
        if (targetFile == null || targetFile.isBlank())
            throw new IllegalArgumentException("Patch target file is required");
        this.id         = id;
        this.kind       = kind;
        this.targetFile = targetFile;
        this.oldText    = oldText;
        this.newText    = newText;
        this.diffBody   = diffBody;
        this.content    = content;
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
        this.origin     = origin != null ? origin : PatchOrigin.AUTOMATED;
        this.rationale  = rationale;
    }

    // ----------------------------------------------------------------
    // Factories
    // ----------------------------------------------------------------

    public static Patch targetedReplace(String targetFile, String oldText, String newText, double confidence) {
        return new Patch(null, PatchKind.TARGETED_REPLACE, targetFile, oldText, newText,
                null, null, confidence, PatchOrigin.AUTOMATED, null);
    }

    public static Patch unifiedDiff(String targetFile, String diffBody, double confidence) {
        return new Patch(null, PatchKind.UNIFIED_DIFF, targetFile, null, null,
                diffBody, null, confidence, PatchOrigin.AUTOMATED, null);
    }

    public static Patch fullRewrite(String targetFile, String content, double confidence) {
        return new Patch(null, PatchKind.FULL_REWRITE, targetFile, null, null,
                null, content, confidence, PatchOrigin.AUTOMATED, null);
    }

    public Patch withId(String newId) {
        return new Patch(newId, kind, targetFile, oldText, newText, diffBody, content, confidence, origin, rationale);
    }

    public Patch withOrigin(PatchOrigin newOrigin) {
        return new Patch(id, kind, targetFile, oldText, newText, diffBody, content, confidence, newOrigin, rationale);
    }

    public Patch withRationale(String newRationale) {
        return new Patch(id, kind, targetFile, oldText, newText, diffBody, content, confidence, origin, newRationale);
    }

    // ----------------------------------------------------------------
    // Accessors
    // ----------------------------------------------------------------

    public String      getId()         { return id; }
    public PatchKind   getKind()       { return kind; }
    public String      getTargetFile() { return targetFile; }
    public String      getOldText()    { return oldText; }
    public String      getNewText()    { return newText; }
    public String      getDiffBody()   { return diffBody; }
    public String      getContent()    { return content; }
    public double      getConfidence() { return confidence; }
    public PatchOrigin getOrigin()     { return origin; }
    public String      getRationale()  { return rationale; }

    @Override
    public String toString() {
        return "Patch{" + (id != null ? id + ", " : "") + kind + " on " + targetFile
                + ", origin=" + origin + ", confidence=" + confidence + "}";
    }
}
