package com.veriheal.core.collaborator;

import com.veriheal.core.checklist.FailureRecord;
import com.veriheal.core.patch.PatchKind;

/**
 * Everything a drafter sees when asked for a patch. {@code targetContent} is
 * null when the target file does not exist.
 */
public final class PatchRequest {

    private final String        caseId;
    private final PatchKind     kind;
    private final String        targetFile;
    private final String        targetContent;
    private final String        testFile;
    private final String        description;
    private final FailureRecord failure;
    private final String        previousRejection;

    private PatchRequest(Builder b) {
        this.caseId            = b.caseId;
        this.kind              = b.kind;
        this.targetFile        = b.targetFile;
        this.targetContent     = b.targetContent;
        this.testFile          = b.testFile;
        this.description       = b.description;
        this.failure           = b.failure;
        this.previousRejection = b.previousRejection;
    }

    public String        getCaseId()            { return caseId; }
    public PatchKind     getKind()              { return kind; }
    public String        getTargetFile()        { return targetFile; }
    public String        getTargetContent()     { return targetContent; }
    public String        getTestFile()          { return testFile; }
    public String        getDescription()       { return description; }
    public FailureRecord getFailure()           { return failure; }
    public String        getPreviousRejection() { return previousRejection; }

    public static Builder builder(String caseId, PatchKind kind, String targetFile) {
        return new Builder(caseId, kind, targetFile);
    }

    public static final class Builder {
        private final String    caseId;
        private final PatchKind kind;
        private final String    targetFile;
        private String        targetContent     = null;
        private String        testFile          = null;
        private String        description       = null;
        private FailureRecord failure           = null;
        private String        previousRejection = null;

        private Builder(String caseId, PatchKind kind, String targetFile) {
            this.caseId     = caseId;
            this.kind       = kind;
            this.targetFile = targetFile;
        }

        public Builder targetContent(String v)     { this.targetContent = v;     return this; }
        public Builder testFile(String v)          { this.testFile = v;          return this; }
        public Builder description(String v)       { this.description = v;       return this; }
        public Builder failure(FailureRecord v)    { this.failure = v;           return this; }
        public Builder previousRejection(String v) { this.previousRejection = v; return this; }

        public PatchRequest build() { return new PatchRequest(this); }
    }
}
