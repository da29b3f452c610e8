package com.veriheal.core.diagnosis;

public final class SemanticAssessment {

    private final DiagnosisCategory category;
    private final FailureScope      scope;
    private final double            confidence;
    private final String            targetFile;
    private final String            explanation;

    public SemanticAssessment(DiagnosisCategory category, FailureScope scope, double confidence,
                              String targetFile, String explanation) {
        this.category    = category;
        this.scope       = scope;
        this.confidence  = confidence;
        this.targetFile  = targetFile;
        this.explanation = explanation;
    }

    public DiagnosisCategory getCategory()    { return category; }
    public FailureScope      getScope()       { return scope; }
    public double            getConfidence()  { return confidence; }
    public String            getTargetFile()  { return targetFile; }
    public String            getExplanation() { return explanation; }
}
