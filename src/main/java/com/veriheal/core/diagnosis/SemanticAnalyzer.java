package com.veriheal.core.diagnosis;

import java.util.Optional;

/**
 * Second-opinion classifier for failures the deterministic rules cannot
 * settle, such as assertion mismatches. Implementations are stateless and
 * return empty when they cannot produce a usable assessment.
 */
public interface SemanticAnalyzer {

    Optional<SemanticAssessment> assess(String failureText, TestMetadata metadata, FailureSignature signature);
}
