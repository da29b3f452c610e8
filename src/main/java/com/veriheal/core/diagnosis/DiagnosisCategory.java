package com.veriheal.core.diagnosis;

public enum DiagnosisCategory {
    IMPORT_OR_NAME_ERROR,
    ENVIRONMENT_ERROR,
    ASSERTION_MISMATCH,
    MOCK_OR_FIXTURE_ERROR,
    AMBIGUOUS_OR_COMPLEX
}
