package com.veriheal.core.diagnosis;

import com.veriheal.core.checklist.TestCase;

/**
 * What the classifier is allowed to know about the case besides its output.
 */
public final class TestMetadata {

    private final String caseId;
    private final String selector;
    private final String testFile;
    private final String targetFile;
    private final String description;
    private final int    retryCount;

    public TestMetadata(String caseId, String selector, String testFile,
                        String targetFile, String description, int retryCount) {
        this.caseId      = caseId;
        this.selector    = selector;
        this.testFile    = testFile;
        this.targetFile  = targetFile;
        this.description = description;
        this.retryCount  = retryCount;
    }

    public static TestMetadata of(TestCase testCase) {
        return new TestMetadata(testCase.getId(), testCase.getSelector(), testCase.getTestFile(),
                testCase.getTargetFile(), testCase.getDescription(), testCase.getRetryCount());
    }

    public String getCaseId()      { return caseId; }
    public String getSelector()    { return selector; }
    public String getTestFile()    { return testFile; }
    public String getTargetFile()  { return targetFile; }
    public String getDescription() { return description; }
    public int    getRetryCount()  { return retryCount; }
}
