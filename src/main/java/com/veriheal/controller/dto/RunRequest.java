package com.veriheal.controller.dto;

import com.veriheal.core.checklist.TestCase;

import java.util.ArrayList;
import java.util.List;

public class RunRequest {

    private String runId;
    private List<TestCase> cases = new ArrayList<>();

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public List<TestCase> getCases() {
        return cases;
    }

    public void setCases(List<TestCase> cases) {
        this.cases = cases;
    }
}
