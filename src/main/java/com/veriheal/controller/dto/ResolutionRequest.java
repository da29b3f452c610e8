package com.veriheal.controller.dto;

import com.veriheal.core.patch.Patch;

/**
 * Reviewer verdict for an escalated case. {@code patch} is only accepted with
 * verdict FIX.
 */
public class ResolutionRequest {

    private String verdict;
    private Patch patch;
    private String note;

    public String getVerdict() {
        return verdict;
    }

    public void setVerdict(String verdict) {
        this.verdict = verdict;
    }

    public Patch getPatch() {
        return patch;
    }

    public void setPatch(Patch patch) {
        this.patch = patch;
    }

    public String getNote() {
        return note;
    }

    public void setNote(String note) {
        this.note = note;
    }
}
