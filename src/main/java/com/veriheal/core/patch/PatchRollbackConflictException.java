package com.veriheal.core.patch;

/**
 * A rollback could not undo its patch because the lines it changed were
 * edited again since the apply. The file is left as it was found.
 */
public class PatchRollbackConflictException extends PatchException {

    private final String patchId;

    public PatchRollbackConflictException(String patchId, String message, Throwable cause) {
        super(message, cause);
        this.patchId = patchId;
    }

    public String getPatchId() {
        return patchId;
    }
}
