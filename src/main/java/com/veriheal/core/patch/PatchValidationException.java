package com.veriheal.core.patch;

/**
 * Raised by {@link PatchEngine#apply} when the patch does not validate against
 * the current file content. Nothing has been written when this is thrown.
 */
public class PatchValidationException extends PatchException {

    private final ValidationResult result;

    public PatchValidationException(ValidationResult result) {
        super("Patch rejected: " + result.getReason());
        this.result = result;
    }

    public ValidationResult getResult() {
        return result;
    }
}
