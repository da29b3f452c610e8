package com.veriheal.core.sandbox;

/**
 * The sandbox itself could not run the test (no temp space, command missing).
 * Distinct from a test that ran and failed.
 */
public class SandboxException extends Exception {

    public SandboxException(String message) {
        super(message);
    }

    public SandboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
