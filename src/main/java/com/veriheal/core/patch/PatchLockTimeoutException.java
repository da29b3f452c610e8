package com.veriheal.core.patch;

/**
 * The per-file lock could not be obtained in time. Treated as fatal for the
 * case that requested it.
 */
public class PatchLockTimeoutException extends PatchException {

    private final String lockKey;

    public PatchLockTimeoutException(String lockKey, long timeoutMs) {
        super("Timed out after " + timeoutMs + "ms waiting for lock on " + lockKey);
        this.lockKey = lockKey;
    }

    public String getLockKey() {
        return lockKey;
    }
}
