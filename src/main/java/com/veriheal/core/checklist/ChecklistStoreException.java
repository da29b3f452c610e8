package com.veriheal.core.checklist;

/**
 * The checklist medium could not be read or written. Fatal for the case
 * being processed; the store does not retry.
 */
public class ChecklistStoreException extends Exception {

    public ChecklistStoreException(String message) {
        super(message);
    }

    public ChecklistStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
