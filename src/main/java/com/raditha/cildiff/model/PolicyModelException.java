package com.raditha.cildiff.model;

/**
 * Raised when the policy model is inconsistent in a way the comparison cannot recover from.
 */
public class PolicyModelException extends RuntimeException {

    public PolicyModelException(String message) {
        super(message);
    }

    public PolicyModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
