package com.mg.content_guard.model;

/**
 * Thrown while building a {@link WhitelistPolicy} that cannot be served safely.
 * Raised at startup only; the application must not come up with a bad policy.
 */
public class PolicyConfigurationException extends RuntimeException {

    public PolicyConfigurationException(String message) {
        super(message);
    }
}
