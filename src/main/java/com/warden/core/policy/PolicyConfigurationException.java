package com.warden.core.policy;

/**
 * Thrown when a policy cannot be activated, e.g. an identifier is both allowed and denied.
 * The previously active policy stays in force.
 */
public class PolicyConfigurationException extends RuntimeException {

    public PolicyConfigurationException(String message) {
        super(message);
    }

    public PolicyConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
