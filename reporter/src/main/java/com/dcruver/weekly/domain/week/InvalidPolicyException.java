package com.dcruver.weekly.domain.week;

/**
 * Unsupported policy name, or a policy used without the parameters it needs.
 */
public class InvalidPolicyException extends RuntimeException {

    public InvalidPolicyException(String message) {
        super(message);
    }
}
