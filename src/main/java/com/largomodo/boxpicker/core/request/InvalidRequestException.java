package com.largomodo.boxpicker.core.request;

import java.util.List;

/**
 * Thrown when a pack request cannot be decoded or fails validation.
 * <p>
 * Unchecked, like the other request-level failures: the processor catches it at a single
 * point and turns it into an error response, so intermediate layers need no catch blocks.
 */
public class InvalidRequestException extends RuntimeException {

    private final ErrorCode errorCode;
    private final List<Violation> violations;

    /**
     * Request rejected with every collected violation.
     */
    public InvalidRequestException(List<Violation> violations) {
        super("Request failed validation with " + violations.size() + " violation(s): " + violations);
        this.errorCode = ErrorCode.VALIDATION_ERROR;
        this.violations = List.copyOf(violations);
    }

    /**
     * Request body is not parseable JSON.
     */
    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = ErrorCode.INVALID_JSON;
        this.violations = List.of();
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public List<Violation> getViolations() {
        return violations;
    }
}
