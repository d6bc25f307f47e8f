/* (C)2026 */
package com.ammann.qc.exception;

/**
 * Exception indicating that process parameters or an input series do not meet the
 * constraints of the requested analysis.
 *
 * <p>Raised at parameter construction or detector call and never recovered from inside
 * the engine: the analysis is aborted. Mapped to HTTP 400 by {@link GlobalExceptionHandler}.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for insufficient data.
     */
    public static ValidationException insufficientData(
            String resourceType, int required, int actual) {
        return new ValidationException(
                String.format(
                        "Insufficient %s: need at least %d, but got %d",
                        resourceType, required, actual));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(
            String paramName, Object value, String expected) {
        return new ValidationException(
                String.format(
                        "Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}
