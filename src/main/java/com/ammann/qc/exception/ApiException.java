/* (C)2026 */
package com.ammann.qc.exception;

/**
 * Base unchecked exception for all application-level errors of the QC fault detector.
 *
 * <p>Subclasses represent specific error categories (invalid parameters, report delivery
 * failures) and are mapped to HTTP status codes by {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException {

    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }

    public ApiException(String message) {
        super(message);
    }
}
