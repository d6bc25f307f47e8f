/* (C)2026 */
package com.ammann.qc.exception;

/**
 * Raised by a {@link com.ammann.qc.service.ReportSink} that could not hand a computed report
 * to its downstream consumer (export, notification, archive).
 *
 * <p>Delivery failures never invalidate the report itself; the dispatcher records them
 * separately.
 */
public class ReportDeliveryException extends ApiException {

    public ReportDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }

    public ReportDeliveryException(String message) {
        super(message);
    }
}
