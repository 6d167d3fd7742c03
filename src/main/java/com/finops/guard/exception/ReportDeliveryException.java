package com.finops.guard.exception;

import com.finops.guard.model.ReportPayload;

/**
 * Delivery failed after the weekly report was fully computed.
 * The report stays available to the caller through {@link #getReport()}.
 */
public class ReportDeliveryException extends RuntimeException {

    private final transient ReportPayload report;

    public ReportDeliveryException(ReportPayload report, DeliveryException cause) {
        super("Report computed but delivery failed: " + cause.getMessage(), cause);
        this.report = report;
    }

    public ReportPayload getReport() {
        return report;
    }
}
