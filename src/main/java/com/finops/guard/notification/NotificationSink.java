package com.finops.guard.notification;

import com.finops.guard.exception.DeliveryException;
import com.finops.guard.model.ReportPayload;

/**
 * Destination for the finished weekly report.
 */
public interface NotificationSink {

    /**
     * Whether a destination is set. An unconfigured sink is skipped, not treated as a failure.
     */
    boolean isConfigured();

    /**
     * Render and deliver the report. No retry.
     *
     * @throws DeliveryException on transport failure, timeout or a non-2xx response
     */
    void deliver(ReportPayload report);

    /**
     * Short channel name used in logs and metrics.
     */
    String channel();
}
