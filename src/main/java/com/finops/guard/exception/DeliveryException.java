package com.finops.guard.exception;

/**
 * The notification sink could not hand the report to its destination
 * (transport failure, timeout or non-2xx response).
 */
public class DeliveryException extends RuntimeException {

    private final int statusCode;

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public DeliveryException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the destination, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
