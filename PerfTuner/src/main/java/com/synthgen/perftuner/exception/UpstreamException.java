package com.synthgen.perftuner.exception;

/**
 * Failure of one upstream completion attempt.
 *
 * Carries the HTTP status when the endpoint answered, or null when the call
 * failed at the transport level (connect error, read timeout).
 */
public class UpstreamException extends Exception {

    private final Integer status;

    public UpstreamException(Integer status, String message) {
        super(message);
        this.status = status;
    }

    public UpstreamException(Integer status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public static UpstreamException transport(String message, Throwable cause) {
        return new UpstreamException(null, message, cause);
    }

    /** Null on transport failure. */
    public Integer getStatus() {
        return status;
    }

    public boolean isTransportFailure() {
        return status == null;
    }
}
