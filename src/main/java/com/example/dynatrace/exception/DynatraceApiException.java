package com.example.dynatrace.exception;

/**
 * Raised when a call to the Dynatrace API could not be completed: connection failure,
 * non-2xx status or a response that cannot be interpreted.
 */
public class DynatraceApiException extends RuntimeException {

    /** Status used when no HTTP response was received at all. */
    public static final int NO_RESPONSE = 0;

    private final int statusCode;
    private final String errorCode;

    public DynatraceApiException(String message) {
        super(message);
        this.statusCode = 500;
        this.errorCode = "DYNATRACE_API_ERROR";
    }

    public DynatraceApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 500;
        this.errorCode = "DYNATRACE_API_ERROR";
    }

    public DynatraceApiException(String message, int statusCode, String errorCode) {
        super(message);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    public DynatraceApiException(String message, int statusCode, String errorCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
