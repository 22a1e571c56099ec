package com.github.salilvnair.j1ql.engine.exception;

public enum J1qlErrorCode {

    // =========================
    // Transport errors
    // =========================
    TRANSPORT_IO_FAILED(
            "HTTP call to J1QL endpoint failed",
            true
    ),

    EXECUTION_CANCELLED(
            "J1QL execution was cancelled",
            false
    ),

    INVALID_REQUEST_URL(
            "Request URL is not a valid absolute http(s) URL",
            false
    ),

    // =========================
    // Payload errors
    // =========================
    REQUEST_SERIALIZATION_FAILED(
            "Failed to serialize J1QL request body",
            false
    ),

    RESPONSE_PARSE_FAILED(
            "J1QL response body is not valid JSON",
            false
    ),

    DEFERRED_URL_MISSING(
            "J1QL submission response did not include a deferred result url",
            false
    ),

    RESULT_PAGE_MALFORMED(
            "J1QL download document is not a result page",
            false
    ),

    // =========================
    // Fallback
    // =========================
    INTERNAL_ERROR(
            "Internal engine error",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    J1qlErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
