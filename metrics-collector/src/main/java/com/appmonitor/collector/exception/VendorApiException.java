package com.appmonitor.collector.exception;

import com.appmonitor.collector.model.FailureKind;

/**
 * Non-success HTTP response from a vendor API, with the vendor's own error detail.
 */
public class VendorApiException extends CollectionException {

    private final int statusCode;

    public VendorApiException(int statusCode, String detail) {
        this(statusCode, detail, null);
    }

    public VendorApiException(int statusCode, String detail, Throwable cause) {
        super(kindFor(statusCode), "HTTP " + statusCode + ": " + detail, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }

    static FailureKind kindFor(int statusCode) {
        if (statusCode == 401 || statusCode == 403) {
            return FailureKind.AUTH;
        }
        if (statusCode >= 400 && statusCode < 500) {
            return FailureKind.CONFIGURATION;
        }
        return FailureKind.TRANSIENT_NETWORK;
    }
}
