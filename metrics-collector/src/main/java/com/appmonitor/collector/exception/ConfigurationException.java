package com.appmonitor.collector.exception;

import com.appmonitor.collector.model.FailureKind;

/**
 * Missing or unusable credentials, bucket settings or vendor identifiers for an app.
 */
public class ConfigurationException extends CollectionException {

    public ConfigurationException(String message) {
        super(FailureKind.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(FailureKind.CONFIGURATION, message, cause);
    }
}
