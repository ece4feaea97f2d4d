package com.appmonitor.collector.exception;

import com.appmonitor.collector.model.FailureKind;

public class ReportParseException extends CollectionException {

    public ReportParseException(String message) {
        super(FailureKind.PARSE, message);
    }

    public ReportParseException(String message, Throwable cause) {
        super(FailureKind.PARSE, message, cause);
    }
}
