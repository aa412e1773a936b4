package com.microsoft.workspacereport.exception;

/**
 * The workspace connection status could not be read.
 */
public class ConnectionStatusQueryFailedException extends LookupFailedException {

    public ConnectionStatusQueryFailedException(String item, Throwable cause) {
        super(item, "Connection status query failed for " + item + ": " + cause.getMessage(), cause);
    }
}
