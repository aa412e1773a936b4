package com.microsoft.workspacereport.exception;

/**
 * The metrics service could not be queried for workspace activity.
 */
public class MetricsQueryFailedException extends LookupFailedException {

    public MetricsQueryFailedException(String item, Throwable cause) {
        super(item, "Metrics query failed for " + item + ": " + cause.getMessage(), cause);
    }
}
