package com.microsoft.workspacereport.exception;

/**
 * Subnet placement could not be resolved.
 */
public class TopologyQueryFailedException extends LookupFailedException {

    public TopologyQueryFailedException(String item, Throwable cause) {
        super(item, "Subnet query failed for " + item + ": " + cause.getMessage(), cause);
    }
}
