package com.microsoft.workspacereport.exception;

import java.time.Duration;

/**
 * The lookups for one workspace did not all complete within the configured timeout.
 */
public class LookupTimeoutException extends LookupFailedException {

    public LookupTimeoutException(String workspaceId, Duration timeout) {
        super(workspaceId, "Lookups for " + workspaceId + " did not complete within " + timeout, null);
    }
}
