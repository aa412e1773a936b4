package com.microsoft.workspacereport.domain.model;

/**
 * What happens to the run when a lookup for one workspace fails.
 */
public enum FailurePolicy {
    /**
     * Stop at the first failed workspace and discard everything. No report is written.
     */
    ABORT_RUN,

    /**
     * Record the failed workspace as a row carrying the failure reason and keep going.
     */
    ISOLATE_RESOURCE
}
