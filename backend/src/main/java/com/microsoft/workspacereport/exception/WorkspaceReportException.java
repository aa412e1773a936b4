package com.microsoft.workspacereport.exception;

/**
 * Base type for all failures raised while building the report.
 */
public class WorkspaceReportException extends RuntimeException {

    public WorkspaceReportException(String message) {
        super(message);
    }

    public WorkspaceReportException(String message, Throwable cause) {
        super(message, cause);
    }
}
