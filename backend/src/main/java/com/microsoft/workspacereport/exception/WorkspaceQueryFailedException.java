package com.microsoft.workspacereport.exception;

/**
 * Tags, bundle or directory details of a workspace could not be read.
 */
public class WorkspaceQueryFailedException extends LookupFailedException {

    public WorkspaceQueryFailedException(String item, Throwable cause) {
        super(item, "WorkSpaces query failed for " + item + ": " + cause.getMessage(), cause);
    }
}
