package com.microsoft.workspacereport.exception;

/**
 * The user or computer directory could not be queried.
 */
public class DirectoryQueryFailedException extends LookupFailedException {

    public DirectoryQueryFailedException(String item, Throwable cause) {
        super(item, "Directory query failed for " + item + ": " + cause.getMessage(), cause);
    }
}
