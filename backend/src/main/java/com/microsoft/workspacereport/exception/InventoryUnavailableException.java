package com.microsoft.workspacereport.exception;

/**
 * The workspace inventory could not be listed. Fatal to the run.
 */
public class InventoryUnavailableException extends WorkspaceReportException {

    private final String region;

    public InventoryUnavailableException(String region, Throwable cause) {
        super("Unable to list WorkSpaces in " + region + ": " + cause.getMessage(), cause);
        this.region = region;
    }

    public String getRegion() {
        return region;
    }
}
