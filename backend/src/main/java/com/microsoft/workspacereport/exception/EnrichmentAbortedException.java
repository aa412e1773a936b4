package com.microsoft.workspacereport.exception;

/**
 * Enumeration of the inventory stopped at the first failed workspace.
 *
 * Rows completed before the failure are discarded along with the rest of the run.
 */
public class EnrichmentAbortedException extends WorkspaceReportException {

    private final String workspaceId;
    private final int completedRows;
    private final int inventorySize;

    public EnrichmentAbortedException(String workspaceId, int completedRows, int inventorySize,
                                      LookupFailedException cause) {
        super("Report aborted at workspace " + workspaceId + " (" + cause.getItem() + "): "
                + cause.getMessage(), cause);
        this.workspaceId = workspaceId;
        this.completedRows = completedRows;
        this.inventorySize = inventorySize;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public int getCompletedRows() {
        return completedRows;
    }

    public int getInventorySize() {
        return inventorySize;
    }

    @Override
    public synchronized LookupFailedException getCause() {
        return (LookupFailedException) super.getCause();
    }
}
