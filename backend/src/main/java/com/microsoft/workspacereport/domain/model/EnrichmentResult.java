package com.microsoft.workspacereport.domain.model;

/**
 * Outcome of enriching the workspace at a given inventory position.
 *
 * Exactly one of {@code row} and {@code failureReason} is non-null.
 */
public record EnrichmentResult(
        int position,
        WorkspaceRecord workspace,
        ReportRow row,
        String failureReason
) {

    public static EnrichmentResult success(int position, ReportRow row) {
        return new EnrichmentResult(position, row.getWorkspace(), row, null);
    }

    public static EnrichmentResult failed(int position, WorkspaceRecord workspace, String reason) {
        return new EnrichmentResult(position, workspace, null, reason);
    }

    public boolean succeeded() {
        return row != null;
    }
}
