package com.microsoft.workspacereport.adapters;

import com.microsoft.workspacereport.domain.model.WorkspaceRecord;

import java.util.List;

/**
 * Port for listing the workspaces of a region.
 *
 * Implementations hide any paging of the backing service and return the
 * complete set in a single call.
 */
public interface WorkspaceInventory {

    /**
     * @param region region code, e.g. {@code us-east-1}
     * @return every workspace in the region, in service order
     * @throws com.microsoft.workspacereport.exception.InventoryUnavailableException
     *         if the backing service fails; no partial inventory is returned
     */
    List<WorkspaceRecord> listWorkspaces(String region);
}
