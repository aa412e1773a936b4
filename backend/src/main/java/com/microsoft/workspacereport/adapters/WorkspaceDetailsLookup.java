package com.microsoft.workspacereport.adapters;

import com.microsoft.workspacereport.domain.model.ConnectionStatus;

import java.util.Map;

/**
 * Port for per-workspace details kept by the WorkSpaces service itself.
 */
public interface WorkspaceDetailsLookup {

    /**
     * Current connection state. Returns {@link ConnectionStatus#unknown()} when the
     * service reports nothing for the workspace.
     *
     * @throws com.microsoft.workspacereport.exception.ConnectionStatusQueryFailedException
     */
    ConnectionStatus fetchConnectionStatus(String workspaceId);

    /**
     * @return tag key to value
     * @throws com.microsoft.workspacereport.exception.WorkspaceQueryFailedException
     */
    Map<String, String> fetchTags(String workspaceId);

    /**
     * @return registered directory name, or null if the directory is not registered
     * @throws com.microsoft.workspacereport.exception.WorkspaceQueryFailedException
     */
    String resolveDirectoryName(String directoryId);

    /**
     * @return bundle name, or null if the bundle no longer exists
     * @throws com.microsoft.workspacereport.exception.WorkspaceQueryFailedException
     */
    String resolveBundleName(String bundleId);
}
