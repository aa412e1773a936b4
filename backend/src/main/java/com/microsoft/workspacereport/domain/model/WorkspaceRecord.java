package com.microsoft.workspacereport.domain.model;

/**
 * Static attributes of a single WorkSpace as returned by the inventory.
 *
 * Immutable once read. Boxed types are null when the inventory did not
 * report a value (e.g. volume sizes of a workspace still being provisioned).
 */
public record WorkspaceRecord(
        String workspaceId,
        String region,
        String userName,
        String computerName,
        String ipAddress,
        String directoryId,
        String bundleId,
        String subnetId,
        String state,
        Boolean rootVolumeEncryptionEnabled,
        Boolean userVolumeEncryptionEnabled,
        String computeType,
        Integer rootVolumeSizeGib,
        Integer userVolumeSizeGib,
        String runningMode,
        Integer autoStopTimeoutMinutes
) {}
