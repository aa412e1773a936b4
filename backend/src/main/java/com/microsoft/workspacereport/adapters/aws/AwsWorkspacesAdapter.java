package com.microsoft.workspacereport.adapters.aws;

import com.microsoft.workspacereport.adapters.WorkspaceDetailsLookup;
import com.microsoft.workspacereport.adapters.WorkspaceInventory;
import com.microsoft.workspacereport.domain.model.ConnectionStatus;
import com.microsoft.workspacereport.domain.model.WorkspaceRecord;
import com.microsoft.workspacereport.exception.ConnectionStatusQueryFailedException;
import com.microsoft.workspacereport.exception.InventoryUnavailableException;
import com.microsoft.workspacereport.exception.WorkspaceQueryFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.workspaces.WorkSpacesClient;
import software.amazon.awssdk.services.workspaces.model.DescribeTagsRequest;
import software.amazon.awssdk.services.workspaces.model.DescribeWorkspaceBundlesRequest;
import software.amazon.awssdk.services.workspaces.model.DescribeWorkspaceDirectoriesRequest;
import software.amazon.awssdk.services.workspaces.model.DescribeWorkspacesConnectionStatusRequest;
import software.amazon.awssdk.services.workspaces.model.DescribeWorkspacesRequest;
import software.amazon.awssdk.services.workspaces.model.DescribeWorkspacesResponse;
import software.amazon.awssdk.services.workspaces.model.Tag;
import software.amazon.awssdk.services.workspaces.model.Workspace;
import software.amazon.awssdk.services.workspaces.model.WorkspaceBundle;
import software.amazon.awssdk.services.workspaces.model.WorkspaceDirectory;
import software.amazon.awssdk.services.workspaces.model.WorkspaceProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Amazon WorkSpaces adapter.
 *
 * DATA SOURCES:
 * 1. DescribeWorkspaces - inventory, paged internally until exhausted
 * 2. DescribeWorkspacesConnectionStatus - point-in-time connection state
 * 3. DescribeTags - workspace tags
 * 4. DescribeWorkspaceDirectories / DescribeWorkspaceBundles - display names
 *
 * Directory and bundle names are shared by many workspaces and cached for the run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AwsWorkspacesAdapter implements WorkspaceInventory, WorkspaceDetailsLookup {

    private final WorkSpacesClient workSpacesClient;

    @Override
    public List<WorkspaceRecord> listWorkspaces(String region) {
        log.info("Listing WorkSpaces in region: {}", region);

        List<WorkspaceRecord> records = new ArrayList<>();
        String nextToken = null;
        try {
            do {
                DescribeWorkspacesResponse page = workSpacesClient.describeWorkspaces(
                        DescribeWorkspacesRequest.builder().nextToken(nextToken).build());
                for (Workspace workspace : page.workspaces()) {
                    records.add(toRecord(region, workspace));
                }
                nextToken = page.nextToken();
            } while (nextToken != null && !nextToken.isEmpty());
        } catch (SdkException e) {
            throw new InventoryUnavailableException(region, e);
        }

        log.info("Found {} WorkSpaces in {}", records.size(), region);
        return records;
    }

    @Override
    public ConnectionStatus fetchConnectionStatus(String workspaceId) {
        log.debug("Fetching connection status: {}", workspaceId);
        try {
            return workSpacesClient.describeWorkspacesConnectionStatus(
                            DescribeWorkspacesConnectionStatusRequest.builder()
                                    .workspaceIds(workspaceId)
                                    .build())
                    .workspacesConnectionStatus()
                    .stream()
                    .findFirst()
                    .map(status -> new ConnectionStatus(
                            status.connectionStateAsString(),
                            status.connectionStateCheckTimestamp(),
                            status.lastKnownUserConnectionTimestamp()))
                    .orElseGet(ConnectionStatus::unknown);
        } catch (SdkException e) {
            throw new ConnectionStatusQueryFailedException(workspaceId, e);
        }
    }

    @Override
    public Map<String, String> fetchTags(String workspaceId) {
        log.debug("Fetching tags: {}", workspaceId);
        try {
            Map<String, String> tags = new TreeMap<>();
            for (Tag tag : workSpacesClient.describeTags(
                    DescribeTagsRequest.builder().resourceId(workspaceId).build()).tagList()) {
                tags.put(tag.key(), tag.value() == null ? "" : tag.value());
            }
            return tags;
        } catch (SdkException e) {
            throw new WorkspaceQueryFailedException(workspaceId, e);
        }
    }

    @Override
    @Cacheable("directoryNames")
    public String resolveDirectoryName(String directoryId) {
        log.debug("Resolving directory name: {}", directoryId);
        try {
            return workSpacesClient.describeWorkspaceDirectories(
                            DescribeWorkspaceDirectoriesRequest.builder()
                                    .directoryIds(directoryId)
                                    .build())
                    .directories()
                    .stream()
                    .findFirst()
                    .map(WorkspaceDirectory::directoryName)
                    .orElse(null);
        } catch (SdkException e) {
            throw new WorkspaceQueryFailedException(directoryId, e);
        }
    }

    @Override
    @Cacheable("bundleNames")
    public String resolveBundleName(String bundleId) {
        log.debug("Resolving bundle name: {}", bundleId);
        try {
            return workSpacesClient.describeWorkspaceBundles(
                            DescribeWorkspaceBundlesRequest.builder()
                                    .bundleIds(bundleId)
                                    .build())
                    .bundles()
                    .stream()
                    .findFirst()
                    .map(WorkspaceBundle::name)
                    .orElse(null);
        } catch (SdkException e) {
            throw new WorkspaceQueryFailedException(bundleId, e);
        }
    }

    private WorkspaceRecord toRecord(String region, Workspace workspace) {
        WorkspaceProperties properties = workspace.workspaceProperties();
        return new WorkspaceRecord(
                workspace.workspaceId(),
                region,
                workspace.userName(),
                workspace.computerName(),
                workspace.ipAddress(),
                workspace.directoryId(),
                workspace.bundleId(),
                workspace.subnetId(),
                workspace.stateAsString(),
                workspace.rootVolumeEncryptionEnabled(),
                workspace.userVolumeEncryptionEnabled(),
                properties != null ? properties.computeTypeNameAsString() : null,
                properties != null ? properties.rootVolumeSizeGib() : null,
                properties != null ? properties.userVolumeSizeGib() : null,
                properties != null ? properties.runningModeAsString() : null,
                properties != null ? properties.runningModeAutoStopTimeoutInMinutes() : null
        );
    }
}
