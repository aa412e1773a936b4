package com.microsoft.workspacereport.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.microsoft.workspacereport.domain.model.ActivityVerdict;
import com.microsoft.workspacereport.domain.model.ConnectionStatus;
import com.microsoft.workspacereport.domain.model.DirectoryComputerInfo;
import com.microsoft.workspacereport.domain.model.DirectoryUserInfo;
import com.microsoft.workspacereport.domain.model.ReportRow;
import com.microsoft.workspacereport.domain.model.SubnetInfo;
import com.microsoft.workspacereport.domain.model.WorkspaceRecord;

import java.util.Objects;
import java.util.function.Function;

/**
 * Flat, all-text view of a {@link ReportRow} in output column order.
 *
 * This is the only place where unresolved values turn into empty cells.
 */
@JsonPropertyOrder({
        "UserName", "FullName", "Department", "UserEnabled", "Email", "Manager", "MobilePhone",
        "ComputerName", "ComputerCreated", "OperatingSystem",
        "WorkspaceId", "ConnectionState", "StateCheckTimestamp", "LastConnectionTimestamp", "UnusedForPeriod",
        "State", "ComputeType", "IpAddress",
        "DirectoryName", "DirectoryId", "BundleName", "BundleId",
        "SubnetName", "SubnetId", "SubnetAvailabilityZone", "SubnetAvailabilityZoneId", "SubnetAvailableIps",
        "RootVolumeEncrypted", "UserVolumeEncrypted", "RootVolumeSizeGib", "UserVolumeSizeGib",
        "RunningMode", "AutoStopTimeoutMinutes", "Region", "Tags", "EnrichmentError"
})
record CsvReportLine(
        @JsonProperty("UserName") String userName,
        @JsonProperty("FullName") String fullName,
        @JsonProperty("Department") String department,
        @JsonProperty("UserEnabled") String userEnabled,
        @JsonProperty("Email") String email,
        @JsonProperty("Manager") String manager,
        @JsonProperty("MobilePhone") String mobilePhone,
        @JsonProperty("ComputerName") String computerName,
        @JsonProperty("ComputerCreated") String computerCreated,
        @JsonProperty("OperatingSystem") String operatingSystem,
        @JsonProperty("WorkspaceId") String workspaceId,
        @JsonProperty("ConnectionState") String connectionState,
        @JsonProperty("StateCheckTimestamp") String stateCheckTimestamp,
        @JsonProperty("LastConnectionTimestamp") String lastConnectionTimestamp,
        @JsonProperty("UnusedForPeriod") String unusedForPeriod,
        @JsonProperty("State") String state,
        @JsonProperty("ComputeType") String computeType,
        @JsonProperty("IpAddress") String ipAddress,
        @JsonProperty("DirectoryName") String directoryName,
        @JsonProperty("DirectoryId") String directoryId,
        @JsonProperty("BundleName") String bundleName,
        @JsonProperty("BundleId") String bundleId,
        @JsonProperty("SubnetName") String subnetName,
        @JsonProperty("SubnetId") String subnetId,
        @JsonProperty("SubnetAvailabilityZone") String subnetAvailabilityZone,
        @JsonProperty("SubnetAvailabilityZoneId") String subnetAvailabilityZoneId,
        @JsonProperty("SubnetAvailableIps") String subnetAvailableIps,
        @JsonProperty("RootVolumeEncrypted") String rootVolumeEncrypted,
        @JsonProperty("UserVolumeEncrypted") String userVolumeEncrypted,
        @JsonProperty("RootVolumeSizeGib") String rootVolumeSizeGib,
        @JsonProperty("UserVolumeSizeGib") String userVolumeSizeGib,
        @JsonProperty("RunningMode") String runningMode,
        @JsonProperty("AutoStopTimeoutMinutes") String autoStopTimeoutMinutes,
        @JsonProperty("Region") String region,
        @JsonProperty("Tags") String tags,
        @JsonProperty("EnrichmentError") String enrichmentError
) {

    static CsvReportLine from(ReportRow row) {
        WorkspaceRecord ws = row.getWorkspace();
        DirectoryUserInfo user = row.getUser();
        DirectoryComputerInfo computer = row.getComputer();
        ConnectionStatus connection = row.getConnection();
        SubnetInfo subnet = row.getSubnet();
        ActivityVerdict activity = row.getActivity();

        return new CsvReportLine(
                text(ws.userName()),
                text(user, DirectoryUserInfo::fullName),
                text(user, DirectoryUserInfo::department),
                text(user, DirectoryUserInfo::enabled),
                text(user, DirectoryUserInfo::email),
                text(user, DirectoryUserInfo::managerDisplayName),
                text(user, DirectoryUserInfo::mobilePhone),
                text(ws.computerName()),
                text(computer, DirectoryComputerInfo::created),
                text(computer, DirectoryComputerInfo::operatingSystem),
                text(ws.workspaceId()),
                text(connection, ConnectionStatus::connectionState),
                text(connection, ConnectionStatus::stateCheckTimestamp),
                text(connection, ConnectionStatus::lastUserConnectionTimestamp),
                text(activity, ActivityVerdict::unusedForPeriod),
                text(ws.state()),
                text(ws.computeType()),
                text(ws.ipAddress()),
                text(row.getDirectoryName()),
                text(ws.directoryId()),
                text(row.getBundleName()),
                text(ws.bundleId()),
                text(subnet, SubnetInfo::label),
                text(ws.subnetId()),
                text(subnet, SubnetInfo::availabilityZone),
                text(subnet, SubnetInfo::availabilityZoneId),
                text(subnet, SubnetInfo::availableIpAddressCount),
                text(ws.rootVolumeEncryptionEnabled()),
                text(ws.userVolumeEncryptionEnabled()),
                text(ws.rootVolumeSizeGib()),
                text(ws.userVolumeSizeGib()),
                text(ws.runningMode()),
                text(ws.autoStopTimeoutMinutes()),
                text(ws.region()),
                TagFormatter.format(row.getTags()),
                text(row.getEnrichmentError())
        );
    }

    private static String text(Object value) {
        return Objects.toString(value, "");
    }

    private static <T> String text(T source, Function<T, ?> attribute) {
        return source == null ? "" : text(attribute.apply(source));
    }
}
