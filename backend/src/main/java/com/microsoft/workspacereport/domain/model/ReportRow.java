package com.microsoft.workspacereport.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One fully joined report line, keyed by workspace id.
 *
 * NOT-FOUND SEMANTICS:
 * {@code user} and {@code computer} are null when the directory has no matching
 * entry, which is distinct from an entry that exists with empty attributes.
 * Nulls become empty cells only when the row is serialized.
 *
 * FAILED ROWS:
 * When enrichment failed and failures are isolated per workspace, only
 * {@code workspace} is populated and {@code enrichmentError} carries the reason.
 */
@Value
@Builder
public class ReportRow {

    WorkspaceRecord workspace;

    DirectoryUserInfo user;

    DirectoryComputerInfo computer;

    ConnectionStatus connection;

    SubnetInfo subnet;

    ActivityVerdict activity;

    String directoryName;

    String bundleName;

    SortedMap<String, String> tags;

    String enrichmentError;

    public static ReportRow failed(WorkspaceRecord workspace, String reason) {
        return ReportRow.builder()
                .workspace(workspace)
                .enrichmentError(reason)
                .build();
    }

    public String getWorkspaceId() {
        return workspace.workspaceId();
    }

    public String getUserName() {
        return workspace.userName();
    }

    public SortedMap<String, String> getTags() {
        return tags == null ? Collections.emptySortedMap() : tags;
    }

    public boolean isEnriched() {
        return enrichmentError == null;
    }

    public static class ReportRowBuilder {
        // Sorted, unmodifiable copy so the row cannot change after it is built
        public ReportRowBuilder tags(Map<String, String> tags) {
            this.tags = Collections.unmodifiableSortedMap(new TreeMap<>(tags));
            return this;
        }
    }
}
