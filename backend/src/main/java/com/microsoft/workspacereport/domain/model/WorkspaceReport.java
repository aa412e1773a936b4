package com.microsoft.workspacereport.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Final, ordered report handed to the output sink.
 */
public record WorkspaceReport(
        SupportedRegion region,
        ActivityWindow window,
        Instant generatedAt,
        List<ReportRow> rows
) {

    public WorkspaceReport {
        rows = List.copyOf(rows);
    }

    public long failedCount() {
        return rows.stream().filter(row -> !row.isEnriched()).count();
    }
}
