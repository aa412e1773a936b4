package com.microsoft.workspacereport.service;

import com.microsoft.workspacereport.adapters.WorkspaceInventory;
import com.microsoft.workspacereport.domain.model.ActivityWindow;
import com.microsoft.workspacereport.domain.model.EnrichmentResult;
import com.microsoft.workspacereport.domain.model.FailurePolicy;
import com.microsoft.workspacereport.domain.model.ReportRow;
import com.microsoft.workspacereport.domain.model.SupportedRegion;
import com.microsoft.workspacereport.domain.model.WorkspaceRecord;
import com.microsoft.workspacereport.domain.model.WorkspaceReport;
import com.microsoft.workspacereport.enrichment.EnrichmentPipeline;
import com.microsoft.workspacereport.report.ReportAssembler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Builds the usage report for one region: inventory, enrichment, ordering.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkspaceReportService {

    private final WorkspaceInventory inventory;
    private final EnrichmentPipeline pipeline;
    private final ReportAssembler assembler;
    private final Clock clock;

    /**
     * @param inactivityDays length of the trailing activity window
     * @throws com.microsoft.workspacereport.exception.InventoryUnavailableException
     *         if the workspaces cannot be listed
     * @throws com.microsoft.workspacereport.exception.EnrichmentAbortedException
     *         if a lookup fails under {@link FailurePolicy#ABORT_RUN}
     */
    public WorkspaceReport generateReport(SupportedRegion region, int inactivityDays, FailurePolicy policy) {
        Instant now = clock.instant();
        ActivityWindow window = ActivityWindow.trailingDays(now, inactivityDays);

        log.info("Generating WorkSpaces report for {} (activity window {} to {}, policy {})",
                region.getCode(), window.start(), window.end(), policy);

        List<WorkspaceRecord> workspaces = inventory.listWorkspaces(region.getCode());
        List<EnrichmentResult> results = pipeline.run(workspaces, window, policy);
        List<ReportRow> rows = assembler.assemble(results);

        WorkspaceReport report = new WorkspaceReport(region, window, now, rows);
        log.info("Report complete: {} rows, {} failed enrichment", rows.size(), report.failedCount());
        return report;
    }
}
