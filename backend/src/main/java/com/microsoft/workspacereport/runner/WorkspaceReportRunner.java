package com.microsoft.workspacereport.runner;

import com.microsoft.workspacereport.config.ReportProperties;
import com.microsoft.workspacereport.domain.model.SupportedRegion;
import com.microsoft.workspacereport.domain.model.WorkspaceReport;
import com.microsoft.workspacereport.exception.EnrichmentAbortedException;
import com.microsoft.workspacereport.exception.InventoryUnavailableException;
import com.microsoft.workspacereport.report.ReportSink;
import com.microsoft.workspacereport.service.WorkspaceReportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs the report once on startup and writes it to the sink.
 *
 * Aborting failures are logged with the failing item and rethrown so the
 * process exits non-zero. Nothing is written for an aborted run.
 */
@Component
@ConditionalOnProperty(name = "report.run-on-startup", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class WorkspaceReportRunner implements CommandLineRunner {

    private final ReportProperties properties;
    private final WorkspaceReportService reportService;
    private final ReportSink sink;

    @Override
    public void run(String... args) {
        SupportedRegion region = SupportedRegion.fromCode(properties.getRegion());

        if (properties.exceedsRetentionAdvisory()) {
            log.warn("Inactivity window of {} days reaches past {} days; CloudWatch keeps older "
                            + "connection data at reduced resolution",
                    properties.getInactivityDays(), ReportProperties.RETENTION_ADVISORY_DAYS);
        }

        WorkspaceReport report;
        try {
            report = reportService.generateReport(
                    region, properties.getInactivityDays(), properties.getFailurePolicy());
        } catch (InventoryUnavailableException e) {
            log.error("Cannot list WorkSpaces in {}: {}", e.getRegion(), e.getMessage());
            throw e;
        } catch (EnrichmentAbortedException e) {
            log.error("Report aborted at workspace {} while querying {} after {} of {} workspaces; "
                            + "no report written: {}",
                    e.getWorkspaceId(), e.getCause().getItem(), e.getCompletedRows(),
                    e.getInventorySize(), e.getCause().getMessage());
            throw e;
        }

        Path written = sink.write(report);
        if (report.failedCount() > 0) {
            log.warn("{} of {} workspaces could not be fully enriched, see the EnrichmentError column",
                    report.failedCount(), report.rows().size());
        }
        log.info("WorkSpaces report written to {}", written.toAbsolutePath());
    }
}
