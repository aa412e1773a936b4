package com.microsoft.workspacereport.report;

import com.microsoft.workspacereport.domain.model.WorkspaceReport;

import java.nio.file.Path;

/**
 * Destination of the finished report.
 */
public interface ReportSink {

    /**
     * @return location the report was written to
     */
    Path write(WorkspaceReport report);
}
