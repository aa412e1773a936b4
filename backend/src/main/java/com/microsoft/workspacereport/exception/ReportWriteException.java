package com.microsoft.workspacereport.exception;

import java.nio.file.Path;

public class ReportWriteException extends WorkspaceReportException {

    public ReportWriteException(Path target, Throwable cause) {
        super("Failed to write report to " + target + ": " + cause.getMessage(), cause);
    }
}
