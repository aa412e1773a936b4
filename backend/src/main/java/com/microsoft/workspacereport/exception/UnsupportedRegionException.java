package com.microsoft.workspacereport.exception;

public class UnsupportedRegionException extends WorkspaceReportException {

    public UnsupportedRegionException(String region) {
        super("Amazon WorkSpaces is not offered in region: " + region);
    }
}
