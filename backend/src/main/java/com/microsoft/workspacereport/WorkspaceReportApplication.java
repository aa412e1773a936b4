package com.microsoft.workspacereport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.cache.annotation.EnableCaching;

/**
 * WorkSpaces Usage Report
 *
 * Joins the WorkSpaces inventory of a region with directory, network and
 * CloudWatch data and writes one CSV row per workspace, flagging workspaces
 * that have not been connected to within the configured window.
 */
@SpringBootApplication
@EnableCaching
@ConfigurationPropertiesScan
public class WorkspaceReportApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(WorkspaceReportApplication.class, args)));
    }
}
