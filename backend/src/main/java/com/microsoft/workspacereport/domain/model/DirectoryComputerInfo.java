package com.microsoft.workspacereport.domain.model;

import java.time.Instant;

/**
 * Directory attributes of a workspace computer account.
 */
public record DirectoryComputerInfo(
        String computerName,
        Instant created,
        String operatingSystem
) {}
