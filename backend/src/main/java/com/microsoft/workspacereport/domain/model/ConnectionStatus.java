package com.microsoft.workspacereport.domain.model;

import java.time.Instant;

/**
 * Connection state of a workspace at the time of the query.
 */
public record ConnectionStatus(
        String connectionState,
        Instant stateCheckTimestamp,
        Instant lastUserConnectionTimestamp
) {

    public static ConnectionStatus unknown() {
        return new ConnectionStatus(null, null, null);
    }
}
