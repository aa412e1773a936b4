package com.microsoft.workspacereport.domain.model;

/**
 * Outcome of the inactivity classifier, always tied to the window it was computed for.
 *
 * @param peakDailyConnections greatest daily maximum returned, null when there were no samples
 */
public record ActivityVerdict(
        boolean unusedForPeriod,
        ActivityWindow window,
        int sampleCount,
        Double peakDailyConnections
) {}
