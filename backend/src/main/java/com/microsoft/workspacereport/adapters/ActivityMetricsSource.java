package com.microsoft.workspacereport.adapters;

import com.microsoft.workspacereport.domain.model.ActivityWindow;

import java.util.List;

/**
 * Port for the workspace connection metric.
 */
public interface ActivityMetricsSource {

    /**
     * Daily maxima of the successful-connection counter for one workspace.
     *
     * @return one value per day that has data; empty when the workspace has no metric history
     * @throws com.microsoft.workspacereport.exception.MetricsQueryFailedException
     */
    List<Double> fetchDailyConnectionMaxima(String workspaceId, ActivityWindow window);
}
