package com.microsoft.workspacereport.activity;

import com.microsoft.workspacereport.adapters.ActivityMetricsSource;
import com.microsoft.workspacereport.domain.model.ActivityVerdict;
import com.microsoft.workspacereport.domain.model.ActivityWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Decides whether a workspace was connected to at least once in a window.
 *
 * CLASSIFICATION:
 * The metrics source returns one daily maximum of successful connections per
 * day with data. A peak of at least {@value #USED_THRESHOLD} means the
 * workspace was used. No samples at all (new workspace, no metric history)
 * or an all-zero series means it was unused for the period.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MetricActivityClassifier {

    static final double USED_THRESHOLD = 1.0;

    private final ActivityMetricsSource metricsSource;

    /**
     * @throws com.microsoft.workspacereport.exception.MetricsQueryFailedException
     *         if the metrics source fails
     */
    public ActivityVerdict classify(String workspaceId, ActivityWindow window) {
        List<Double> dailyMaxima = metricsSource.fetchDailyConnectionMaxima(workspaceId, window);

        Double peak = dailyMaxima.stream()
                .max(Double::compare)
                .orElse(null);

        boolean unused = peak == null || peak < USED_THRESHOLD;
        log.debug("Workspace {}: {} daily samples, peak {}, unused={}",
                workspaceId, dailyMaxima.size(), peak, unused);

        return new ActivityVerdict(unused, window, dailyMaxima.size(), peak);
    }
}
