package com.microsoft.workspacereport.adapters.aws;

import com.microsoft.workspacereport.adapters.ActivityMetricsSource;
import com.microsoft.workspacereport.domain.model.ActivityWindow;
import com.microsoft.workspacereport.exception.MetricsQueryFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.Datapoint;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsRequest;
import software.amazon.awssdk.services.cloudwatch.model.Statistic;

import java.util.List;
import java.util.Objects;

/**
 * CloudWatch source for the WorkSpaces {@code ConnectionSuccess} metric.
 *
 * Queried with the Maximum statistic at the window's granularity (one day),
 * so a single successful connection on a given day yields a sample of at least 1.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AwsCloudWatchMetricsSource implements ActivityMetricsSource {

    static final String NAMESPACE = "AWS/WorkSpaces";
    static final String METRIC_NAME = "ConnectionSuccess";
    static final String DIMENSION_NAME = "WorkspaceId";

    private final CloudWatchClient cloudWatchClient;

    @Override
    public List<Double> fetchDailyConnectionMaxima(String workspaceId, ActivityWindow window) {
        log.debug("Fetching {} for {} from {} to {}", METRIC_NAME, workspaceId, window.start(), window.end());

        GetMetricStatisticsRequest request = GetMetricStatisticsRequest.builder()
                .namespace(NAMESPACE)
                .metricName(METRIC_NAME)
                .dimensions(Dimension.builder().name(DIMENSION_NAME).value(workspaceId).build())
                .startTime(window.start())
                .endTime(window.end())
                .period((int) window.granularity().toSeconds())
                .statistics(Statistic.MAXIMUM)
                .build();

        try {
            return cloudWatchClient.getMetricStatistics(request)
                    .datapoints()
                    .stream()
                    .map(Datapoint::maximum)
                    .filter(Objects::nonNull)
                    .toList();
        } catch (SdkException e) {
            throw new MetricsQueryFailedException(workspaceId, e);
        }
    }
}
