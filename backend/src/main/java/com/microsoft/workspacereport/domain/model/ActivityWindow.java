package com.microsoft.workspacereport.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Trailing time range over which workspace usage is evaluated.
 *
 * Sampled at one aggregated point per day: CloudWatch silently drops finer
 * grained data for older periods, and the daily period keeps the sample count
 * under the per-request datapoint limit for every supported window length.
 */
public record ActivityWindow(Instant start, Instant end, Duration granularity) {

    public static final Duration DAILY = Duration.ofDays(1);

    public ActivityWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(granularity, "granularity");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException(
                    "Activity window end " + end + " must be after start " + start);
        }
        if (granularity.isZero() || granularity.isNegative()) {
            throw new IllegalArgumentException("Granularity must be positive: " + granularity);
        }
    }

    /**
     * Window covering the {@code days} days before {@code now}.
     */
    public static ActivityWindow trailingDays(Instant now, int days) {
        if (days < 1) {
            throw new IllegalArgumentException("Inactivity days must be at least 1, got " + days);
        }
        return new ActivityWindow(now.minus(Duration.ofDays(days)), now, DAILY);
    }

    /**
     * Upper bound of samples the metrics source can return for this window.
     */
    public long maxSamples() {
        Duration length = Duration.between(start, end);
        long samples = length.dividedBy(granularity);
        return length.equals(granularity.multipliedBy(samples)) ? samples : samples + 1;
    }
}
