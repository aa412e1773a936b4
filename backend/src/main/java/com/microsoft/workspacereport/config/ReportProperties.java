package com.microsoft.workspacereport.config;

import com.microsoft.workspacereport.domain.model.FailurePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Report run parameters, bound from {@code report.*}.
 */
@ConfigurationProperties(prefix = "report")
@Validated
@Getter
@Setter
public class ReportProperties {

    /**
     * CloudWatch starts aggregating older data points beyond this horizon.
     * Longer windows still classify correctly, with fewer samples.
     */
    public static final int RETENTION_ADVISORY_DAYS = 455;

    @NotBlank
    private String region = "us-east-1";

    @Min(1)
    @Max(999)
    private int inactivityDays = 30;

    @NotNull
    private Path outputDirectory = Path.of("reports");

    @NotNull
    private FailurePolicy failurePolicy = FailurePolicy.ISOLATE_RESOURCE;

    /**
     * Worker threads for the independent lookups of a single workspace. 1 runs them one after another.
     */
    @Min(1)
    @Max(32)
    private int lookupThreads = 4;

    @NotNull
    private Duration lookupTimeout = Duration.ofSeconds(60);

    /**
     * Upper bound for one AWS API call, retries included. Kept below {@link #lookupTimeout}
     * so a stalled call ends before the workspace is given up on.
     */
    @NotNull
    private Duration awsCallTimeout = Duration.ofSeconds(30);

    private boolean runOnStartup = true;

    @Valid
    private Directory directory = new Directory();

    @AssertTrue(message = "aws-call-timeout must be shorter than lookup-timeout")
    public boolean isAwsCallTimeoutWithinLookupTimeout() {
        return awsCallTimeout == null || lookupTimeout == null || awsCallTimeout.compareTo(lookupTimeout) < 0;
    }

    public boolean exceedsRetentionAdvisory() {
        return inactivityDays >= RETENTION_ADVISORY_DAYS;
    }

    @Getter
    @Setter
    public static class Directory {

        /**
         * Search base for user entries, relative to {@code spring.ldap.base}.
         */
        private String userSearchBase = "";

        /**
         * Search base for computer entries, relative to {@code spring.ldap.base}.
         */
        private String computerSearchBase = "";
    }
}
