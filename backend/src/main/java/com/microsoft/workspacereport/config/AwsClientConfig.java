package com.microsoft.workspacereport.config;

import com.microsoft.workspacereport.domain.model.SupportedRegion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.workspaces.WorkSpacesClient;

/**
 * AWS SDK clients for the configured region.
 *
 * CREDENTIAL STRATEGY:
 * Uses the SDK default credential chain (environment, system properties,
 * shared profile, web identity, instance metadata). The region is validated
 * against the WorkSpaces regions before any client is built. Every client
 * bounds its calls with {@code report.aws-call-timeout}.
 */
@Configuration
@Slf4j
public class AwsClientConfig {

    @Bean
    public Region awsRegion(ReportProperties properties) {
        SupportedRegion region = SupportedRegion.fromCode(properties.getRegion());
        log.info("Using AWS region {} ({})", region.getCode(), region.getDisplayName());
        return region.toSdkRegion();
    }

    @Bean(destroyMethod = "close")
    public WorkSpacesClient workSpacesClient(Region awsRegion, ReportProperties properties) {
        return WorkSpacesClient.builder()
                .region(awsRegion)
                .credentialsProvider(DefaultCredentialsProvider.create())
                .overrideConfiguration(timeouts(properties))
                .build();
    }

    @Bean(destroyMethod = "close")
    public CloudWatchClient cloudWatchClient(Region awsRegion, ReportProperties properties) {
        return CloudWatchClient.builder()
                .region(awsRegion)
                .credentialsProvider(DefaultCredentialsProvider.create())
                .overrideConfiguration(timeouts(properties))
                .build();
    }

    @Bean(destroyMethod = "close")
    public Ec2Client ec2Client(Region awsRegion, ReportProperties properties) {
        return Ec2Client.builder()
                .region(awsRegion)
                .credentialsProvider(DefaultCredentialsProvider.create())
                .overrideConfiguration(timeouts(properties))
                .build();
    }

    private static ClientOverrideConfiguration timeouts(ReportProperties properties) {
        return ClientOverrideConfiguration.builder()
                .apiCallTimeout(properties.getAwsCallTimeout())
                .build();
    }
}
