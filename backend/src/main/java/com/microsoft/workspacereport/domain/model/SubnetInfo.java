package com.microsoft.workspacereport.domain.model;

/**
 * Network placement of a workspace subnet.
 *
 * @param label value of the subnet's {@code Name} tag, empty when the tag is absent
 */
public record SubnetInfo(
        String subnetId,
        String label,
        String availabilityZone,
        String availabilityZoneId,
        Integer availableIpAddressCount
) {}
