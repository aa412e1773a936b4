package com.microsoft.workspacereport.adapters.aws;

import com.microsoft.workspacereport.adapters.NetworkTopologyLookup;
import com.microsoft.workspacereport.domain.model.SubnetInfo;
import com.microsoft.workspacereport.exception.TopologyQueryFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeSubnetsRequest;
import software.amazon.awssdk.services.ec2.model.Subnet;
import software.amazon.awssdk.services.ec2.model.Tag;

import java.util.List;

/**
 * EC2 subnet lookup. Results are cached per subnet id since workspaces share subnets.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AwsSubnetLookup implements NetworkTopologyLookup {

    static final String NAME_TAG_KEY = "Name";

    private final Ec2Client ec2Client;

    @Override
    @Cacheable("subnets")
    public SubnetInfo resolveSubnet(String subnetId) {
        log.debug("Describing subnet: {}", subnetId);

        List<Subnet> subnets;
        try {
            subnets = ec2Client.describeSubnets(
                    DescribeSubnetsRequest.builder().subnetIds(subnetId).build()).subnets();
        } catch (SdkException e) {
            throw new TopologyQueryFailedException(subnetId, e);
        }

        if (subnets.isEmpty()) {
            throw new TopologyQueryFailedException(subnetId,
                    new IllegalStateException("subnet not returned by DescribeSubnets"));
        }

        Subnet subnet = subnets.get(0);
        return new SubnetInfo(
                subnet.subnetId(),
                nameTag(subnet.tags()),
                subnet.availabilityZone(),
                subnet.availabilityZoneId(),
                subnet.availableIpAddressCount()
        );
    }

    /**
     * Value of the tag whose key is exactly {@code Name}; empty when there is none.
     */
    static String nameTag(List<Tag> tags) {
        return tags.stream()
                .filter(tag -> NAME_TAG_KEY.equals(tag.key()))
                .map(Tag::value)
                .findFirst()
                .orElse("");
    }
}
