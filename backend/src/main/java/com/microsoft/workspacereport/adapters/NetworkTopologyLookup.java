package com.microsoft.workspacereport.adapters;

import com.microsoft.workspacereport.domain.model.SubnetInfo;

/**
 * Port for subnet placement lookups.
 */
public interface NetworkTopologyLookup {

    /**
     * @throws com.microsoft.workspacereport.exception.TopologyQueryFailedException
     *         if the subnet cannot be described
     */
    SubnetInfo resolveSubnet(String subnetId);
}
