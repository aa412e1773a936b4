package com.microsoft.workspacereport.domain.model;

import com.microsoft.workspacereport.exception.UnsupportedRegionException;
import software.amazon.awssdk.regions.Region;

/**
 * AWS regions in which Amazon WorkSpaces is offered.
 */
public enum SupportedRegion {
    US_EAST_1("us-east-1", "US East (N. Virginia)"),
    US_WEST_2("us-west-2", "US West (Oregon)"),
    CA_CENTRAL_1("ca-central-1", "Canada (Central)"),
    SA_EAST_1("sa-east-1", "South America (Sao Paulo)"),
    EU_CENTRAL_1("eu-central-1", "Europe (Frankfurt)"),
    EU_WEST_1("eu-west-1", "Europe (Ireland)"),
    EU_WEST_2("eu-west-2", "Europe (London)"),
    EU_WEST_3("eu-west-3", "Europe (Paris)"),
    AF_SOUTH_1("af-south-1", "Africa (Cape Town)"),
    IL_CENTRAL_1("il-central-1", "Israel (Tel Aviv)"),
    AP_SOUTH_1("ap-south-1", "Asia Pacific (Mumbai)"),
    AP_NORTHEAST_1("ap-northeast-1", "Asia Pacific (Tokyo)"),
    AP_NORTHEAST_2("ap-northeast-2", "Asia Pacific (Seoul)"),
    AP_SOUTHEAST_1("ap-southeast-1", "Asia Pacific (Singapore)"),
    AP_SOUTHEAST_2("ap-southeast-2", "Asia Pacific (Sydney)"),
    US_GOV_WEST_1("us-gov-west-1", "AWS GovCloud (US-West)");

    private final String code;
    private final String displayName;

    SupportedRegion(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Region toSdkRegion() {
        return Region.of(code);
    }

    /**
     * Resolve a region code such as {@code eu-west-1}. Matching ignores case and
     * surrounding whitespace.
     *
     * @throws UnsupportedRegionException if WorkSpaces is not offered in the region
     */
    public static SupportedRegion fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase();
            for (SupportedRegion region : values()) {
                if (region.code.equals(normalized)) {
                    return region;
                }
            }
        }
        throw new UnsupportedRegionException(code);
    }
}
