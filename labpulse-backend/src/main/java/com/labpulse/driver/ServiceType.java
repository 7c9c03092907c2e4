package com.labpulse.driver;

import java.util.Locale;

/**
 * Service families a driver exists for. The tag is the value stored on the integration row.
 */
public enum ServiceType {
    UPTIME_KUMA("uptime-kuma", "Uptime Kuma"),
    NETDATA("netdata", "Netdata"),
    UNRAID("unraid", "Unraid");

    private final String tag;
    private final String displayName;

    ServiceType(String tag, String displayName) {
        this.tag = tag;
        this.displayName = displayName;
    }

    public String getTag() {
        return tag;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolve a stored tag.
     *
     * @param tag service-type tag, compared case-insensitively
     * @return matching service type
     * @throws UnknownServiceTypeException if no service type has this tag
     */
    public static ServiceType fromTag(String tag) {
        if (tag != null) {
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            for (ServiceType type : values()) {
                if (type.tag.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new UnknownServiceTypeException(tag);
    }
}
