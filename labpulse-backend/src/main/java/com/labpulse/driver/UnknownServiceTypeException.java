package com.labpulse.driver;

/**
 * Thrown when a service-type tag does not match any registered driver.
 */
public class UnknownServiceTypeException extends ConfigurationException {
    private final String serviceType;

    /**
     * Create a new exception.
     *
     * @param serviceType the unrecognized tag
     */
    public UnknownServiceTypeException(String serviceType) {
        super("Unknown service type: " + serviceType);
        this.serviceType = serviceType;
    }

    public String getServiceType() {
        return serviceType;
    }
}
