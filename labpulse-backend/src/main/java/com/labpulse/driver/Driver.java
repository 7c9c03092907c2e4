package com.labpulse.driver;

import com.labpulse.model.Capability;
import com.labpulse.model.ConnectionTestResult;
import com.labpulse.model.MetricValue;

import java.util.List;
import java.util.Optional;

/**
 * Adapter translating one external service's API into capabilities and metric values.
 *
 * <p>Instances are built per poll by {@link DriverFactory} and are not shared between threads except for
 * the capability fetches the poller bounds with a timeout.
 */
public interface Driver {

    ServiceType getServiceType();

    long getIntegrationId();

    default String getDisplayName() {
        return getServiceType().getDisplayName();
    }

    /**
     * Check that the service is reachable with the configured credentials. Never throws.
     *
     * @return test result
     */
    ConnectionTestResult testConnection();

    /**
     * List the capabilities this instance can report, in a stable order.
     *
     * @return capabilities
     * @throws DriverException if the service cannot be queried at all
     */
    List<Capability> getCapabilities();

    /**
     * Fetch one capability.
     *
     * @param key capability key
     * @return the value, or empty when the service has nothing to report for this key
     * @throws DriverException if the fetch fails
     */
    Optional<MetricValue> fetchMetric(String key);
}
