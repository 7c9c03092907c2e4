package com.labpulse.driver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.labpulse.model.DriverCredentials;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the driver variant registered for an integration's service type.
 *
 * <p>The tag is resolved to a {@link ServiceType} once; every constant must have a constructor registered
 * here, so adding a service type is a compile-time change in two places.
 */
@Component
public class DriverFactory {

    /**
     * Creates one driver variant.
     */
    @FunctionalInterface
    public interface DriverConstructor {
        Driver create(long integrationId, DriverCredentials credentials, DriverContext context);
    }

    private final DriverContext context;
    private final Map<ServiceType, DriverConstructor> constructors;

    @Autowired
    public DriverFactory(ObjectMapper objectMapper) {
        this(new DriverContext(
                HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(5))
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                objectMapper
        ), defaultConstructors());
    }

    public DriverFactory(DriverContext context, Map<ServiceType, DriverConstructor> constructors) {
        this.context = Objects.requireNonNull(context, "context");
        EnumMap<ServiceType, DriverConstructor> copy = new EnumMap<>(ServiceType.class);
        copy.putAll(constructors);
        for (ServiceType type : ServiceType.values()) {
            if (!copy.containsKey(type)) {
                throw new IllegalArgumentException("No driver registered for service type: " + type.getTag());
            }
        }
        this.constructors = Collections.unmodifiableMap(copy);
    }

    /**
     * Build a driver.
     *
     * @param integrationId integration id
     * @param serviceTypeTag tag stored on the integration
     * @param credentials decrypted credentials
     * @return driver instance
     * @throws UnknownServiceTypeException if the tag is not recognized
     * @throws MissingCredentialsException if a field the variant needs is empty
     */
    public Driver create(long integrationId, String serviceTypeTag, DriverCredentials credentials) {
        ServiceType type = ServiceType.fromTag(serviceTypeTag);
        return constructors.get(type).create(integrationId, credentials, context);
    }

    /**
     * @return registered service types in declaration order
     */
    public List<ServiceType> listServiceTypes() {
        return List.copyOf(constructors.keySet());
    }

    private static Map<ServiceType, DriverConstructor> defaultConstructors() {
        Map<ServiceType, DriverConstructor> map = new EnumMap<>(ServiceType.class);
        map.put(ServiceType.UPTIME_KUMA, UptimeKumaDriver::new);
        map.put(ServiceType.NETDATA, NetdataDriver::new);
        map.put(ServiceType.UNRAID, UnraidDriver::new);
        return map;
    }
}
