package com.labpulse.driver;

import com.labpulse.model.Capability;
import com.labpulse.model.ConnectionTestResult;
import com.labpulse.model.DriverCredentials;
import com.labpulse.model.MetricValue;
import com.labpulse.model.MonitorState;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Uptime Kuma driver. Reads the Prometheus {@code /metrics} endpoint, authenticated with HTTP Basic auth
 * using an empty user name and the API key as password.
 */
public class UptimeKumaDriver extends AbstractHttpDriver implements MonitorListing {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);
    private static final Pattern MONITOR_STATUS = Pattern.compile("^monitor_status\\{([^}]*)}\\s+(\\d+)", Pattern.MULTILINE);
    private static final Pattern MONITOR_NAME = Pattern.compile("monitor_name=\"([^\"]+)\"");

    private static final List<Capability> CAPABILITIES = List.of(
            Capability.of("uptime", "All Monitors Up", "boolean", "status"),
            Capability.of("services", "Monitors", "list", "status"),
            Capability.of("up_count", "Monitors Up", "monitors", "status"),
            Capability.of("down_count", "Monitors Down", "monitors", "status")
    );

    public UptimeKumaDriver(long integrationId, DriverCredentials credentials, DriverContext context) {
        super(integrationId, credentials, context, REQUEST_TIMEOUT);
        if (credentials.getApiKey() == null || credentials.getApiKey().isBlank()) {
            throw new MissingCredentialsException("Uptime Kuma requires an apiKey");
        }
    }

    @Override
    public ServiceType getServiceType() {
        return ServiceType.UPTIME_KUMA;
    }

    @Override
    public ConnectionTestResult testConnection() {
        try {
            fetchMetricsText();
            return ConnectionTestResult.ok("Successfully connected to Uptime Kuma");
        } catch (DriverException e) {
            return ConnectionTestResult.failed(e.getMessage());
        }
    }

    @Override
    public List<Capability> getCapabilities() {
        return CAPABILITIES;
    }

    @Override
    public Optional<MetricValue> fetchMetric(String key) {
        switch (key) {
            case "uptime": {
                List<MonitorState> monitors = parseMonitors(fetchMetricsText());
                boolean allUp = !monitors.isEmpty() && monitors.stream().allMatch(MonitorState::isUp);
                return Optional.of(MetricValue.of(allUp, "boolean", Map.of("source", "prometheus_metrics")));
            }
            case "services": {
                List<MonitorState> monitors = parseMonitors(fetchMetricsText());
                List<Map<String, Object>> value = new ArrayList<>();
                for (MonitorState monitor : monitors) {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("name", monitor.getName());
                    entry.put("status", monitor.getStatus());
                    value.add(entry);
                }
                return Optional.of(MetricValue.of(value, "list", Map.of("count", monitors.size())));
            }
            case "up_count":
                return Optional.of(MetricValue.of(countMonitors(true), "monitors"));
            case "down_count":
                return Optional.of(MetricValue.of(countMonitors(false), "monitors"));
            default:
                return Optional.empty();
        }
    }

    @Override
    public List<MonitorState> fetchMonitorList() {
        return parseMonitors(fetchMetricsText());
    }

    private long countMonitors(boolean up) {
        return parseMonitors(fetchMetricsText()).stream().filter(m -> m.isUp() == up).count();
    }

    private String fetchMetricsText() {
        return getText("/metrics", Map.of("Authorization", basicAuth("", credentials.getApiKey())));
    }

    /**
     * Extract the monitor name from a Prometheus label set.
     *
     * @param labels label string such as {@code monitor_name="Plex",monitor_type="http"}
     * @return the name, or null when the label is missing
     */
    static String parseMonitorName(String labels) {
        Matcher m = MONITOR_NAME.matcher(labels);
        return m.find() ? m.group(1) : null;
    }

    /**
     * Parse all named {@code monitor_status} samples. A sample value of 1 is up; anything else
     * (down, pending, maintenance) is reported as down.
     *
     * @param metricsText Prometheus exposition text
     * @return monitors in exposition order
     */
    static List<MonitorState> parseMonitors(String metricsText) {
        List<MonitorState> monitors = new ArrayList<>();
        if (metricsText == null) {
            return monitors;
        }
        Matcher m = MONITOR_STATUS.matcher(metricsText);
        while (m.find()) {
            String name = parseMonitorName(m.group(1));
            if (name != null) {
                monitors.add(new MonitorState(name, "1".equals(m.group(2))));
            }
        }
        return monitors;
    }
}
