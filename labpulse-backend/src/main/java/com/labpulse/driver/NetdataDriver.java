package com.labpulse.driver;

import com.fasterxml.jackson.databind.JsonNode;
import com.labpulse.model.Capability;
import com.labpulse.model.ConnectionTestResult;
import com.labpulse.model.DriverCredentials;
import com.labpulse.model.MetricValue;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Netdata driver. Reads the latest point of a few system charts from {@code /api/v1/data}.
 */
public class NetdataDriver extends AbstractHttpDriver {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(5);

    private static final List<Capability> CAPABILITIES = List.of(
            Capability.of("cpu", "CPU Usage", "%", "performance"),
            Capability.of("memory", "RAM Usage", "%", "performance"),
            Capability.of("disk", "Disk Usage", "%", "performance"),
            Capability.of("network", "Network Traffic", "kilobits/s", "performance")
    );

    public NetdataDriver(long integrationId, DriverCredentials credentials, DriverContext context) {
        super(integrationId, credentials, context, REQUEST_TIMEOUT);
    }

    @Override
    public ServiceType getServiceType() {
        return ServiceType.NETDATA;
    }

    @Override
    public ConnectionTestResult testConnection() {
        try {
            JsonNode info = getJson("/api/v1/info", headers());
            return ConnectionTestResult.ok("Successfully connected to Netdata (v" + info.path("version").asText("unknown") + ")");
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
            case "cpu": {
                Map<String, Double> row = latestRow("system.cpu");
                double total = row.values().stream().mapToDouble(Double::doubleValue).sum();
                return Optional.of(MetricValue.of(round(total), "%", Map.of("chart", "system.cpu")));
            }
            case "memory": {
                Map<String, Double> row = latestRow("system.ram");
                double total = row.values().stream().mapToDouble(Double::doubleValue).sum();
                double used = row.getOrDefault("used", 0.0);
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("used", used);
                metadata.put("free", row.getOrDefault("free", 0.0));
                metadata.put("total", total);
                return Optional.of(MetricValue.of(percentage(used, total), "%", metadata));
            }
            case "disk": {
                Map<String, Double> row = latestRow("disk_space._");
                double total = row.values().stream().mapToDouble(Double::doubleValue).sum();
                double used = row.getOrDefault("used", 0.0);
                return Optional.of(MetricValue.of(percentage(used, total), "%", Map.of("chart", "disk_space._")));
            }
            case "network": {
                Map<String, Double> row = latestRow("system.net");
                Map<String, Object> value = new LinkedHashMap<>();
                value.put("received", Math.abs(row.getOrDefault("received", 0.0)));
                value.put("sent", Math.abs(row.getOrDefault("sent", 0.0)));
                return Optional.of(MetricValue.of(value, "kilobits/s", Map.of("chart", "system.net")));
            }
            default:
                return Optional.empty();
        }
    }

    /**
     * Fetch the newest point of a chart as dimension name to value, skipping the time column.
     */
    private Map<String, Double> latestRow(String chart) {
        JsonNode body = getJson("/api/v1/data?chart=" + chart + "&points=1&format=json", headers());
        JsonNode labels = body.path("labels");
        JsonNode row = body.path("data").path(0);
        if (!row.isArray() || row.size() < 2) {
            throw new DriverException("Netdata returned no data for chart " + chart);
        }

        Map<String, Double> out = new LinkedHashMap<>();
        for (int i = 1; i < row.size(); i++) {
            String label = labels.has(i) ? labels.get(i).asText() : "dim" + i;
            out.put(label, row.get(i).asDouble());
        }
        return out;
    }

    private Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "application/json");
        if (credentials.getUsername() != null && !credentials.getUsername().isBlank()
                && credentials.getPassword() != null && !credentials.getPassword().isBlank()) {
            headers.put("Authorization", basicAuth(credentials.getUsername(), credentials.getPassword()));
        }
        return headers;
    }

    private static double percentage(double part, double total) {
        return total <= 0 ? 0.0 : round(part / total * 100);
    }

    private static double round(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
