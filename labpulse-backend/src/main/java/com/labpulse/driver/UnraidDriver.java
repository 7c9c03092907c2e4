package com.labpulse.driver;

import com.fasterxml.jackson.databind.JsonNode;
import com.labpulse.model.Capability;
import com.labpulse.model.ConnectionTestResult;
import com.labpulse.model.DriverCredentials;
import com.labpulse.model.MetricValue;
import com.labpulse.model.MonitorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Unraid driver backed by the official GraphQL API ({@code /graphql}, {@code x-api-key} header).
 *
 * <p>Capabilities are discovered per instance: base system metrics plus one entry per array disk and
 * per Docker container.
 */
public class UnraidDriver extends AbstractHttpDriver implements MonitorListing {
    private static final Logger log = LoggerFactory.getLogger(UnraidDriver.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private static final String OS_QUERY = "query { info { os { platform distro release } } }";
    private static final String CPU_QUERY = "query { info { cpu { manufacturer brand cores threads } } }";
    private static final String MEMORY_QUERY = "query { info { memory { total free used available } } }";
    private static final String ARRAY_QUERY =
            "query { array { state capacity { disks { total used free } } disks { name size status temp fsSize fsUsed } } }";
    private static final String DOCKER_QUERY = "query { docker { containers { id names state status autoStart } } }";

    private static final Capability CPU_USAGE = Capability.builder()
            .key("cpu_usage").target("cpu").metric("usage").displayName("CPU Cores")
            .description("CPU core count").unit("cores").category("performance").build();
    private static final Capability CPU_TEMP = Capability.builder()
            .key("cpu_temp").target("cpu").metric("temp").displayName("Average Disk Temperature")
            .description("Average temperature across array disks").unit("°C").category("health").build();
    private static final Capability MEMORY_USAGE = Capability.builder()
            .key("memory_usage").target("memory").metric("usage").displayName("RAM Usage")
            .description("Memory utilization percentage").unit("%").category("performance").build();
    private static final Capability ARRAY_STATUS = Capability.builder()
            .key("array_status").target("array").metric("status").displayName("Array Status")
            .description("Array state").unit("status").category("health").build();
    private static final Capability ARRAY_USAGE = Capability.builder()
            .key("array_usage").target("array").metric("usage").displayName("Array Usage")
            .description("Array capacity utilization").unit("%").category("performance").build();

    /**
     * A Docker container as reported by Unraid.
     */
    public record ContainerInfo(String id, String name, String state, String status) {
        public boolean isRunning() {
            return "running".equalsIgnoreCase(state);
        }
    }

    public UnraidDriver(long integrationId, DriverCredentials credentials, DriverContext context) {
        super(integrationId, credentials, context, REQUEST_TIMEOUT);
        if (credentials.getApiKey() == null || credentials.getApiKey().isBlank()) {
            throw new MissingCredentialsException("API key is required for Unraid GraphQL API");
        }
    }

    @Override
    public ServiceType getServiceType() {
        return ServiceType.UNRAID;
    }

    @Override
    public ConnectionTestResult testConnection() {
        try {
            JsonNode os = query(OS_QUERY).path("info").path("os");
            if (os.isMissingNode() || os.isNull()) {
                return ConnectionTestResult.failed("Invalid response - expected Unraid API data");
            }
            return ConnectionTestResult.ok("Connected to Unraid " + os.path("distro").asText("") + " " + os.path("release").asText(""));
        } catch (DriverException e) {
            return ConnectionTestResult.failed(e.getMessage());
        }
    }

    @Override
    public List<Capability> getCapabilities() {
        List<Capability> capabilities = new ArrayList<>(List.of(CPU_USAGE, CPU_TEMP, MEMORY_USAGE, ARRAY_STATUS, ARRAY_USAGE));
        try {
            for (JsonNode disk : query(ARRAY_QUERY).path("array").path("disks")) {
                String name = disk.path("name").asText(null);
                if (name == null || name.isBlank()) {
                    continue;
                }
                capabilities.add(Capability.builder()
                        .key("disk_" + name + "_usage").target("disk_" + name).metric("usage")
                        .displayName(name + " Usage").description("Disk space usage for " + name)
                        .unit("%").category("performance").build());
                if (disk.hasNonNull("temp")) {
                    capabilities.add(Capability.builder()
                            .key("disk_" + name + "_temp").target("disk_" + name).metric("temp")
                            .displayName(name + " Temperature").description("Temperature for " + name)
                            .unit("°C").category("health").build());
                }
            }
            for (ContainerInfo container : fetchContainers()) {
                capabilities.add(Capability.builder()
                        .key("docker_" + container.name() + "_status").target("docker_" + container.name()).metric("status")
                        .displayName("Docker: " + container.name()).description("Status of Docker container " + container.name())
                        .unit("status").category("status").build());
            }
        } catch (DriverException e) {
            log.warn("Unraid capability discovery failed, using base capabilities: integration_id={}, reason={}",
                    integrationId, e.getMessage());
        }
        return capabilities;
    }

    @Override
    public Optional<MetricValue> fetchMetric(String key) {
        if ("cpu_usage".equals(key)) {
            JsonNode cpu = query(CPU_QUERY).path("info").path("cpu");
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("brand", cpu.path("brand").asText(""));
            metadata.put("threads", cpu.path("threads").asInt());
            return Optional.of(MetricValue.of(cpu.path("cores").asInt(0), "cores", metadata));
        }
        if ("cpu_temp".equals(key)) {
            return Optional.of(averageDiskTemperature());
        }
        if ("memory_usage".equals(key)) {
            JsonNode memory = query(MEMORY_QUERY).path("info").path("memory");
            double total = memory.path("total").asDouble();
            double used = memory.path("used").asDouble();
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("total", total);
            metadata.put("used", used);
            metadata.put("free", memory.path("free").asDouble());
            metadata.put("available", memory.path("available").asDouble());
            return Optional.of(MetricValue.of(percentage(used, total), "%", metadata));
        }
        if ("array_status".equals(key)) {
            return Optional.of(MetricValue.of(query(ARRAY_QUERY).path("array").path("state").asText("UNKNOWN"), "status"));
        }
        if ("array_usage".equals(key)) {
            JsonNode capacity = query(ARRAY_QUERY).path("array").path("capacity").path("disks");
            return Optional.of(MetricValue.of(percentage(capacity.path("used").asDouble(), capacity.path("total").asDouble()), "%"));
        }
        if (key.startsWith("disk_") && key.endsWith("_usage")) {
            return findDisk(diskName(key, "_usage")).map(disk -> MetricValue.of(
                    percentage(disk.path("fsUsed").asDouble(), disk.path("fsSize").asDouble()), "%"));
        }
        if (key.startsWith("disk_") && key.endsWith("_temp")) {
            return findDisk(diskName(key, "_temp"))
                    .filter(disk -> disk.hasNonNull("temp"))
                    .map(disk -> MetricValue.of(disk.path("temp").asDouble(), "°C"));
        }
        if (key.startsWith("docker_") && key.endsWith("_status")) {
            String name = key.substring("docker_".length(), key.length() - "_status".length());
            return fetchContainers().stream()
                    .filter(c -> c.name().equalsIgnoreCase(name))
                    .findFirst()
                    .map(c -> MetricValue.of(c.state(), "status", Map.of("status", c.status() == null ? "" : c.status())));
        }

        log.warn("Unraid metric key not implemented: integration_id={}, key={}", integrationId, key);
        return Optional.empty();
    }

    /**
     * List Docker containers.
     *
     * @return containers in API order
     */
    public List<ContainerInfo> fetchContainers() {
        List<ContainerInfo> containers = new ArrayList<>();
        for (JsonNode c : query(DOCKER_QUERY).path("docker").path("containers")) {
            String id = c.path("id").asText("");
            containers.add(new ContainerInfo(
                    id,
                    containerName(c.path("names"), id),
                    c.path("state").asText(""),
                    c.path("status").asText(null)
            ));
        }
        return containers;
    }

    @Override
    public List<MonitorState> fetchMonitorList() {
        List<MonitorState> monitors = new ArrayList<>();
        for (ContainerInfo container : fetchContainers()) {
            monitors.add(new MonitorState(container.name(), container.isRunning()));
        }
        return monitors;
    }

    private MetricValue averageDiskTemperature() {
        double sum = 0;
        int count = 0;
        List<Map<String, Object>> diskTemps = new ArrayList<>();
        for (JsonNode disk : query(ARRAY_QUERY).path("array").path("disks")) {
            double temp = disk.path("temp").asDouble(0);
            if (temp > 0) {
                sum += temp;
                count++;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("disk", disk.path("name").asText(""));
            entry.put("temp", disk.hasNonNull("temp") ? temp : null);
            diskTemps.add(entry);
        }
        double avg = count == 0 ? 0.0 : Math.round(sum / count * 10) / 10.0;
        return MetricValue.of(avg, "°C", Map.of("disk_temps", diskTemps));
    }

    private Optional<JsonNode> findDisk(String name) {
        for (JsonNode disk : query(ARRAY_QUERY).path("array").path("disks")) {
            if (name.equalsIgnoreCase(disk.path("name").asText(""))) {
                return Optional.of(disk);
            }
        }
        return Optional.empty();
    }

    private JsonNode query(String graphql) {
        JsonNode result = postJson("/graphql", Map.of("query", graphql), Map.of("x-api-key", credentials.getApiKey()));
        JsonNode errors = result.path("errors");
        if (errors.isArray() && errors.size() > 0) {
            throw new DriverException("GraphQL Error: " + errors.get(0).path("message").asText("unknown error"));
        }
        return result.path("data");
    }

    private static String diskName(String key, String suffix) {
        return key.substring("disk_".length(), key.length() - suffix.length());
    }

    /**
     * Docker reports names as an array of {@code /name} strings.
     */
    static String containerName(JsonNode names, String fallback) {
        String name = null;
        if (names.isArray() && names.size() > 0) {
            name = names.get(0).asText(null);
        } else if (names.isTextual()) {
            name = names.asText();
        }
        if (name == null || name.isBlank()) {
            return fallback;
        }
        return name.startsWith("/") ? name.substring(1) : name;
    }

    private static double percentage(double part, double total) {
        return total <= 0 ? 0.0 : Math.round(part / total * 10000) / 100.0;
    }
}
