package com.labpulse.driver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.labpulse.model.Capability;
import com.labpulse.model.DriverCredentials;
import com.labpulse.model.MonitorState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

class UnraidDriverTest {

    private static final String ARRAY = "{\"data\":{\"array\":{\"state\":\"STARTED\","
            + "\"capacity\":{\"disks\":{\"total\":\"4000\",\"used\":\"1000\",\"free\":\"3000\"}},"
            + "\"disks\":[{\"name\":\"disk1\",\"size\":2000,\"status\":\"DISK_OK\",\"temp\":34,\"fsSize\":2000,\"fsUsed\":500},"
            + "{\"name\":\"disk2\",\"size\":2000,\"status\":\"DISK_OK\",\"temp\":null,\"fsSize\":2000,\"fsUsed\":1000}]}}}";
    private static final String DOCKER = "{\"data\":{\"docker\":{\"containers\":["
            + "{\"id\":\"abc\",\"names\":[\"/plex\"],\"state\":\"RUNNING\",\"status\":\"Up 3 days\",\"autoStart\":true},"
            + "{\"id\":\"def\",\"names\":[\"/sonarr\"],\"state\":\"EXITED\",\"status\":\"Exited (0)\",\"autoStart\":false}]}}}";
    private static final String MEMORY = "{\"data\":{\"info\":{\"memory\":{\"total\":16000,\"free\":4000,\"used\":12000,\"available\":5000}}}}";

    private final DriverContext context = new DriverContext(HttpClient.newHttpClient(), new ObjectMapper());
    private StubHttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
    }

    @Test
    @DisplayName("Capabilities include one entry per disk and per container")
    void testDynamicCapabilities() throws Exception {
        UnraidDriver driver = start(UnraidDriverTest::respond);

        List<Capability> capabilities = driver.getCapabilities();

        assertThat(capabilities).extracting(Capability::getKey).containsExactly(
                "cpu_usage", "cpu_temp", "memory_usage", "array_status", "array_usage",
                "disk_disk1_usage", "disk_disk1_temp", "disk_disk2_usage",
                "docker_plex_status", "docker_sonarr_status");
        assertThat(server.requests).allSatisfy(r -> {
            assertThat(r.method()).isEqualTo("POST");
            assertThat(r.path()).isEqualTo("/graphql");
            assertThat(r.apiKey()).isEqualTo("unraid-key");
        });
    }

    @Test
    @DisplayName("Discovery failure falls back to the base capabilities")
    void testDiscoveryFailure() throws Exception {
        UnraidDriver driver = start(req -> new StubHttpServer.Response(500, "oops"));

        assertThat(driver.getCapabilities()).extracting(Capability::getKey)
                .containsExactly("cpu_usage", "cpu_temp", "memory_usage", "array_status", "array_usage");
    }

    @Test
    @DisplayName("Metrics are computed from the GraphQL responses")
    void testFetchMetrics() throws Exception {
        UnraidDriver driver = start(UnraidDriverTest::respond);

        assertThat(driver.fetchMetric("memory_usage").orElseThrow().getValue()).isEqualTo(75.0);
        assertThat(driver.fetchMetric("array_status").orElseThrow().getValue()).isEqualTo("STARTED");
        assertThat(driver.fetchMetric("array_usage").orElseThrow().getValue()).isEqualTo(25.0);
        assertThat(driver.fetchMetric("cpu_temp").orElseThrow().getValue()).isEqualTo(34.0);
        assertThat(driver.fetchMetric("disk_disk2_usage").orElseThrow().getValue()).isEqualTo(50.0);
        assertThat(driver.fetchMetric("disk_disk2_temp")).isEmpty();
        assertThat(driver.fetchMetric("docker_plex_status").orElseThrow().getValue()).isEqualTo("RUNNING");
        assertThat(driver.fetchMetric("docker_missing_status")).isEmpty();
        assertThat(driver.fetchMetric("parity_status")).isEmpty();
    }

    @Test
    @DisplayName("Containers become monitors named without the leading slash")
    void testMonitorList() throws Exception {
        UnraidDriver driver = start(UnraidDriverTest::respond);

        assertThat(driver.fetchMonitorList()).containsExactly(MonitorState.up("plex"), MonitorState.down("sonarr"));
        assertThat(driver.fetchContainers()).extracting(UnraidDriver.ContainerInfo::id).containsExactly("abc", "def");
    }

    @Test
    @DisplayName("GraphQL errors raise a driver exception")
    void testGraphqlErrors() throws Exception {
        UnraidDriver driver = start(req -> StubHttpServer.Response.ok("{\"errors\":[{\"message\":\"Forbidden resource\"}]}"));

        assertThatThrownBy(() -> driver.fetchMetric("memory_usage"))
                .isInstanceOf(DriverException.class)
                .hasMessageContaining("Forbidden resource");
        assertThat(driver.testConnection().isSuccess()).isFalse();
    }

    @Test
    @DisplayName("An API key is required")
    void testMissingApiKey() {
        assertThatThrownBy(() -> new UnraidDriver(1, DriverCredentials.builder().url("http://tower").build(), context))
                .isInstanceOf(MissingCredentialsException.class);
    }

    private UnraidDriver start(Function<StubHttpServer.Request, StubHttpServer.Response> handler) throws Exception {
        server = new StubHttpServer(handler);
        return new UnraidDriver(3, DriverCredentials.builder().url(server.url()).apiKey("unraid-key").build(), context);
    }

    private static StubHttpServer.Response respond(StubHttpServer.Request request) {
        String body = request.body();
        if (body.contains("docker")) {
            return StubHttpServer.Response.ok(DOCKER);
        }
        if (body.contains("array")) {
            return StubHttpServer.Response.ok(ARRAY);
        }
        if (body.contains("memory")) {
            return StubHttpServer.Response.ok(MEMORY);
        }
        return new StubHttpServer.Response(400, "{\"errors\":[{\"message\":\"unexpected query\"}]}");
    }
}
