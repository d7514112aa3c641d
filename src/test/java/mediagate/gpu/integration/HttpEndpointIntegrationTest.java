package mediagate.gpu.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import mediagate.gpu.RecordingDispatcher;
import mediagate.gpu.config.Dependencies;
import mediagate.gpu.config.DeviceSpec;
import mediagate.gpu.config.GatewayConfig;
import mediagate.gpu.server.GatewayServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

import static mediagate.gpu.config.GatewayConfig.MB;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the gateway through its HTTP endpoints on a real Netty server.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Dependencies deps;
    private GatewayServer server;
    private RecordingDispatcher dispatcher;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    void setUp() {
        GatewayConfig config = GatewayConfig.defaults()
                .withDevices(List.of(
                        new DeviceSpec(0, "RTX 4090-1", 24_000 * MB),
                        new DeviceSpec(1, "RTX 4090-2", 24_000 * MB)));
        dispatcher = new RecordingDispatcher();
        deps = Dependencies.create(config, dispatcher, null);
        server = new GatewayServer(deps.routerHandler());
        int port = server.start("127.0.0.1", 0);
        baseUrl = "http://127.0.0.1:" + port;

        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        deps.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + path))
                        .GET()
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return httpClient.send(HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode json(HttpResponse<String> response) throws Exception {
        return MAPPER.readTree(response.body());
    }

    private String submitImage(int vramMb) throws Exception {
        HttpResponse<String> res = post("/api/v1/jobs", String.format("""
                {
                    "tier": "normal",
                    "vramEstimateMb": %d,
                    "payload": {"kind": "image", "model": "SDXL", "prompt": "a lighthouse", "width": 1024, "height": 1024, "batchSize": 1}
                }
                """, vramMb));
        assertEquals(202, res.statusCode(), "Submit should return 202. Body: " + res.body());
        return json(res).get("id").asText();
    }

    @Test
    @DisplayName("Submit, queue, complete and drain over HTTP")
    void fullJobFlow() throws Exception {
        String first = submitImage(20_000);
        String second = submitImage(20_000);
        String third = submitImage(20_000);

        JsonNode running = json(get("/api/v1/jobs/" + first));
        assertEquals("running", running.get("state").asText());
        assertEquals(0, running.get("deviceId").asInt());
        assertEquals(1, json(get("/api/v1/jobs/" + second)).get("deviceId").asInt());

        JsonNode queued = json(get("/api/v1/jobs/" + third));
        assertEquals("queued", queued.get("state").asText());
        assertEquals(0, queued.get("queuePosition").asInt());

        JsonNode queue = json(get("/api/v1/queue"));
        assertEquals(1, queue.get("total").asInt());
        assertEquals(1, queue.get("tiers").get("normal").asInt());

        HttpResponse<String> done = post("/internal/v1/jobs/" + first + "/complete", "{\"success\": true}");
        assertEquals(200, done.statusCode(), done.body());
        assertEquals("completed", json(done).get("result").asText());

        assertEquals("running", json(get("/api/v1/jobs/" + third)).get("state").asText());
        assertEquals(0, dispatcher.dispatched.get(third));

        HttpResponse<String> again = post("/internal/v1/jobs/" + first + "/complete", "{\"success\": false}");
        assertEquals(200, again.statusCode());
        assertEquals("already_terminal", json(again).get("result").asText());
    }

    @Test
    void healthAndDevices() throws Exception {
        HttpResponse<String> health = get("/api/v1/health");
        assertEquals(200, health.statusCode());
        assertEquals("healthy", json(health).get("status").asText());
        assertEquals(2, json(health).get("healthyDevices").asInt());

        submitImage(5_000);

        JsonNode devices = json(get("/api/v1/devices"));
        assertEquals(2, devices.get("count").asInt());
        JsonNode d0 = devices.get("devices").get(0);
        assertEquals(0, d0.get("id").asInt());
        assertEquals(5_000, d0.get("reservedVramMb").asLong());
        assertEquals(19_000, d0.get("freeVramMb").asLong());
        assertEquals(1, d0.get("jobs").asInt());
    }

    @Test
    void healthDegradesWhenNoDeviceAcceptsWork() throws Exception {
        post("/api/v1/admin/devices/0/quarantine", "{\"reason\": \"driver update\"}");
        post("/api/v1/admin/devices/1/quarantine", "");

        HttpResponse<String> health = get("/api/v1/health");
        assertEquals(503, health.statusCode());
        assertEquals("degraded", json(health).get("status").asText());
    }

    @Test
    void cancelJob() throws Exception {
        String id = submitImage(4_000);

        HttpResponse<String> res = post("/api/v1/jobs/" + id + "/cancel", "");
        assertEquals(200, res.statusCode());
        assertEquals("cancelled_running", json(res).get("result").asText());
        assertTrue(dispatcher.stopped.contains(id));

        assertEquals(409, post("/api/v1/jobs/" + id + "/cancel", "").statusCode());
        assertEquals(404, post("/api/v1/jobs/job-nope/cancel", "").statusCode());
    }

    @Test
    void quarantineMovesWorkAndRestoreReopens() throws Exception {
        String id = submitImage(4_000);

        HttpResponse<String> q = post("/api/v1/admin/devices/0/quarantine", "{\"reason\": \"fan failure\"}");
        assertEquals(200, q.statusCode());
        assertEquals("quarantined", json(q).get("result").asText());
        assertEquals(1, json(get("/api/v1/jobs/" + id)).get("deviceId").asInt());

        JsonNode d0 = json(get("/api/v1/devices")).get("devices").get(0);
        assertFalse(d0.get("healthy").asBoolean());
        assertEquals("fan failure", d0.get("reason").asText());

        assertEquals("already_unhealthy",
                json(post("/api/v1/admin/devices/0/quarantine", "")).get("result").asText());
        assertEquals("restored", json(post("/api/v1/admin/devices/0/restore", "")).get("result").asText());
        assertEquals(404, post("/api/v1/admin/devices/7/restore", "").statusCode());
    }

    @Test
    void removeDevice() throws Exception {
        HttpResponse<String> res = httpClient.send(HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + "/api/v1/admin/devices/1"))
                        .DELETE()
                        .build(),
                HttpResponse.BodyHandlers.ofString());
        assertEquals(200, res.statusCode(), res.body());
        assertEquals("removed", json(res).get("result").asText());

        assertEquals(1, json(get("/api/v1/devices")).get("count").asInt());
        assertEquals(404, post("/internal/v1/metrics",
                "{\"deviceId\": 1, \"utilization\": 1, \"temperature\": 40, \"usedVram\": 0, \"errors\": 0}").statusCode());
    }

    @Test
    void forceRelease() throws Exception {
        String id = submitImage(4_000);

        HttpResponse<String> res = post("/api/v1/admin/jobs/" + id + "/force-release", "");
        assertEquals(200, res.statusCode());
        assertEquals("released", json(res).get("result").asText());

        JsonNode job = json(get("/api/v1/jobs/" + id));
        assertEquals("failed", job.get("state").asText());
        assertEquals("force released by operator", job.get("error").asText());
        assertEquals("not_held", json(post("/api/v1/admin/jobs/" + id + "/force-release", "")).get("result").asText());
    }

    @Test
    void metricsPush() throws Exception {
        HttpResponse<String> ok = post("/internal/v1/metrics",
                "{\"deviceId\": 1, \"utilization\": 64.0, \"temperature\": 71.5, \"usedVram\": 0, \"errors\": 0}");
        assertEquals(200, ok.statusCode(), ok.body());
        assertTrue(json(ok).get("ok").asBoolean());

        JsonNode d1 = json(get("/api/v1/devices")).get("devices").get(1);
        assertEquals(64.0, d1.get("utilization").asDouble());
        assertEquals(71.5, d1.get("temperature").asDouble());

        assertEquals(404, post("/internal/v1/metrics",
                "{\"deviceId\": 9, \"utilization\": 1, \"temperature\": 40, \"usedVram\": 0, \"errors\": 0}").statusCode());
        assertEquals(400, post("/internal/v1/metrics",
                "{\"deviceId\": 1, \"utilization\": 250, \"temperature\": 40, \"usedVram\": 0, \"errors\": 0}").statusCode());
    }

    @Test
    void completionEdgeCases() throws Exception {
        assertEquals(404, post("/internal/v1/jobs/job-nope/complete", "{\"success\": true}").statusCode());

        submitImage(20_000);
        submitImage(20_000);
        String queued = submitImage(20_000);

        HttpResponse<String> res = post("/internal/v1/jobs/" + queued + "/complete", "{\"success\": true}");
        assertEquals(409, res.statusCode());
        assertEquals("not_running", json(res).get("error").asText());

        assertEquals(400, post("/internal/v1/jobs/" + queued + "/complete", "{}").statusCode());
    }

    @Test
    void badRequestsAndUnknownRoutes() throws Exception {
        assertEquals(404, get("/api/v1/nothing").statusCode());
        assertEquals(404, get("/api/v1/jobs/job-missing").statusCode());
        assertEquals(400, post("/api/v1/jobs", "{not json").statusCode());
        assertEquals(400, post("/api/v1/jobs", "").statusCode());
        assertEquals(400, post("/api/v1/jobs", "{\"kind\": \"hologram\"}").statusCode());

        HttpResponse<String> tier = post("/api/v1/jobs", "{\"kind\": \"speech\", \"tier\": \"urgent\"}");
        assertEquals(400, tier.statusCode());
        assertTrue(json(tier).get("error").asText().contains("urgent"));
    }

    @Test
    void oversizedJobIsAcceptedAsFailed() throws Exception {
        HttpResponse<String> res = post("/api/v1/jobs", "{\"kind\": \"video\", \"vramEstimateMb\": 80000}");

        assertEquals(202, res.statusCode());
        assertEquals("failed", json(res).get("state").asText());
        assertTrue(json(res).has("error"));
    }
}
