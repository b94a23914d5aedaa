package io.voicecast.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prometheus.client.CollectorRegistry;
import io.voicecast.application.service.NotificationQueue;
import io.voicecast.application.service.NotificationService;
import io.voicecast.application.service.NotificationWorker;
import io.voicecast.application.service.ShutdownCoordinator;
import io.voicecast.application.service.ShutdownSignal;
import io.voicecast.application.service.TargetRegistry;
import io.voicecast.domain.model.NotificationRequest;
import io.voicecast.infrastructure.metrics.PrometheusMetricsHandler;
import io.voicecast.infrastructure.metrics.PrometheusNotificationMetrics;
import io.voicecast.support.FakeEndpoint;
import io.voicecast.support.ScriptedMediaSession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static io.voicecast.support.ScriptedMediaSession.playing;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the trigger API over real HTTP.
 */
public class NotificationApiHandlersTest {

    private static final int TEST_PORT = 19184;
    private static final String BASE = "http://localhost:" + TEST_PORT;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final NotificationQueue queue = new NotificationQueue();
    private final TargetRegistry registry = new TargetRegistry();
    private final HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(5))
        .build();
    private ApiServer server;

    private void startServer(String defaultTarget) {
        PrometheusNotificationMetrics metrics = new PrometheusNotificationMetrics(new CollectorRegistry());
        ShutdownCoordinator coordinator = new ShutdownCoordinator(new ShutdownSignal(), queue, Duration.ofSeconds(1));
        NotificationService service = new NotificationService(queue, Mockito.mock(NotificationWorker.class),
            coordinator, metrics, defaultTarget);
        NotificationApiHandlers api = new NotificationApiHandlers(service, registry);

        server = new ApiServer(api.routes(new PrometheusMetricsHandler(metrics.getRegistry())));
        server.start(TEST_PORT, "localhost");
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(BASE + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(BASE + path)).GET().build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void notifyQueuesRequestAndReturns202() throws Exception {
        startServer("");

        HttpResponse<String> response = post("/api/notify", "{\"target\":\"Kitchen\",\"text\":\"Dinner is ready\"}");

        assertEquals(202, response.statusCode());
        assertTrue(MAPPER.readTree(response.body()).path("queued").asBoolean());
        NotificationRequest queued = queue.dequeue(100);
        assertEquals("Kitchen", queued.target());
        assertEquals("Dinner is ready", queued.text());
    }

    @Test
    public void notifyWithoutTargetUsesDefault() throws Exception {
        startServer("Salon");

        assertEquals(202, post("/api/notify", "{\"text\":\"Door open\"}").statusCode());
        assertEquals("Salon", queue.dequeue(100).target());
    }

    @Test
    public void notifyWithoutTargetOrDefaultIs400() throws Exception {
        startServer("");

        HttpResponse<String> response = post("/api/notify", "{\"text\":\"Door open\"}");

        assertEquals(400, response.statusCode());
        assertEquals(0, queue.pendingCount());
    }

    @Test
    public void notifyWithoutTextIs400() throws Exception {
        startServer("Salon");

        assertEquals(400, post("/api/notify", "{\"target\":\"Kitchen\",\"text\":\"  \"}").statusCode());
        assertEquals(400, post("/api/notify", "{\"target\":\"Kitchen\"}").statusCode());
        assertEquals(0, queue.pendingCount());
    }

    @Test
    public void invalidJsonIs400() throws Exception {
        startServer("Salon");

        assertEquals(400, post("/api/notify", "not json").statusCode());
        assertEquals(400, post("/api/notify", "[1,2]").statusCode());
    }

    @Test
    public void closedQueueIs503() throws Exception {
        startServer("Salon");
        queue.close();

        assertEquals(503, post("/api/notify", "{\"target\":\"Kitchen\",\"text\":\"late\"}").statusCode());
    }

    @Test
    public void targetsListsRegistry() throws Exception {
        registry.onEndpointFound(FakeEndpoint.home("k1", "Kitchen", new ScriptedMediaSession(playing(null, null))));
        startServer("");

        HttpResponse<String> response = get("/api/targets");

        assertEquals(200, response.statusCode());
        JsonNode targets = MAPPER.readTree(response.body());
        assertEquals(1, targets.size());
        assertEquals("k1", targets.get(0).path("id").asText());
        assertEquals("Kitchen", targets.get(0).path("name").asText());
        assertEquals("Google Home Mini", targets.get(0).path("model").asText());
        assertTrue(targets.get(0).path("ready").asBoolean());
    }

    @Test
    public void healthReportsPendingCount() throws Exception {
        startServer("Salon");
        post("/api/notify", "{\"text\":\"one\"}");

        JsonNode health = MAPPER.readTree(get("/api/health").body());

        assertEquals("ok", health.path("status").asText());
        assertEquals(1, health.path("pending").asInt());
    }

    @Test
    public void metricsEndpointExposesNotificationMetrics() throws Exception {
        startServer("");

        HttpResponse<String> response = get("/metrics");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("voicecast_queue_depth"));
        assertTrue(response.body().contains("voicecast_notifications"));
    }

    @Test
    public void metricsEndpointFiltersByName() throws Exception {
        startServer("");

        HttpResponse<String> response = get("/metrics?name%5B%5D=voicecast_queue_depth");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("voicecast_queue_depth"));
        assertFalse(response.body().contains("voicecast_media_bytes"));
    }

    @Test
    public void unknownPathIs404AndWrongMethodIs405() throws Exception {
        startServer("");

        assertEquals(404, get("/api/nothing").statusCode());
        assertEquals(405, get("/api/notify").statusCode());
    }
}
