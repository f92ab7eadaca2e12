package fr.lapetina.tenantserving.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.tenantserving.ServingFactory;
import fr.lapetina.tenantserving.domain.model.AdmissionOutcome;
import fr.lapetina.tenantserving.domain.tenant.TenantState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class HttpServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

    private ServingFactory factory;
    private HttpServer server;

    @BeforeEach
    void setUp() throws Exception {
        factory = ServingFactory.create("test-config.yaml").start();
        server = new HttpServer("127.0.0.1", 0, 16, 2,
                factory.getController(), factory.getMetricsRegistry(), factory.getConfigLoader());
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
        factory.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.getPort() + path);
    }

    @Nested
    @DisplayName("Operational endpoints")
    class Operational {

        @Test
        @DisplayName("should report health with pool and admission state")
        void shouldReportHealth() throws Exception {
            AdmissionOutcome outcome = factory.getController().submit("tenant-a")
                    .outcome().get(5, TimeUnit.SECONDS);

            HttpResponse<String> response = get("/health");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode health = mapper.readTree(response.body());
            assertThat(health.get("status").asText()).isEqualTo("UP");
            assertThat(health.get("plugin").asText()).isEqualTo("multi-tenant-serving");
            assertThat(health.at("/pool/name").asText()).isEqualTo("test-pool");
            assertThat(health.at("/pool/used").asInt()).isEqualTo(1);
            assertThat(health.at("/pool/total").asInt()).isEqualTo(2);
            assertThat(health.at("/admission/activeLeases").asInt()).isEqualTo(1);

            factory.getController().complete(outcome.lease());
        }

        @Test
        @DisplayName("should report DOWN once the pool is closed")
        void shouldReportDown() throws Exception {
            factory.getPool().close();

            HttpResponse<String> response = get("/health");

            assertThat(response.statusCode()).isEqualTo(503);
            assertThat(mapper.readTree(response.body()).get("status").asText()).isEqualTo("DOWN");
        }

        @Test
        @DisplayName("should serve Prometheus metrics")
        void shouldServeMetrics() throws Exception {
            HttpResponse<String> response = get("/metrics");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).contains("test_serving_queue_depth");
            assertThat(response.body()).contains("test_serving_pool_total");
        }

        @Test
        @DisplayName("should refuse writes on health")
        void shouldRefuseWrites() throws Exception {
            assertThat(send("POST", "/health", "{}").statusCode()).isEqualTo(405);
        }
    }

    @Nested
    @DisplayName("Tenant administration")
    class Tenants {

        @Test
        @DisplayName("should list registered tenants")
        void shouldListTenants() throws Exception {
            HttpResponse<String> response = get("/admin/tenants");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode tenants = mapper.readTree(response.body());
            assertThat(tenants).hasSize(2);
            assertThat(tenants.get(0).get("id").asText()).isEqualTo("tenant-a");
            assertThat(tenants.get(0).get("weight").asInt()).isEqualTo(2);
            assertThat(tenants.get(0).get("ratePerSecond").isNull()).isTrue();
            assertThat(tenants.get(1).get("ratePerSecond").asDouble()).isEqualTo(5.0);
        }

        @Test
        @DisplayName("should update a tenant policy")
        void shouldUpdateTenant() throws Exception {
            HttpResponse<String> response = send("PUT", "/admin/tenants/gold",
                    "{\"weight\": 4, \"maxConcurrent\": 9, \"ratePerSecond\": 20, \"burst\": 5}");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode view = mapper.readTree(response.body());
            assertThat(view.get("registered").asBoolean()).isTrue();
            assertThat(view.get("weight").asInt()).isEqualTo(4);
            assertThat(factory.getRegistry().lookup("gold").maxConcurrent()).isEqualTo(9);
            assertThat(factory.getRegistry().lookup("gold").burst()).isEqualTo(5.0);
        }

        @Test
        @DisplayName("should reject invalid policy values")
        void shouldRejectInvalidValues() throws Exception {
            HttpResponse<String> response = send("PUT", "/admin/tenants/gold", "{\"weight\": 0}");

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(mapper.readTree(response.body()).get("error").asText()).isNotBlank();
            assertThat(factory.getRegistry().isRegistered("gold")).isFalse();
        }

        @Test
        @DisplayName("should reject malformed JSON")
        void shouldRejectMalformedJson() throws Exception {
            assertThat(send("PUT", "/admin/tenants/gold", "{weight").statusCode()).isEqualTo(400);
        }

        @Test
        @DisplayName("should look up an unknown tenant without tracking it")
        void shouldNotTrackLookedUpTenant() throws Exception {
            HttpResponse<String> response = get("/admin/tenants/ghost");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode view = mapper.readTree(response.body());
            assertThat(view.get("registered").asBoolean()).isFalse();
            assertThat(view.get("inFlight").asInt()).isZero();
            assertThat(view.get("dispatched").asLong()).isZero();
            assertThat(factory.getRegistry().findState("ghost")).isEmpty();
            assertThat(factory.getRegistry().states())
                    .extracting(TenantState::getTenantId)
                    .doesNotContain("ghost");
        }

        @Test
        @DisplayName("should reject a blank tenant id")
        void shouldRejectBlankTenantId() throws Exception {
            assertThat(get("/admin/tenants/%20").statusCode()).isEqualTo(400);
            assertThat(send("PUT", "/admin/tenants/%20%20", "{\"weight\": 2}").statusCode()).isEqualTo(400);
            assertThat(factory.getRegistry().tenants()).doesNotContainKey(" ");
        }

        @Test
        @DisplayName("should answer 404 for node endpoints on a slot pool")
        void shouldNotListNodes() throws Exception {
            assertThat(get("/admin/nodes").statusCode()).isEqualTo(404);
            assertThat(get("/admin/unknown").statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("should reload configuration on demand")
        void shouldReload() throws Exception {
            HttpResponse<String> response = send("POST", "/admin/reload", null);

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(mapper.readTree(response.body()).get("tenants").asInt()).isEqualTo(2);
        }
    }
}
