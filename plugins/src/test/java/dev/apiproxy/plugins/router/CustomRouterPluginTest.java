package dev.apiproxy.plugins.router;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import dev.apiproxy.plugin.PluginConfig;
import dev.apiproxy.protocol.ErrorKind;
import dev.apiproxy.protocol.PluginProtocolException;
import dev.apiproxy.protocol.model.Payload;
import dev.apiproxy.protocol.model.ProxyRequest;
import dev.apiproxy.protocol.model.RequestOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CustomRouterPlugin")
class CustomRouterPluginTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final CustomRouterPlugin plugin = new CustomRouterPlugin();
    private final AtomicReference<String> seenPath = new AtomicReference<>();
    private final AtomicReference<String> seenHeader = new AtomicReference<>();
    private final AtomicReference<String> seenBody = new AtomicReference<>();

    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            seenPath.set(exchange.getRequestURI().getPath());
            seenHeader.set(exchange.getRequestHeaders().getFirst("X-Client"));
            seenBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            boolean binary = exchange.getRequestURI().getPath().endsWith(".bin");
            byte[] body = binary ? new byte[] {1, 2, 3} : "{\"from\":\"custom\"}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", binary ? "application/octet-stream" : "application/json");
            exchange.sendResponseHeaders(201, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private CustomRouterPlugin.Settings configure(String json) throws IOException {
        return plugin.configure(PluginConfig.from(mapper.readTree(json)));
    }

    @Test
    @DisplayName("matching requests are answered by the custom API")
    void routesMatchingRequest() throws Exception {
        CustomRouterPlugin.Settings settings = configure(
            "{\"routes\":{\"/api/custom/*\":\"" + baseUrl + "\"},\"timeout_ms\":5000}");
        ProxyRequest request = ProxyRequest.of("POST", "/api/custom/users")
            .withHeader("X-Client", "test")
            .withBody(Payload.text("{\"q\":1}"));

        RequestOutcome outcome = plugin.onRequest(settings, request);

        assertFalse(outcome.proceed());
        assertEquals("/users", seenPath.get());
        assertEquals("test", seenHeader.get());
        assertEquals("{\"q\":1}", seenBody.get());
        assertEquals(201, outcome.response().statusCode());
        assertEquals("{\"from\":\"custom\"}", outcome.response().body().asText());
        assertFalse(outcome.response().body().isBinary());
        assertEquals("true", outcome.response().metadata().get(CustomRouterPlugin.CUSTOM_API));
        assertEquals("true", outcome.request().metadataValue(CustomRouterPlugin.ROUTED));
        assertEquals("201", outcome.request().metadataValue(CustomRouterPlugin.CUSTOM_STATUS));
    }

    @Test
    @DisplayName("non-text responses come back binary")
    void binaryResponse() throws Exception {
        CustomRouterPlugin.Settings settings = configure("{\"routes\":{\"/files/*\":\"" + baseUrl + "\"}}");

        RequestOutcome outcome = plugin.onRequest(settings, ProxyRequest.of("GET", "/files/blob.bin"));

        assertTrue(outcome.response().body().isBinary());
        assertArrayEquals(new byte[] {1, 2, 3}, outcome.response().body().asBytes());
    }

    @Test
    @DisplayName("unmatched requests proceed untouched")
    void unmatched() throws Exception {
        CustomRouterPlugin.Settings settings = configure("{\"routes\":{\"/api/custom/*\":\"" + baseUrl + "\"}}");
        ProxyRequest request = ProxyRequest.of("GET", "/api/other");

        RequestOutcome outcome = plugin.onRequest(settings, request);

        assertTrue(outcome.proceed());
        assertEquals(request, outcome.request());
        assertNull(seenPath.get());
    }

    @Test
    @DisplayName("defaults to a ten second timeout and no routes")
    void defaults() {
        CustomRouterPlugin.Settings settings = plugin.configure(PluginConfig.empty());

        assertTrue(settings.routes().isEmpty());
        assertEquals(Duration.ofSeconds(10), settings.timeout());
    }

    @Test
    @DisplayName("re-init keeps the HTTP client unless the timeout changes")
    void reinitReusesClient() throws IOException {
        CustomRouterPlugin.Settings first = configure("{\"routes\":{\"/a/*\":\"" + baseUrl + "\"},\"timeout_ms\":500}");
        CustomRouterPlugin.Settings second = configure("{\"routes\":{\"/b/*\":\"" + baseUrl + "\"},\"timeout_ms\":500}");
        CustomRouterPlugin.Settings third = configure("{\"timeout_ms\":800}");

        assertSame(first.client(), second.client());
        assertNotSame(second.client(), third.client());
        assertEquals(Duration.ofMillis(800), third.client().connectTimeout().orElseThrow());
    }

    @Test
    @DisplayName("relative base URLs are rejected at init")
    void rejectsRelativeUrl() {
        PluginProtocolException e = assertThrows(PluginProtocolException.class,
            () -> configure("{\"routes\":{\"/a/*\":\"localhost:9000\"}}"));

        assertEquals(ErrorKind.INVALID_PARAMS, e.getKind());
    }

    @Test
    @DisplayName("an unreachable custom API fails the hook")
    void unreachable() throws Exception {
        CustomRouterPlugin.Settings settings = configure("{\"routes\":{\"/a/*\":\"" + baseUrl + "\"}}");
        server.stop(0);

        assertThrows(IOException.class, () -> plugin.onRequest(settings, ProxyRequest.of("GET", "/a/x")));
    }
}
