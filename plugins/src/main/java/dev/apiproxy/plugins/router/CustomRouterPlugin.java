package dev.apiproxy.plugins.router;

import dev.apiproxy.plugin.PluginConfig;
import dev.apiproxy.plugin.PluginInfo;
import dev.apiproxy.plugin.PluginServer;
import dev.apiproxy.plugin.ProxyPlugin;
import dev.apiproxy.protocol.ErrorKind;
import dev.apiproxy.protocol.PluginProtocolException;
import dev.apiproxy.protocol.model.Payload;
import dev.apiproxy.protocol.model.ProxyRequest;
import dev.apiproxy.protocol.model.ProxyResponse;
import dev.apiproxy.protocol.model.RequestOutcome;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves configured endpoints from custom APIs instead of the default upstream. A matching
 * request is sent to the custom API by the plugin itself and the exchange is short-circuited
 * with that API's response.
 * <p>
 * Example configuration:
 * <pre>
 * {"routes": {"/v1/custom/*": "https://my-api.example.com"}, "timeout_ms": 5000}
 * </pre>
 */
public final class CustomRouterPlugin implements ProxyPlugin<CustomRouterPlugin.Settings> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CustomRouterPlugin.class);

    public static final PluginInfo INFO = new PluginInfo("custom_router", "1.0.0");

    public static final String ROUTED = "routed";
    public static final String CUSTOM_API = "custom_api";
    public static final String CUSTOM_STATUS = "custom_status";

    // Managed by HttpClient itself; setting them is rejected.
    private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host",
        "upgrade");

    /**
     * @param routes routes in configuration order; the first match wins
     * @param timeout per request timeout towards the custom API
     * @param client client used for custom API calls
     */
    public record Settings(List<RoutePattern> routes, Duration timeout, HttpClient client) {

        Optional<RoutePattern> match(String endpoint) {
            return routes.stream().filter(route -> route.matches(endpoint)).findFirst();
        }
    }

    private HttpClient client;
    private Duration clientTimeout;

    @Override
    public PluginInfo info() {
        return INFO;
    }

    @Override
    public Settings configure(PluginConfig config) {
        List<RoutePattern> routes = new ArrayList<>();
        config.getStringMap("routes").forEach((pattern, baseUrl) -> {
            requireAbsoluteUrl(pattern, baseUrl);
            routes.add(new RoutePattern(pattern, baseUrl));
            LOGGER.info("Registered route: {} -> {}", pattern, baseUrl);
        });
        Duration timeout = config.getMillis("timeout_ms", Duration.ofSeconds(10));
        return new Settings(List.copyOf(routes), timeout, clientFor(timeout));
    }

    /**
     * One client per plugin instance; a re-init only replaces it when the timeout changed, and the
     * replaced client is left to the garbage collector.
     */
    synchronized HttpClient clientFor(Duration timeout) {
        if (client == null || !timeout.equals(clientTimeout)) {
            client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
            clientTimeout = timeout;
        }
        return client;
    }

    @Override
    public RequestOutcome onRequest(Settings settings, ProxyRequest request) throws IOException, InterruptedException {
        Optional<RoutePattern> route = settings.match(request.endpoint());
        if (route.isEmpty()) {
            return RequestOutcome.proceed(request);
        }
        String target = route.get().targetUrl(request.endpoint());
        LOGGER.info("Routing {} to custom API: {}", request.endpoint(), target);

        HttpResponse<byte[]> upstream = settings.client().send(buildRequest(settings, request, target),
            HttpResponse.BodyHandlers.ofByteArray());

        Map<String, String> headers = new LinkedHashMap<>();
        upstream.headers().map().forEach((name, values) -> {
            if (!values.isEmpty()) {
                headers.put(name, values.get(0));
            }
        });
        Payload body = isTextual(headers) ? Payload.text(new String(upstream.body(), StandardCharsets.UTF_8))
            : Payload.binary(upstream.body());
        String status = Integer.toString(upstream.statusCode());

        ProxyRequest routed = request.withMetadata(Map.of(ROUTED, "true", CUSTOM_STATUS, status));
        ProxyResponse response = new ProxyResponse(upstream.statusCode(), headers, body, false,
            Map.of(ROUTED, "true", CUSTOM_API, "true"));
        return RequestOutcome.shortCircuit(routed, response);
    }

    @Override
    public void shutdown(Settings settings) {
        LOGGER.info("Shutting down");
    }

    private static void requireAbsoluteUrl(String pattern, String baseUrl) {
        try {
            URI uri = new URI(baseUrl);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new PluginProtocolException(ErrorKind.INVALID_PARAMS,
                    "Route '" + pattern + "' needs an absolute base URL, got '" + baseUrl + "'");
            }
        } catch (URISyntaxException e) {
            throw new PluginProtocolException(ErrorKind.INVALID_PARAMS,
                "Route '" + pattern + "' has a malformed base URL: " + e.getMessage(), e);
        }
    }

    private static HttpRequest buildRequest(Settings settings, ProxyRequest request, String target) {
        HttpRequest.BodyPublisher publisher = request.body().isEmpty()
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofByteArray(request.body().asBytes());
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(target))
            .timeout(settings.timeout())
            .method(request.method().toUpperCase(Locale.ROOT), publisher);
        request.headers().forEach((name, value) -> {
            if (!RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                builder.header(name, value);
            }
        });
        return builder.build();
    }

    private static boolean isTextual(Map<String, String> headers) {
        String contentType = headers.entrySet().stream()
            .filter(e -> e.getKey().equalsIgnoreCase("content-type"))
            .map(Map.Entry::getValue)
            .findFirst()
            .orElse("")
            .toLowerCase(Locale.ROOT);
        return contentType.isEmpty() || contentType.startsWith("text/") || contentType.contains("json")
            || contentType.contains("xml");
    }

    public static void main(String[] args) throws IOException {
        try (PluginServer<Settings> server = PluginServer.stdio(new CustomRouterPlugin())) {
            server.run();
        }
    }
}
