package dev.apiproxy.plugins.logger;

import dev.apiproxy.plugin.PluginConfig;
import dev.apiproxy.plugin.PluginInfo;
import dev.apiproxy.plugin.PluginServer;
import dev.apiproxy.plugin.ProxyPlugin;
import dev.apiproxy.protocol.model.ProxyRequest;
import dev.apiproxy.protocol.model.ProxyResponse;
import dev.apiproxy.protocol.model.RequestOutcome;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs every exchange, tags forwarded requests with a marker header and stamps responses with
 * {@code logged_at}.
 */
public final class RequestLoggerPlugin implements ProxyPlugin<RequestLoggerPlugin.Settings> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RequestLoggerPlugin.class);

    public static final PluginInfo INFO = new PluginInfo("request_logger", "1.0.0");

    public static final String LOGGED_AT = "logged_at";

    private final Clock clock;

    public RequestLoggerPlugin() {
        this(Clock.systemUTC());
    }

    public RequestLoggerPlugin(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param headerName marker header added to forwarded requests
     * @param headerValue value of the marker header
     */
    public record Settings(String headerName, String headerValue) {
    }

    @Override
    public PluginInfo info() {
        return INFO;
    }

    @Override
    public Settings configure(PluginConfig config) {
        Settings settings = new Settings(
            config.getString("header_name", "X-Plugin-Logger"),
            config.getString("header_value", "enabled"));
        LOGGER.info("Initialized with config keys {}", config.keys());
        return settings;
    }

    @Override
    public RequestOutcome onRequest(Settings settings, ProxyRequest request) {
        LOGGER.info("{} request to {} at {}", request.method(), request.endpoint(), Instant.now(clock));
        return RequestOutcome.proceed(request.withHeader(settings.headerName(), settings.headerValue()));
    }

    @Override
    public ProxyResponse onResponse(Settings settings, ProxyRequest request, ProxyResponse response) {
        LOGGER.info("Response from {}: status={}, size={} bytes", request.endpoint(), response.statusCode(),
            response.body().size());
        return response.withMetadata(LOGGED_AT, Instant.now(clock).toString());
    }

    @Override
    public ProxyResponse onCacheHit(Settings settings, ProxyRequest request, ProxyResponse response) {
        LOGGER.info("Cache HIT for {} {}", request.method(), request.endpoint());
        return response;
    }

    @Override
    public void shutdown(Settings settings) {
        LOGGER.info("Shutting down");
    }

    public static void main(String[] args) throws IOException {
        try (PluginServer<Settings> server = PluginServer.stdio(new RequestLoggerPlugin())) {
            server.run();
        }
    }
}
