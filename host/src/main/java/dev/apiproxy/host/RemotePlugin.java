package dev.apiproxy.host;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import dev.apiproxy.protocol.model.ExchangeCodec;
import dev.apiproxy.protocol.model.ProxyRequest;
import dev.apiproxy.protocol.model.ProxyResponse;
import dev.apiproxy.protocol.model.RequestOutcome;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;

/**
 * Typed client for one plugin. Exchange values are sent as encoded JSON text; results are
 * decoded from either text or object form.
 */
public class RemotePlugin implements Closeable {

    public static final String GET_INFO = "get_info";
    public static final String INIT = "init";
    public static final String ON_REQUEST = "on_request";
    public static final String ON_RESPONSE = "on_response";
    public static final String ON_CACHE_HIT = "on_cache_hit";
    public static final String SHUTDOWN = "shutdown";

    private final PluginConnection connection;
    private final Duration callTimeout;
    private final ExchangeCodec exchangeCodec;

    private volatile String name;
    private volatile String version;

    public RemotePlugin(PluginConnection connection, Duration callTimeout) {
        this(connection, callTimeout, new ExchangeCodec());
    }

    public RemotePlugin(PluginConnection connection, Duration callTimeout, ExchangeCodec exchangeCodec) {
        this.connection = connection;
        this.callTimeout = callTimeout;
        this.exchangeCodec = exchangeCodec;
        this.name = connection.name();
    }

    /**
     * @return the name the plugin reported, or the configured name before {@link #describe()}
     */
    public String name() {
        return name;
    }

    public String version() {
        return version;
    }

    public boolean isOpen() {
        return connection.isOpen();
    }

    public void describe() throws PluginCallException {
        JsonNode result = connection.call(GET_INFO, params(), callTimeout);
        if (!result.path("name").isTextual()) {
            throw new PluginCallException(name, GET_INFO, "reply has no name");
        }
        this.name = result.get("name").asText();
        this.version = result.path("version").asText("");
    }

    public void init(JsonNode config) throws PluginCallException {
        JsonNode result = connection.call(INIT, params(config == null ? NullNode.getInstance() : config), callTimeout);
        if (!"ok".equals(result.path("status").asText())) {
            throw new PluginCallException(name, INIT, "unexpected reply " + result);
        }
    }

    public RequestOutcome onRequest(ProxyRequest request) throws PluginCallException {
        JsonNode result = connection.call(ON_REQUEST, params(encode(request)), callTimeout);
        try {
            return exchangeCodec.decodeOutcome(result);
        } catch (IOException e) {
            throw new PluginCallException(name, ON_REQUEST, "malformed outcome: " + e.getMessage(), e);
        }
    }

    public ProxyResponse onResponse(ProxyRequest request, ProxyResponse response) throws PluginCallException {
        return exchange(ON_RESPONSE, request, response);
    }

    public ProxyResponse onCacheHit(ProxyRequest request, ProxyResponse response) throws PluginCallException {
        return exchange(ON_CACHE_HIT, request, response);
    }

    public void shutdown() throws PluginCallException {
        connection.call(SHUTDOWN, params(), callTimeout);
    }

    private ProxyResponse exchange(String method, ProxyRequest request, ProxyResponse response)
            throws PluginCallException {
        JsonNode result = connection.call(method, params(encode(request), encode(response)), callTimeout);
        try {
            return exchangeCodec.decodeResponse(result);
        } catch (IOException e) {
            throw new PluginCallException(name, method, "malformed response: " + e.getMessage(), e);
        }
    }

    private JsonNode encode(ProxyRequest request) {
        return JsonNodeFactory.instance.textNode(exchangeCodec.encodeRequest(request));
    }

    private JsonNode encode(ProxyResponse response) {
        return JsonNodeFactory.instance.textNode(exchangeCodec.encodeResponse(response));
    }

    private static ArrayNode params(JsonNode... values) {
        ArrayNode params = JsonNodeFactory.instance.arrayNode();
        for (JsonNode value : values) {
            params.add(value);
        }
        return params;
    }

    @Override
    public void close() throws IOException {
        connection.close();
    }
}
