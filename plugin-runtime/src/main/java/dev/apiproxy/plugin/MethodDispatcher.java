package dev.apiproxy.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.apiproxy.protocol.ErrorKind;
import dev.apiproxy.protocol.PluginProtocolException;
import dev.apiproxy.protocol.RpcError;
import dev.apiproxy.protocol.RpcRequest;
import dev.apiproxy.protocol.RpcResponse;
import dev.apiproxy.protocol.model.ExchangeCodec;
import dev.apiproxy.protocol.model.ProxyResponse;
import dev.apiproxy.protocol.model.RequestOutcome;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a decoded call to the matching hook of one plugin. This is the failure boundary of the
 * runtime: whatever happens below, {@link #dispatch} returns exactly one reply.
 *
 * @param <S> settings type of the plugin
 */
public final class MethodDispatcher<S> {

    private static final Logger LOGGER = LoggerFactory.getLogger(MethodDispatcher.class);

    private static final String STATUS_OK = "ok";

    private final ProxyPlugin<S> plugin;
    private final ExchangeCodec exchangeCodec;

    public MethodDispatcher(ProxyPlugin<S> plugin) {
        this(plugin, new ExchangeCodec());
    }

    public MethodDispatcher(ProxyPlugin<S> plugin, ExchangeCodec exchangeCodec) {
        this.plugin = Objects.requireNonNull(plugin, "plugin");
        this.exchangeCodec = Objects.requireNonNull(exchangeCodec, "exchangeCodec");
    }

    public RpcResponse dispatch(PluginSession<S> session, RpcRequest request) {
        JsonNode id = request.id();
        try {
            HookMethod method = HookMethod.lookup(request.method())
                .orElseThrow(() -> new PluginProtocolException(ErrorKind.METHOD_NOT_FOUND,
                    "Unknown method: " + request.method()));
            requireState(session, method);
            HookCall call = method.bind(request, exchangeCodec);
            return RpcResponse.success(id, invoke(session, call));
        } catch (PluginProtocolException e) {
            LOGGER.warn("{} call {} rejected: {} {}", session.name(), request.method(), e.getKind(), e.getMessage());
            return RpcResponse.failure(id, e.toRpcError());
        } catch (Exception e) {
            LOGGER.error("{} hook {} failed", session.name(), request.method(), e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return RpcResponse.failure(id, RpcError.of(ErrorKind.HANDLER_ERROR, message));
        } catch (StackOverflowError | AssertionError | LinkageError e) {
            // The loop must keep serving; other VirtualMachineErrors still propagate.
            LOGGER.error("{} hook {} failed with {}", session.name(), request.method(), e.getClass().getName(), e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return RpcResponse.failure(id, RpcError.of(ErrorKind.HANDLER_ERROR, message));
        }
    }

    private static void requireState(PluginSession<?> session, HookMethod method) {
        if (method == HookMethod.INIT) {
            session.requireInitAllowed();
        } else if (method.isExchangeHook() || method == HookMethod.SHUTDOWN) {
            session.requireReady();
        }
    }

    private JsonNode invoke(PluginSession<S> session, HookCall call) throws Exception {
        return switch (call.method()) {
            case GET_INFO -> info(session);
            case INIT -> init(session, call.config());
            case ON_REQUEST -> onRequest(session, call);
            case ON_RESPONSE -> response(plugin.onResponse(session.settings(), call.request(), call.response()));
            case ON_CACHE_HIT -> response(plugin.onCacheHit(session.settings(), call.request(), call.response()));
            case SHUTDOWN -> shutdown(session);
        };
    }

    private JsonNode info(PluginSession<S> session) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("name", session.name());
        result.put("version", session.version());
        return result;
    }

    private JsonNode init(PluginSession<S> session, PluginConfig config) throws Exception {
        session.requireInitAllowed();
        S settings = plugin.configure(config);
        session.initialize(config, settings);
        LOGGER.info("Plugin {} {} initialized with keys {}", session.name(), session.version(), config.keys());
        return status(STATUS_OK);
    }

    private JsonNode onRequest(PluginSession<S> session, HookCall call) throws Exception {
        RequestOutcome outcome = plugin.onRequest(session.settings(), call.request());
        if (outcome == null) {
            throw new IllegalStateException("on_request returned no outcome");
        }
        return exchangeCodec.toTree(outcome);
    }

    private JsonNode response(ProxyResponse response) {
        if (response == null) {
            throw new IllegalStateException("hook returned no response");
        }
        return exchangeCodec.toTree(response);
    }

    private JsonNode shutdown(PluginSession<S> session) throws Exception {
        S settings = session.settings();
        try {
            plugin.shutdown(settings);
        } finally {
            session.terminate();
            LOGGER.info("Plugin {} shut down", session.name());
        }
        return status(STATUS_OK);
    }

    private static JsonNode status(String status) {
        return JsonNodeFactory.instance.objectNode().put("status", status);
    }
}
