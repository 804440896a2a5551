package dev.apiproxy.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import dev.apiproxy.protocol.ErrorKind;
import dev.apiproxy.protocol.PluginProtocolException;
import dev.apiproxy.protocol.RpcRequest;
import dev.apiproxy.protocol.model.ExchangeCodec;
import dev.apiproxy.protocol.model.ProxyRequest;
import dev.apiproxy.protocol.model.ProxyResponse;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The fixed hook table. Each entry declares its wire name and the kind of every required
 * positional parameter; {@link #bind} validates a call against that schema before any hook runs.
 */
public enum HookMethod {

    GET_INFO("get_info", false),
    INIT("init", false, ParamKind.CONFIG),
    ON_REQUEST("on_request", true, ParamKind.REQUEST),
    ON_RESPONSE("on_response", true, ParamKind.REQUEST, ParamKind.RESPONSE),
    ON_CACHE_HIT("on_cache_hit", true, ParamKind.REQUEST, ParamKind.RESPONSE),
    SHUTDOWN("shutdown", false);

    /**
     * Shape of one positional parameter.
     */
    public enum ParamKind {
        /** JSON object, or {@code null} for an empty configuration. */
        CONFIG,
        /** {@link ProxyRequest}, as encoded JSON text or an object. */
        REQUEST,
        /** {@link ProxyResponse}, as encoded JSON text or an object. */
        RESPONSE
    }

    private final String wireName;
    private final boolean exchangeHook;
    private final List<ParamKind> params;

    HookMethod(String wireName, boolean exchangeHook, ParamKind... params) {
        this.wireName = wireName;
        this.exchangeHook = exchangeHook;
        this.params = List.of(params);
    }

    public String wireName() {
        return wireName;
    }

    public int arity() {
        return params.size();
    }

    public List<ParamKind> params() {
        return params;
    }

    /**
     * @return {@code true} for hooks that act on an exchange and therefore need a ready session
     */
    public boolean isExchangeHook() {
        return exchangeHook;
    }

    public static Optional<HookMethod> lookup(String wireName) {
        return Arrays.stream(values()).filter(m -> m.wireName.equals(wireName)).findFirst();
    }

    /**
     * Validate a call against this schema and decode its parameters. Extra parameters are
     * ignored.
     * @param request the decoded call
     * @param exchangeCodec codec for exchange values
     * @return the typed call
     * @throws PluginProtocolException with {@link ErrorKind#INVALID_PARAMS} when a parameter is
     * missing or malformed
     */
    public HookCall bind(RpcRequest request, ExchangeCodec exchangeCodec) {
        if (request.arity() < params.size()) {
            throw new PluginProtocolException(ErrorKind.INVALID_PARAMS,
                wireName + " expects " + params.size() + " param(s), got " + request.arity());
        }
        PluginConfig config = null;
        ProxyRequest proxyRequest = null;
        ProxyResponse proxyResponse = null;
        for (int i = 0; i < params.size(); i++) {
            JsonNode value = request.param(i);
            switch (params.get(i)) {
                case CONFIG -> config = PluginConfig.from(value);
                case REQUEST -> proxyRequest = decode(i, () -> exchangeCodec.decodeRequest(value));
                case RESPONSE -> proxyResponse = decode(i, () -> exchangeCodec.decodeResponse(value));
                default -> throw new IllegalStateException("Unhandled param kind " + params.get(i));
            }
        }
        return new HookCall(this, config, proxyRequest, proxyResponse);
    }

    private <T> T decode(int index, Decoder<T> decoder) {
        try {
            return decoder.decode();
        } catch (IOException e) {
            throw new PluginProtocolException(ErrorKind.INVALID_PARAMS,
                wireName + " param " + index + " is malformed: " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface Decoder<T> {
        T decode() throws IOException;
    }
}
