package dev.apiproxy.plugin;

import dev.apiproxy.protocol.model.ProxyRequest;
import dev.apiproxy.protocol.model.ProxyResponse;

/**
 * A call that passed schema validation, with its parameters decoded. Fields a hook does not take
 * are {@code null}.
 *
 * @param method the hook being called
 * @param config {@code init} configuration
 * @param request exchange request
 * @param response exchange response
 */
public record HookCall(HookMethod method, PluginConfig config, ProxyRequest request, ProxyResponse response) {
}
