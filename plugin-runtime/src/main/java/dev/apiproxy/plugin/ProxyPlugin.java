package dev.apiproxy.plugin;

import dev.apiproxy.protocol.model.ProxyRequest;
import dev.apiproxy.protocol.model.ProxyResponse;
import dev.apiproxy.protocol.model.RequestOutcome;

/**
 * Hooks a plugin implements. Hooks never hold state of their own: {@link #configure} turns the
 * {@code init} configuration into a settings value that the session keeps and hands back to
 * every later hook.
 * <p>
 * Any exception a hook throws is reported to the host as an error reply; the process keeps
 * serving.
 *
 * @param <S> validated settings type
 */
public interface ProxyPlugin<S> {

    PluginInfo info();

    /**
     * Validate configuration into settings. Called for every {@code init}; the result replaces
     * the previous settings.
     * @param config configuration sent by the host
     * @return validated settings
     * @throws Exception when the configuration is unusable
     */
    S configure(PluginConfig config) throws Exception;

    /**
     * Called before the host forwards a request upstream or to its cache.
     * @param settings current settings
     * @param request the request as the host or a previous plugin left it
     * @return the request to forward, or a short-circuit carrying the final response
     * @throws Exception on failure
     */
    default RequestOutcome onRequest(S settings, ProxyRequest request) throws Exception {
        return RequestOutcome.proceed(request);
    }

    /**
     * Called with the upstream response of an exchange.
     * @param settings current settings
     * @param request the request as it was forwarded, with its metadata
     * @param response the upstream response
     * @return the response to hand back to the host
     * @throws Exception on failure
     */
    default ProxyResponse onResponse(S settings, ProxyRequest request, ProxyResponse response) throws Exception {
        return response;
    }

    /**
     * Same contract as {@link #onResponse}, for responses served from the host cache.
     */
    default ProxyResponse onCacheHit(S settings, ProxyRequest request, ProxyResponse response) throws Exception {
        return response;
    }

    /**
     * Release plugin owned resources. Called once, when the host shuts the plugin down.
     * @param settings current settings
     * @throws Exception on failure
     */
    default void shutdown(S settings) throws Exception {
    }
}
