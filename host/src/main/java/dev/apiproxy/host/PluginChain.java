package dev.apiproxy.host;

import dev.apiproxy.protocol.model.ProxyRequest;
import dev.apiproxy.protocol.model.ProxyResponse;
import dev.apiproxy.protocol.model.RequestOutcome;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the loaded plugins in configuration order. Each plugin sees the output of the previous
 * one. A plugin whose call fails is skipped for that exchange and the value passes on as it was.
 */
@RequiredArgsConstructor
public class PluginChain {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginChain.class);

    private final List<RemotePlugin> plugins;

    public List<RemotePlugin> plugins() {
        return List.copyOf(plugins);
    }

    /**
     * Pass a request through every plugin until one short-circuits it.
     * @param request the incoming request
     * @return the final request, with a response when a plugin answered it
     */
    public RequestOutcome onRequest(ProxyRequest request) {
        ProxyRequest current = request;
        for (RemotePlugin plugin : plugins) {
            try {
                RequestOutcome outcome = plugin.onRequest(current);
                current = outcome.request();
                if (!outcome.proceed()) {
                    LOGGER.debug("Request {} answered by plugin {}", current.endpoint(), plugin.name());
                    return outcome;
                }
            } catch (PluginCallException e) {
                bypass(plugin, e);
            }
        }
        return RequestOutcome.proceed(current);
    }

    public ProxyResponse onResponse(ProxyRequest request, ProxyResponse response) {
        ProxyResponse current = response;
        for (RemotePlugin plugin : plugins) {
            try {
                current = plugin.onResponse(request, current);
            } catch (PluginCallException e) {
                bypass(plugin, e);
            }
        }
        return current;
    }

    public ProxyResponse onCacheHit(ProxyRequest request, ProxyResponse response) {
        ProxyResponse current = response;
        for (RemotePlugin plugin : plugins) {
            try {
                current = plugin.onCacheHit(request, current);
            } catch (PluginCallException e) {
                bypass(plugin, e);
            }
        }
        return current;
    }

    private static void bypass(RemotePlugin plugin, PluginCallException e) {
        LOGGER.warn("Skipping plugin {} for this exchange: {}", plugin.name(), e.getMessage());
    }
}
