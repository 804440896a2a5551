package dev.apiproxy.host;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.apiproxy.host.config.PluginHostProperties;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the plugin lifecycle: launch, handshake and initialise on start, shut down and release on
 * stop. A plugin that fails to start is logged and left out of the chain.
 */
@RequiredArgsConstructor
public class PluginManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginManager.class);

    private final PluginHostProperties properties;
    private final PluginLauncher launcher;
    private final ObjectMapper mapper;

    private final List<RemotePlugin> loaded = new ArrayList<>();
    private volatile PluginChain chain = new PluginChain(List.of());

    public synchronized void start() {
        if (!properties.isEnabled()) {
            LOGGER.info("Plugins disabled");
            return;
        }
        for (PluginHostProperties.Definition definition : properties.getDefinitions()) {
            if (!definition.isEnabled()) {
                LOGGER.info("Plugin {} is disabled", definition.getName());
                continue;
            }
            RemotePlugin plugin = load(definition);
            if (plugin != null) {
                loaded.add(plugin);
            }
        }
        chain = new PluginChain(List.copyOf(loaded));
        LOGGER.info("Loaded {} plugin(s)", loaded.size());
    }

    private RemotePlugin load(PluginHostProperties.Definition definition) {
        PluginConnection connection;
        try {
            connection = launcher.launch(definition);
        } catch (IOException e) {
            LOGGER.error("Failed to launch plugin {}", definition.getName(), e);
            return null;
        }
        RemotePlugin plugin = new RemotePlugin(connection, definition.effectiveCallTimeout(properties.getCallTimeout()));
        try {
            plugin.describe();
            JsonNode config = mapper.valueToTree(definition.getConfig());
            plugin.init(config);
            LOGGER.info("Plugin {} {} ready", plugin.name(), plugin.version());
            return plugin;
        } catch (PluginCallException e) {
            LOGGER.error("Plugin {} failed to initialise: {}", definition.getName(), e.getMessage());
            release(plugin);
            return null;
        }
    }

    public PluginChain chain() {
        return chain;
    }

    public synchronized void stop() {
        chain = new PluginChain(List.of());
        for (RemotePlugin plugin : loaded) {
            if (plugin.isOpen()) {
                try {
                    plugin.shutdown();
                } catch (PluginCallException e) {
                    LOGGER.warn("Plugin {} did not shut down cleanly: {}", plugin.name(), e.getMessage());
                }
            }
            release(plugin);
        }
        loaded.clear();
    }

    private static void release(RemotePlugin plugin) {
        try {
            plugin.close();
        } catch (IOException e) {
            LOGGER.warn("Error closing plugin {}", plugin.name(), e);
        }
    }
}
