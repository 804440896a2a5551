package dev.apiproxy.host;

import dev.apiproxy.host.config.PluginHostProperties;
import java.io.IOException;

/**
 * Opens the channel to a configured plugin.
 */
@FunctionalInterface
public interface PluginLauncher {

    PluginConnection launch(PluginHostProperties.Definition definition) throws IOException;
}
