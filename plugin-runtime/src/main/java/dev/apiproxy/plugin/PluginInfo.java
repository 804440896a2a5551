package dev.apiproxy.plugin;

import java.util.Objects;

/**
 * Static identity of a plugin, answered by {@code get_info} in every state.
 *
 * @param name plugin name
 * @param version plugin version
 */
public record PluginInfo(String name, String version) {

    public PluginInfo {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
    }
}
