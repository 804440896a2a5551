package dev.apiproxy.host;

import dev.apiproxy.protocol.ErrorKind;
import java.io.IOException;

/**
 * A plugin call that did not produce a usable result: an error reply, a timeout, a malformed
 * reply or a broken channel.
 */
public class PluginCallException extends IOException {

    private final String plugin;
    private final String method;
    private final ErrorKind kind;

    public PluginCallException(String plugin, String method, String message) {
        this(plugin, method, null, message, null);
    }

    public PluginCallException(String plugin, String method, String message, Throwable cause) {
        this(plugin, method, null, message, cause);
    }

    public PluginCallException(String plugin, String method, ErrorKind kind, String message, Throwable cause) {
        super(plugin + " " + method + ": " + message, cause);
        this.plugin = plugin;
        this.method = method;
        this.kind = kind;
    }

    public String getPlugin() {
        return plugin;
    }

    public String getMethod() {
        return method;
    }

    /**
     * @return the failure kind reported by the plugin, or {@code null} when the call failed on
     * the host side of the channel
     */
    public ErrorKind getKind() {
        return kind;
    }
}
