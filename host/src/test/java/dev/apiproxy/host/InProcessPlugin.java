package dev.apiproxy.host;

import dev.apiproxy.plugin.PluginServer;
import dev.apiproxy.plugin.ProxyPlugin;

import java.io.IOException;

/**
 * Runs a plugin server on a background thread behind a {@link PluginConnection}.
 */
final class InProcessPlugin {

    private InProcessPlugin() {
    }

    static PluginConnection start(String name, ProxyPlugin<?> plugin) {
        QueueLineTransport[] ends = QueueLineTransport.pair();
        PluginServer<?> server = new PluginServer<>(plugin, ends[1]);
        Thread thread = new Thread(() -> {
            try {
                server.run();
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }, "in-process-" + name);
        thread.setDaemon(true);
        thread.start();
        return new PluginConnection(name, ends[0], () -> {
            ends[0].close();
            try {
                thread.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
    }
}
