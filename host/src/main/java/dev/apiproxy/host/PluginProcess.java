package dev.apiproxy.host;

import dev.apiproxy.protocol.StreamLineTransport;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A plugin running as a child process. Its stdin and stdout carry the protocol; its stderr is
 * forwarded line by line to the host log.
 */
public class PluginProcess implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginProcess.class);

    private final String name;
    private final Process process;
    private final Duration exitGrace;
    private final Thread stderrDrain;

    private PluginProcess(String name, Process process, Duration exitGrace) {
        this.name = name;
        this.process = process;
        this.exitGrace = exitGrace;
        this.stderrDrain = new Thread(this::drainStderr, "plugin-stderr-" + name);
        this.stderrDrain.setDaemon(true);
        this.stderrDrain.start();
    }

    /**
     * Start the plugin and open a connection to it.
     * @param name plugin name used in logs
     * @param command executable and arguments
     * @param environment extra environment variables for the child
     * @param exitGrace how long to wait for a voluntary exit on close
     * @return a connection that stops the process when closed
     * @throws IOException when the process cannot be started
     */
    public static PluginConnection launch(String name, List<String> command, Map<String, String> environment,
            Duration exitGrace) throws IOException {
        if (command == null || command.isEmpty()) {
            throw new IOException("No command configured for plugin " + name);
        }
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.environment().putAll(environment);
        builder.redirectErrorStream(false);
        Process process = builder.start();
        LOGGER.info("Started plugin {} (pid {}): {}", name, process.pid(), String.join(" ", command));
        PluginProcess handle = new PluginProcess(name, process, exitGrace);
        StreamLineTransport transport = new StreamLineTransport(process.getInputStream(), process.getOutputStream());
        return new PluginConnection(name, transport, handle);
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    private void drainStderr() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                LOGGER.info("[{}] {}", name, line);
            }
        } catch (IOException e) {
            LOGGER.debug("stderr of plugin {} closed: {}", name, e.getMessage());
        }
    }

    /**
     * Close the plugin's stdin, wait for it to exit on its own, then destroy it.
     */
    @Override
    public void close() {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            LOGGER.debug("stdin of plugin {} already closed: {}", name, e.getMessage());
        }
        try {
            if (!process.waitFor(exitGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Plugin {} did not exit within {} ms, destroying", name, exitGrace.toMillis());
                process.destroy();
                if (!process.waitFor(exitGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        if (!process.isAlive()) {
            LOGGER.info("Plugin {} exited with status {}", name, process.exitValue());
        }
    }
}
