package dev.apiproxy.plugin;

import dev.apiproxy.protocol.DecodeResult;
import dev.apiproxy.protocol.EnvelopeCodec;
import dev.apiproxy.protocol.LineTransport;
import dev.apiproxy.protocol.RpcResponse;
import dev.apiproxy.protocol.StreamLineTransport;
import dev.apiproxy.protocol.Wire;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plugin side read loop. Reads one call, answers it, and only then reads the next: the host
 * never has more than one call in flight, so the loop and the session it owns are single
 * threaded.
 *
 * @param <S> settings type of the plugin
 */
public final class PluginServer<S> implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginServer.class);

    private final ProxyPlugin<S> plugin;
    private final PluginSession<S> session;
    private final MethodDispatcher<S> dispatcher;
    private final EnvelopeCodec codec;
    private final LineTransport transport;

    public PluginServer(ProxyPlugin<S> plugin, LineTransport transport) {
        this(plugin, transport, new EnvelopeCodec());
    }

    public PluginServer(ProxyPlugin<S> plugin, LineTransport transport, EnvelopeCodec codec) {
        this.plugin = Objects.requireNonNull(plugin, "plugin");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.session = new PluginSession<>(plugin.info());
        this.dispatcher = new MethodDispatcher<>(plugin);
    }

    /**
     * Server bound to the process standard streams.
     * @param plugin the plugin to serve
     * @param <S> settings type of the plugin
     * @return a server reading calls from stdin and replying on stdout
     */
    public static <S> PluginServer<S> stdio(ProxyPlugin<S> plugin) {
        return new PluginServer<>(plugin, StreamLineTransport.stdio());
    }

    /**
     * Serve calls until the host closes the input stream.
     * @throws IOException when the transport fails
     */
    public void run() throws IOException {
        LOGGER.info("Plugin {} {} ready", session.name(), session.version());
        String line;
        while ((line = transport.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            Wire.rx(session.name(), line);
            String reply = codec.encode(handle(line));
            Wire.tx(session.name(), reply);
            transport.writeLine(reply);
        }
        onEndOfInput();
    }

    /**
     * Answer one call line. Never throws.
     * @param line the raw line read from the host
     * @return the reply owed for it
     */
    public RpcResponse handle(String line) {
        DecodeResult decoded = codec.decode(line.trim());
        if (!decoded.isSuccess()) {
            LOGGER.warn("Rejecting undecodable call: {}", decoded.error().message());
            return decoded.toFailureReply();
        }
        return dispatcher.dispatch(session, decoded.request());
    }

    public PluginSession<S> session() {
        return session;
    }

    private void onEndOfInput() {
        if (!session.isReady()) {
            LOGGER.info("Input closed, plugin {} exiting", session.name());
            return;
        }
        LOGGER.warn("Input closed before shutdown, running cleanup for plugin {}", session.name());
        try {
            plugin.shutdown(session.settings());
        } catch (Exception e) {
            LOGGER.error("Cleanup of plugin {} failed", session.name(), e);
        } finally {
            session.terminate();
        }
    }

    @Override
    public void close() throws IOException {
        transport.close();
    }
}
