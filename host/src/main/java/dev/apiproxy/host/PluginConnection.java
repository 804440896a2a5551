package dev.apiproxy.host;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.LongNode;
import dev.apiproxy.protocol.EnvelopeCodec;
import dev.apiproxy.protocol.LineTransport;
import dev.apiproxy.protocol.RpcError;
import dev.apiproxy.protocol.RpcRequest;
import dev.apiproxy.protocol.RpcResponse;
import dev.apiproxy.protocol.Wire;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Host end of one plugin channel. Calls are lock-step: one call is written, then its reply is
 * awaited before the next call may start. The timeout is enforced here; a reply that arrives
 * after its call was abandoned is recognised by id and discarded on the next call.
 */
public class PluginConnection implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginConnection.class);

    private final String name;
    private final LineTransport transport;
    private final Closeable resource;
    private final EnvelopeCodec codec;
    private final AtomicLong requestCounter = new AtomicLong();
    private final ExecutorService readerExecutor;

    private Future<String> pendingRead;
    private volatile boolean open = true;

    /**
     * @param name plugin name used in logs and errors
     * @param transport channel to the plugin
     * @param resource released before the transport on close; it must stop the peer's output so
     * that a pending read returns, as stopping the plugin process does. May be {@code null}
     */
    public PluginConnection(String name, LineTransport transport, Closeable resource) {
        this.name = name;
        this.transport = transport;
        this.resource = resource;
        this.codec = new EnvelopeCodec();
        this.readerExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "plugin-reader-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    public String name() {
        return name;
    }

    public boolean isOpen() {
        return open;
    }

    /**
     * Perform one call and wait for its reply.
     * @param method hook name
     * @param params positional params
     * @param timeout how long to wait for the reply
     * @return the {@code result} member of the reply
     * @throws PluginCallException on an error reply, a timeout or a broken channel
     */
    public synchronized JsonNode call(String method, ArrayNode params, Duration timeout) throws PluginCallException {
        if (!open) {
            throw new PluginCallException(name, method, "connection closed");
        }
        long id = requestCounter.incrementAndGet();
        String line = codec.encodeRequest(new RpcRequest(method, params, LongNode.valueOf(id)));
        try {
            Wire.tx(name, line);
            transport.writeLine(line);
        } catch (IOException e) {
            markBroken();
            throw new PluginCallException(name, method, "write failed", e);
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            String replyLine = awaitLine(method, deadline, timeout);
            Wire.rx(name, replyLine);
            RpcResponse reply;
            try {
                reply = codec.decodeResponse(replyLine);
            } catch (IOException e) {
                throw new PluginCallException(name, method, "malformed reply: " + e.getMessage(), e);
            }
            if (!answers(reply, id)) {
                LOGGER.warn("Discarding stale reply from {} with id {}", name, reply.id());
                continue;
            }
            if (reply.isError()) {
                RpcError error = reply.error();
                throw new PluginCallException(name, method, error.kind(), error.message(), null);
            }
            return reply.result();
        }
    }

    private String awaitLine(String method, long deadline, Duration timeout) throws PluginCallException {
        if (pendingRead == null) {
            pendingRead = readerExecutor.submit(transport::readLine);
        }
        try {
            String line = pendingRead.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            pendingRead = null;
            if (line == null) {
                markBroken();
                throw new PluginCallException(name, method, "plugin closed its output");
            }
            return line;
        } catch (TimeoutException e) {
            // The read stays pending; its line belongs to this call and is discarded later.
            throw new PluginCallException(name, method, "no reply within " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            pendingRead = null;
            markBroken();
            throw new PluginCallException(name, method, "read failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PluginCallException(name, method, "interrupted", e);
        }
    }

    private static boolean answers(RpcResponse reply, long id) {
        JsonNode replyId = reply.id();
        if (replyId == null || replyId.isNull()) {
            // Undecodable calls are answered with a null id; only the current call can be meant.
            return reply.isError();
        }
        if (replyId.isIntegralNumber()) {
            return replyId.canConvertToLong() && replyId.longValue() == id;
        }
        return replyId.isTextual() && replyId.asText().equals(Long.toString(id));
    }

    private void markBroken() {
        if (open) {
            LOGGER.warn("Channel to plugin {} is broken", name);
        }
        open = false;
    }

    @Override
    public void close() throws IOException {
        open = false;
        readerExecutor.shutdownNow();
        try {
            if (resource != null) {
                resource.close();
            }
        } finally {
            try {
                transport.close();
            } catch (IOException e) {
                // Expected when the plugin already exited and left unflushed input behind.
                LOGGER.debug("Closing channel to plugin {} failed: {}", name, e.getMessage());
            }
        }
    }
}
