package dev.apiproxy.host;

import dev.apiproxy.protocol.LineTransport;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * In-memory line channel. Closing one end signals end of input to the other.
 */
final class QueueLineTransport implements LineTransport {

    private static final String END = "\u0000end";

    private final BlockingQueue<String> incoming;
    private final BlockingQueue<String> outgoing;
    private volatile boolean closed;

    private QueueLineTransport(BlockingQueue<String> incoming, BlockingQueue<String> outgoing) {
        this.incoming = incoming;
        this.outgoing = outgoing;
    }

    /**
     * @return two connected ends, host first
     */
    static QueueLineTransport[] pair() {
        BlockingQueue<String> toPlugin = new LinkedBlockingQueue<>();
        BlockingQueue<String> toHost = new LinkedBlockingQueue<>();
        return new QueueLineTransport[] {
            new QueueLineTransport(toHost, toPlugin),
            new QueueLineTransport(toPlugin, toHost)
        };
    }

    /**
     * Push a line as if the peer had written it to this end.
     */
    void inject(String line) {
        incoming.add(line);
    }

    /**
     * Take the next line written by this end.
     */
    String takeWritten() throws InterruptedException {
        return outgoing.take();
    }

    @Override
    public String readLine() throws IOException {
        try {
            String line = incoming.take();
            if (END.equals(line)) {
                incoming.add(END);
                return null;
            }
            return line;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("read interrupted");
        }
    }

    @Override
    public void writeLine(String line) throws IOException {
        if (closed) {
            throw new IOException("transport closed");
        }
        outgoing.add(line.endsWith("\n") ? line.substring(0, line.length() - 1) : line);
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            outgoing.add(END);
        }
    }
}
