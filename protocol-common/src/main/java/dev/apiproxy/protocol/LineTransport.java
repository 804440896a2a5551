package dev.apiproxy.protocol;

import java.io.Closeable;
import java.io.IOException;

/**
 * Duplex, line oriented channel between the host and one plugin process.
 */
public interface LineTransport extends Closeable {

    /**
     * Block until the next line is available.
     * @return the line without its terminator, or {@code null} at end of stream
     * @throws IOException when the channel fails
     */
    String readLine() throws IOException;

    /**
     * Write one line and flush it. A trailing newline is added when missing.
     * @param line the line to write
     * @throws IOException when the channel fails
     */
    void writeLine(String line) throws IOException;
}
