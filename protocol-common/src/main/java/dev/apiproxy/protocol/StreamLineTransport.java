package dev.apiproxy.protocol;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;

/**
 * {@link LineTransport} over a pair of byte streams, UTF-8 encoded. Every write is flushed
 * immediately: the peer blocks on each reply, so nothing may linger in a buffer.
 */
public final class StreamLineTransport implements LineTransport {

    private final BufferedReader reader;
    private final BufferedWriter writer;

    public StreamLineTransport(InputStream in, OutputStream out) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    }

    /**
     * Transport over the process standard streams. {@code System.out} is redirected to
     * {@code System.err} afterwards so that stray prints cannot corrupt the protocol channel.
     * @return a transport bound to stdin and the original stdout
     */
    public static StreamLineTransport stdio() {
        OutputStream stdout = new FileOutputStream(FileDescriptor.out);
        System.setOut(System.err);
        return new StreamLineTransport(System.in, stdout);
    }

    @Override
    public String readLine() throws IOException {
        return reader.readLine();
    }

    @Override
    public void writeLine(String line) throws IOException {
        writer.write(line);
        if (!line.endsWith("\n")) {
            writer.write('\n');
        }
        writer.flush();
    }

    @Override
    public void close() throws IOException {
        try {
            writer.close();
        } finally {
            reader.close();
        }
    }
}
